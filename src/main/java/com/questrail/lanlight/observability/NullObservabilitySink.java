package com.questrail.lanlight.observability;

/**
 * No-op implementation of LanObservabilitySink.
 */
public final class NullObservabilitySink implements LanObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onCommandFinished(CommandFinishedEvent event) {}

    @Override
    public void onTransportEvent(TransportEvent event) {}

    @Override
    public void onError(LanErrorEvent event) {}
}
