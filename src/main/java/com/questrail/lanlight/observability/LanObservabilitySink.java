package com.questrail.lanlight.observability;

/**
 * Receives runtime events of the control plane.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks are invoked on the controller's scheduler thread and must not block.</p>
 */
public interface LanObservabilitySink {
    /**
     * Called when a command sequence ends, whatever the outcome.
     * @param event the outcome details
     */
    void onCommandFinished(CommandFinishedEvent event);

    /**
     * Called when a transport endpoint comes up or goes down.
     * @param event the transport event
     */
    void onTransportEvent(TransportEvent event);

    /**
     * Called when a scheduled task fails unexpectedly.
     * @param event the error event
     */
    void onError(LanErrorEvent event);
}
