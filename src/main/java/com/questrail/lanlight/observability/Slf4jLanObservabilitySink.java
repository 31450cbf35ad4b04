package com.questrail.lanlight.observability;

import com.questrail.lanlight.api.CommandOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of LanObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jLanObservabilitySink implements LanObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jLanObservabilitySink.class);

    @Override
    public void onCommandFinished(CommandFinishedEvent event) {
        if (event.outcome() == CommandOutcome.EXHAUSTED) {
            log.info("Command {} for {} not confirmed after {} sends",
                event.kind(), event.fingerprint(), event.sends());
        } else {
            log.debug("Command {} for {}: {} after {} sends",
                event.kind(), event.fingerprint(), event.outcome(), event.sends());
        }
    }

    @Override
    public void onTransportEvent(TransportEvent event) {
        if (event.up()) {
            log.info("Transport up on {}", event.localAddress());
        } else if (event.cause() != null) {
            log.warn("Transport down on {}", event.localAddress(), event.cause());
        } else {
            log.info("Transport down on {}", event.localAddress());
        }
    }

    @Override
    public void onError(LanErrorEvent event) {
        log.error("LAN control error: {}", event.message(), event.cause());
    }
}
