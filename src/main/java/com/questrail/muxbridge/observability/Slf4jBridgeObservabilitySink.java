package com.questrail.muxbridge.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of BridgeObservabilitySink that emits logs via SLF4J.
 */
public final class Slf4jBridgeObservabilitySink implements BridgeObservabilitySink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jBridgeObservabilitySink.class);

    @Override
    public void onChannelTransition(ChannelTransitionEvent event) {
        if (event.problem() != null) {
            log.info("Channel {} ({}): {} -> {} problem={}",
                event.channel(), event.payload(), event.from(), event.to(), event.problem());
        } else {
            log.debug("Channel {} ({}): {} -> {}",
                event.channel(), event.payload(), event.from(), event.to());
        }
    }

    @Override
    public void onSuperuserTransition(SuperuserTransitionEvent event) {
        log.info("Superuser: {} -> {}", event.from(), event.to());
    }

    @Override
    public void onProtocolEvent(BridgeProtocolEvent event) {
        log.debug("Bridge Protocol Event: {}", event.description());
    }

    @Override
    public void onError(BridgeErrorEvent event) {
        log.error("Bridge Error: {}", event.message(), event.cause());
    }
}
