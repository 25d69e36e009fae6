package com.questrail.muxbridge.observability;

/**
 * Main interface for receiving bridge observability events.
 * Implementations can provide logging, metrics, or tracing.
 */
public interface BridgeObservabilitySink {
    /**
     * Called when a channel moves between lifecycle states.
     * @param event the transition details
     */
    void onChannelTransition(ChannelTransitionEvent event);

    /**
     * Called when the superuser state ({@code Current}) changes.
     * @param event the transition details
     */
    void onSuperuserTransition(SuperuserTransitionEvent event);

    /**
     * Called for notable protocol-level occurrences (dropped frames, peer chatter).
     * @param event the protocol event
     */
    void onProtocolEvent(BridgeProtocolEvent event);

    /**
     * Called when an error or anomaly occurs.
     * @param event the error event
     */
    void onError(BridgeErrorEvent event);
}
