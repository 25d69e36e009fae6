package com.questrail.muxbridge.observability;

/**
 * No-op implementation of BridgeObservabilitySink.
 */
public final class NullObservabilitySink implements BridgeObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onChannelTransition(ChannelTransitionEvent event) {}

    @Override
    public void onSuperuserTransition(SuperuserTransitionEvent event) {}

    @Override
    public void onProtocolEvent(BridgeProtocolEvent event) {}

    @Override
    public void onError(BridgeErrorEvent event) {}
}
