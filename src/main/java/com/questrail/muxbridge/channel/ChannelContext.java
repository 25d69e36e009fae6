package com.questrail.muxbridge.channel;

import com.questrail.muxbridge.bus.InternalBus;
import com.questrail.muxbridge.observability.BridgeObservabilitySink;

import java.util.Objects;

/**
 * What an endpoint is given when it is created.
 *
 * @param request the decoded {@code open} request
 * @param gate    the channel's outbound gate to the front end
 * @param bus     the session's internal bus
 * @param sink    observability sink for lifecycle transitions
 */
public record ChannelContext(ChannelOpenRequest request,
                             FlowControlGate gate,
                             InternalBus bus,
                             BridgeObservabilitySink sink)
{
    public ChannelContext {
        Objects.requireNonNull(request, "request");
        Objects.requireNonNull(gate, "gate");
        Objects.requireNonNull(bus, "bus");
        Objects.requireNonNull(sink, "sink");
    }
}
