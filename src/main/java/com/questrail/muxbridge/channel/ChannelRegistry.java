package com.questrail.muxbridge.channel;

import com.questrail.muxbridge.bus.InternalBus;
import com.questrail.muxbridge.codec.Frame;
import com.questrail.muxbridge.observability.BridgeErrorEvent;
import com.questrail.muxbridge.observability.BridgeObservabilitySink;
import com.questrail.muxbridge.observability.ChannelTransitionEvent;
import com.questrail.muxbridge.protocol.ControlMessages;
import com.questrail.muxbridge.protocol.Problem;
import com.questrail.muxbridge.protocol.ProtocolException;
import com.questrail.muxbridge.transport.FrameSink;
import com.questrail.muxbridge.util.Jsons;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * ChannelRegistry
 * =============================================================================
 * The set of open channels, keyed by id.
 *
 * <p>A channel is registered for as long as its id is in use: from a
 * successful {@code open} until its {@code close} has actually been written to
 * the front end. A failed open is answered with {@code close} directly and is
 * never registered.</p>
 *
 * <p>Not thread-safe; owned by the driver thread.</p>
 */
public final class ChannelRegistry
{
    private final Map<String, ChannelEndpoint> channels = new LinkedHashMap<>();

    private final FrameSink frontEnd;
    private final InternalBus bus;
    private final BridgeObservabilitySink sink;

    public ChannelRegistry(FrameSink frontEnd, InternalBus bus, BridgeObservabilitySink sink)
    {
        this.frontEnd = Objects.requireNonNull(frontEnd, "frontEnd");
        this.bus = Objects.requireNonNull(bus, "bus");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * Creates, registers and starts the endpoint for {@code request}.
     *
     * @return the endpoint, or empty if it failed to open; the failure has
     *         already been reported to the front end
     * @throws ProtocolException if the channel id is already in use
     */
    public Optional<ChannelEndpoint> open(ChannelOpenRequest request, ChannelFactory factory)
    {
        String id = request.channel();
        if (channels.containsKey(id)) {
            throw new ProtocolException("channel " + id + " is already open");
        }

        FlowControlGate gate = new FlowControlGate(id, frontEnd, () -> release(id));
        ChannelContext context = new ChannelContext(request, gate, bus, sink);

        try {
            ChannelEndpoint endpoint = factory.create(context);
            channels.put(id, endpoint);
            endpoint.open();
            return Optional.of(endpoint);
        } catch (ChannelOpenException e) {
            channels.remove(id);
            reject(request, e.problem(), e.getMessage());
        } catch (RuntimeException e) {
            if (e instanceof ProtocolException) {
                throw e;
            }
            sink.onError(new BridgeErrorEvent(Instant.now(), "Failed to open channel " + id, e));
            channels.remove(id);
            reject(request, Problem.INTERNAL_ERROR, null);
        }
        return Optional.empty();
    }

    /**
     * Answers {@code open} with a failing {@code close} without registering anything.
     */
    public void reject(ChannelOpenRequest request, String problem, String message)
    {
        frontEnd.send(Frame.control(Jsons.toBytes(
                ControlMessages.close(request.channel(), problem, message))));
        sink.onChannelTransition(new ChannelTransitionEvent(Instant.now(), request.channel(),
                request.payload(), ChannelState.OPENING, ChannelState.CLOSED, problem));
    }

    public Optional<ChannelEndpoint> find(String id)
    {
        return Optional.ofNullable(channels.get(id));
    }

    public boolean contains(String id)
    {
        return channels.containsKey(id);
    }

    public int size()
    {
        return channels.size();
    }

    /**
     * Frees {@code id}. Releasing an id that is not registered does nothing.
     */
    public void release(String id)
    {
        channels.remove(id);
    }

    /**
     * Open channels in the order they were opened.
     */
    public List<ChannelEndpoint> snapshot()
    {
        return new ArrayList<>(channels.values());
    }

    public List<ChannelEndpoint> matching(Predicate<ChannelEndpoint> filter)
    {
        List<ChannelEndpoint> result = new ArrayList<>();
        for (ChannelEndpoint endpoint : channels.values()) {
            if (filter.test(endpoint)) {
                result.add(endpoint);
            }
        }
        return result;
    }

    /**
     * Drops every channel without writing anything.
     */
    public void abandonAll()
    {
        for (ChannelEndpoint endpoint : snapshot()) {
            endpoint.abandon();
        }
        channels.clear();
    }
}
