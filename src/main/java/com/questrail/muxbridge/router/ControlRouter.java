package com.questrail.muxbridge.router;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.muxbridge.channel.ChannelEndpoint;
import com.questrail.muxbridge.channel.ChannelFactory;
import com.questrail.muxbridge.channel.ChannelOpenRequest;
import com.questrail.muxbridge.channel.ChannelRegistry;
import com.questrail.muxbridge.channel.ChannelTypeRegistry;
import com.questrail.muxbridge.channel.SuperuserMode;
import com.questrail.muxbridge.codec.Frame;
import com.questrail.muxbridge.observability.BridgeObservabilitySink;
import com.questrail.muxbridge.observability.BridgeProtocolEvent;
import com.questrail.muxbridge.protocol.Command;
import com.questrail.muxbridge.protocol.ControlMessages;
import com.questrail.muxbridge.protocol.Problem;
import com.questrail.muxbridge.protocol.ProtocolException;
import com.questrail.muxbridge.superuser.SuperuserRule;
import com.questrail.muxbridge.transport.FrameSink;
import com.questrail.muxbridge.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * ControlRouter
 * =============================================================================
 * Dispatches every frame received from the front end.
 *
 * <h2>Responsibilities</h2>
 * <ul>
 *   <li>Data frames go to the addressed channel, or are dropped when the
 *       channel is unknown.</li>
 *   <li>Control frames are decoded and dispatched by {@code command}. The
 *       front end must send {@code init} first.</li>
 *   <li>{@code open} checks the host, then superuser routing, then the
 *       payload type. A host failure is always reported as {@code no-host},
 *       even when superuser routing would also fail.</li>
 * </ul>
 *
 * <p>Anything the session cannot survive (unparseable control message,
 * unknown command, duplicate channel id, commands before {@code init})
 * raises {@link ProtocolException}.</p>
 */
public final class ControlRouter
{
    public static final String LOCALHOST = "localhost";

    private static final Logger log = LoggerFactory.getLogger(ControlRouter.class);

    private final ChannelRegistry registry;
    private final ChannelTypeRegistry types;
    private final SuperuserRule superuser;
    private final FrameSink frontEnd;
    private final BridgeObservabilitySink sink;

    private boolean initialized;
    private String host = LOCALHOST;

    public ControlRouter(ChannelRegistry registry,
                         ChannelTypeRegistry types,
                         SuperuserRule superuser,
                         FrameSink frontEnd,
                         BridgeObservabilitySink sink)
    {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.types = Objects.requireNonNull(types, "types");
        this.superuser = Objects.requireNonNull(superuser, "superuser");
        this.frontEnd = Objects.requireNonNull(frontEnd, "frontEnd");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public boolean isInitialized()
    {
        return initialized;
    }

    /** Host name the front end knows this machine by. */
    public String host()
    {
        return host;
    }

    public void route(Frame frame)
    {
        if (!frame.isControl()) {
            routeData(frame);
            return;
        }

        ObjectNode message;
        try {
            message = Jsons.parseObject(frame.payload());
        } catch (IOException e) {
            throw new ProtocolException("invalid control message", e);
        }

        String name = Jsons.text(message, "command");
        Command command = Command.fromWireName(name)
                .orElseThrow(() -> new ProtocolException("unknown command: " + name));
        if (!initialized && command != Command.INIT) {
            throw new ProtocolException("expected init, received " + name);
        }

        switch (command) {
            case INIT:
                handleInit(message);
                break;
            case OPEN:
                handleOpen(message);
                break;
            case DONE:
                channelFor(message).ifPresent(ChannelEndpoint::receiveDone);
                break;
            case CLOSE:
                channelFor(message).ifPresent(ch -> ch.receiveClose(Jsons.text(message, "problem")));
                break;
            case PING:
                handlePing(message);
                break;
            case KILL:
                handleKill(message);
                break;
            case AUTHORIZE:
                superuser.authorize(message);
                break;
            case PONG:
            case READY:
            case SUPERUSER_INIT_DONE:
            default:
                log.debug("Ignoring {} from the front end", name);
                break;
        }
    }

    private void routeData(Frame frame)
    {
        if (!initialized) {
            throw new ProtocolException("data received before init");
        }
        Optional<ChannelEndpoint> channel = registry.find(frame.channel());
        if (channel.isPresent()) {
            channel.get().receiveData(frame.payload());
        }
        else {
            log.debug("Dropping {} bytes for unknown channel {}", frame.payload().length, frame.channel());
        }
    }

    private void handleInit(ObjectNode message)
    {
        if (initialized) {
            throw new ProtocolException("duplicate init");
        }
        int version = message.path("version").asInt(-1);
        if (version != ControlMessages.PROTOCOL_VERSION) {
            throw new ProtocolException("unsupported protocol version " + message.get("version"));
        }
        String requestedHost = Jsons.text(message, "host");
        if (requestedHost != null && !requestedHost.isEmpty()) {
            host = requestedHost;
        }
        initialized = true;
        sink.onProtocolEvent(new BridgeProtocolEvent(Instant.now(), "Session initialized for host " + host));

        String label = superuserAtInit(message.get("superuser"));
        if (label != null) {
            superuser.startAtInit(label);
        }
    }

    private static String superuserAtInit(JsonNode value)
    {
        if (value == null || !value.isObject()) {
            return null;
        }
        String id = Jsons.text(value, "id");
        return id == null || SuperuserRule.NONE.equals(id) ? null : id;
    }

    private void handleOpen(ObjectNode message)
    {
        ChannelOpenRequest request = ChannelOpenRequest.fromMessage(message);
        if (registry.contains(request.channel())) {
            throw new ProtocolException("channel " + request.channel() + " is already open");
        }

        if (!isLocal(request.host())) {
            registry.reject(request, Problem.NO_HOST, null);
            return;
        }

        if (request.superuser() != SuperuserMode.NONE && !superuser.isPrivileged()) {
            if (superuser.isRunning()) {
                superuser.openRouted(request);
                return;
            }
            if (request.superuser() == SuperuserMode.REQUIRE) {
                registry.reject(request, Problem.ACCESS_DENIED, null);
                return;
            }
        }

        if (request.payload() == null) {
            registry.reject(request, Problem.PROTOCOL_ERROR, "open is missing a payload type");
            return;
        }
        Optional<ChannelFactory> factory = types.find(request.payload());
        if (factory.isEmpty()) {
            registry.reject(request, Problem.NOT_SUPPORTED, "Unsupported channel type " + request.payload());
            return;
        }
        registry.open(request, factory.get());
    }

    private boolean isLocal(String requested)
    {
        return requested == null || requested.equals(host) || requested.equals(LOCALHOST);
    }

    private void handlePing(ObjectNode message)
    {
        String channel = Jsons.text(message, "channel");
        if (channel != null) {
            registry.find(channel).ifPresent(ch -> ch.receivePing(message));
            return;
        }
        ObjectNode pong = message.deepCopy();
        pong.put("command", Command.PONG.wireName());
        frontEnd.send(Frame.control(Jsons.toBytes(pong)));
    }

    private void handleKill(ObjectNode message)
    {
        String group = Jsons.text(message, "group");
        for (ChannelEndpoint channel : registry.matching(ch -> group == null || group.equals(ch.group()))) {
            channel.close(Problem.TERMINATED);
        }
    }

    private Optional<ChannelEndpoint> channelFor(ObjectNode message)
    {
        String channel = Jsons.text(message, "channel");
        return channel == null ? Optional.empty() : registry.find(channel);
    }
}
