package com.questrail.muxbridge.superuser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.questrail.muxbridge.bus.BusCall;
import com.questrail.muxbridge.bus.BusError;
import com.questrail.muxbridge.bus.BusInterface;
import com.questrail.muxbridge.bus.BusObject;
import com.questrail.muxbridge.bus.Signatures;
import com.questrail.muxbridge.channel.ChannelEndpoint;
import com.questrail.muxbridge.channel.ChannelOpenRequest;
import com.questrail.muxbridge.channel.ChannelRegistry;
import com.questrail.muxbridge.codec.Frame;
import com.questrail.muxbridge.config.BridgeRuntimeConfig;
import com.questrail.muxbridge.config.SuperuserBridgeConfig;
import com.questrail.muxbridge.internal.events.BridgeEvent;
import com.questrail.muxbridge.internal.events.PeerEvent;
import com.questrail.muxbridge.observability.BridgeObservabilitySink;
import com.questrail.muxbridge.observability.BridgeProtocolEvent;
import com.questrail.muxbridge.observability.SuperuserTransitionEvent;
import com.questrail.muxbridge.protocol.Command;
import com.questrail.muxbridge.protocol.ControlMessages;
import com.questrail.muxbridge.transport.FrameSink;
import com.questrail.muxbridge.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * SuperuserRule
 * =============================================================================
 * The superuser elevation state machine, exported as {@code /superuser}.
 *
 * <pre>
 *   none ──Start──▶ init ──peer init──▶ &lt;label&gt; ──Stop / peer exit──▶ none
 *                    │
 *                    └──peer rejects / exits──▶ none
 * </pre>
 *
 * <p>A privileged bridge is permanently {@code root}: it has no peers and
 * opens superuser channels itself.</p>
 *
 * <h2>Elevation</h2>
 * Elevation is started either by the {@code Start} bus method or by the
 * front end's {@code init} ({@code superuser: {"id": label}}). Credential
 * prompts from the peer go back the same way: as a {@code Prompt} signal,
 * or as an {@code authorize} challenge on the control channel. While the
 * peer negotiates, every other channel keeps running.
 *
 * <h2>Stopping</h2>
 * {@code Stop}, peer exit and failed elevation close every routed channel
 * before anything else is reported. Those closes still pass through each
 * channel's {@link com.questrail.muxbridge.channel.FlowControlGate}: a frozen
 * routed channel holds its {@code close} until it is thawed, so the
 * {@code Stop} reply can reach the front end first.
 *
 * <h2>Threading</h2>
 * Driver thread only. Peer output arrives as {@link PeerEvent}s.
 */
public final class SuperuserRule extends BusObject
{
    public static final String PATH = "/superuser";
    public static final String INTERFACE = "cockpit.Superuser";
    public static final String ERROR = "cockpit.Superuser.Error";

    public static final String NONE = "none";
    public static final String INIT = "init";
    public static final String ROOT = "root";

    private static final Logger log = LoggerFactory.getLogger(SuperuserRule.class);

    private final Map<String, SuperuserBridgeConfig> configs = new LinkedHashMap<>();
    private final boolean privileged;
    private final Map<String, String> environment;
    private final PeerLauncher launcher;
    private final FrameSink frontEnd;
    private final ChannelRegistry registry;
    private final Consumer<BridgeEvent> events;
    private final BridgeObservabilitySink sink;
    private final BusInterface descriptor;

    private String current;
    private PeerBridge peer;
    private Elevation elevation;

    public SuperuserRule(BridgeRuntimeConfig config,
                         PeerLauncher launcher,
                         FrameSink frontEnd,
                         ChannelRegistry registry,
                         Consumer<BridgeEvent> events,
                         BridgeObservabilitySink sink)
    {
        for (SuperuserBridgeConfig bridge : config.superuserBridges()) {
            configs.put(bridge.label(), bridge);
        }
        this.privileged = config.privileged();
        this.environment = config.environment();
        this.launcher = Objects.requireNonNull(launcher, "launcher");
        this.frontEnd = Objects.requireNonNull(frontEnd, "frontEnd");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.events = Objects.requireNonNull(events, "events");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.current = privileged ? ROOT : NONE;

        this.descriptor = BusInterface.builder(INTERFACE)
                .method("Start", List.of("s"), List.of(), this::start)
                .method("Stop", List.of(), List.of(), this::stop)
                .method("Answer", List.of("s"), List.of(), this::answer)
                .property("Bridges", "as", this::bridges)
                .property("Current", "s", () -> TextNode.valueOf(current))
                .property("Methods", "a{sv}", this::methods)
                .signal("Prompt", "s", "s", "s", "b", "s")
                .build();
    }

    @Override
    protected List<BusInterface> interfaces()
    {
        return List.of(descriptor);
    }

    public String current()
    {
        return current;
    }

    /**
     * Whether superuser channels can be routed to a peer right now.
     */
    public boolean isRunning()
    {
        return peer != null && peer.isInitialized();
    }

    public boolean isPrivileged()
    {
        return privileged;
    }

    // ---------------------------------------------------------------------
    // Bus methods
    // ---------------------------------------------------------------------

    private void start(ArrayNode args, BusCall call) throws BusError
    {
        String label = args.get(0).asText();
        if (privileged) {
            throw new BusError(ERROR, "Already running with administrative privileges");
        }
        if (peer != null) {
            throw new BusError(ERROR, INIT.equals(current)
                    ? "A superuser bridge is already starting"
                    : "A superuser bridge is already running");
        }
        SuperuserBridgeConfig config = configs.get(label);
        if (config == null) {
            throw new BusError(ERROR, "Unknown superuser bridge type");
        }
        begin(config, new BusElevation(call));
    }

    private void stop(ArrayNode args, BusCall call) throws BusError
    {
        if (INIT.equals(current)) {
            throw new BusError(ERROR, "The superuser bridge is still starting");
        }
        if (peer != null) {
            teardown();
        }
        call.reply();
    }

    private void answer(ArrayNode args, BusCall call) throws BusError
    {
        if (!(elevation instanceof BusElevation) || elevation.pendingCookie() == null) {
            throw new BusError(ERROR, "No password prompt is pending");
        }
        sendAuthorizeResponse(elevation.pendingCookie(), args.get(0).asText());
        call.reply();
    }

    private JsonNode bridges()
    {
        ArrayNode labels = Jsons.array();
        configs.keySet().forEach(labels::add);
        return labels;
    }

    private JsonNode methods()
    {
        ObjectNode methods = Jsons.object();
        for (String label : configs.keySet()) {
            ObjectNode details = Jsons.object();
            details.set("label", Signatures.variant("s", TextNode.valueOf(label)));
            methods.set(label, Signatures.variant("a{sv}", details));
        }
        return methods;
    }

    // ---------------------------------------------------------------------
    // Control channel entry points
    // ---------------------------------------------------------------------

    /**
     * Elevation requested by the front end's {@code init}. Always answered
     * with {@code superuser-init-done}.
     */
    public void startAtInit(String label)
    {
        InitElevation init = new InitElevation();
        SuperuserBridgeConfig config = configs.get(label);
        if (privileged || peer != null || config == null) {
            log.warn("Not starting superuser bridge '{}' at init", label);
            init.failed("unavailable");
            return;
        }
        begin(config, init);
    }

    /**
     * The front end answered an {@code authorize} challenge.
     */
    public void authorize(ObjectNode message)
    {
        String cookie = Jsons.text(message, "cookie");
        String response = Jsons.text(message, "response");
        if (!(elevation instanceof InitElevation)
                || cookie == null || !cookie.equals(elevation.pendingCookie())) {
            sink.onProtocolEvent(new BridgeProtocolEvent(Instant.now(),
                    "Ignoring authorize for unknown cookie " + cookie));
            return;
        }
        sendAuthorizeResponse(cookie, response == null ? "" : response);
    }

    /**
     * Opens {@code request} inside the running peer.
     */
    public Optional<ChannelEndpoint> openRouted(ChannelOpenRequest request)
    {
        PeerBridge target = peer;
        if (target == null || !target.isInitialized()) {
            throw new IllegalStateException("no superuser bridge is running");
        }
        return registry.open(request, context -> new PeerRoutedChannel(context, target));
    }

    // ---------------------------------------------------------------------
    // Peer events
    // ---------------------------------------------------------------------

    public void handlePeerEvent(PeerEvent event)
    {
        if (peer == null || event.peer() != peer.connection()) {
            log.debug("Ignoring event from a previous superuser bridge");
            return;
        }
        if (event instanceof PeerEvent.PeerFrameReceived) {
            peerFrame(((PeerEvent.PeerFrameReceived) event).frame());
        }
        else if (event instanceof PeerEvent.PeerExited) {
            PeerEvent.PeerExited exited = (PeerEvent.PeerExited) event;
            peerExited(exited.exitCode(), exited.diagnostics());
        }
    }

    /**
     * Session teardown: stop the peer without any further output.
     */
    public void shutdown()
    {
        if (peer != null) {
            peer.connection().stop();
            peer = null;
        }
        elevation = null;
    }

    // ---------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------

    private void begin(SuperuserBridgeConfig config, Elevation requester)
    {
        setCurrent(INIT);
        PeerConnection connection;
        try {
            connection = launcher.launch(config, environment, new PeerListener() {
                @Override
                public void onFrame(PeerConnection source, Frame frame) {
                    events.accept(new PeerEvent.PeerFrameReceived(Instant.now(), source, frame));
                }

                @Override
                public void onExit(PeerConnection source, int exitCode, String diagnostics) {
                    events.accept(new PeerEvent.PeerExited(Instant.now(), source, exitCode, diagnostics));
                }
            });
        } catch (IOException e) {
            log.warn("Unable to start superuser bridge {}", config.label(), e);
            setCurrent(NONE);
            requester.failed(e.getMessage() == null ? config.label() + " failed to start" : e.getMessage());
            return;
        }
        peer = new PeerBridge(connection);
        elevation = requester;
    }

    private void peerFrame(Frame frame)
    {
        if (!frame.isControl()) {
            if (!peer.isInitialized()) {
                log.debug("Dropping data from superuser bridge before init");
                return;
            }
            Optional<PeerRoutedChannel> routed = peer.routed(frame.channel());
            if (routed.isPresent()) {
                routed.get().fromPeer(frame.payload());
            }
            else {
                log.debug("Dropping data from superuser bridge for unknown channel {}", frame.channel());
            }
            return;
        }

        ObjectNode message;
        try {
            message = Jsons.parseObject(frame.payload());
        } catch (IOException e) {
            log.warn("Superuser bridge {} sent an invalid control message", peer.label(), e);
            fail("Protocol error from " + peer.label());
            return;
        }

        Command command = Command.fromWireName(Jsons.text(message, "command")).orElse(null);
        if (!peer.isInitialized()) {
            peerControlBeforeInit(command, message);
        }
        else {
            peerControl(command, message);
        }
    }

    private void peerControlBeforeInit(Command command, ObjectNode message)
    {
        if (command == Command.AUTHORIZE) {
            String cookie = Jsons.text(message, "cookie");
            if (cookie == null) {
                log.debug("Superuser bridge sent authorize without a cookie");
                return;
            }
            String prompt = Jsons.text(message, "prompt");
            boolean echo = message.path("echo").asBoolean(false);
            elevation.prompt(cookie, prompt == null ? "" : prompt, echo);
        }
        else if (command == Command.INIT) {
            if (message.has("problem")) {
                String detail = Jsons.text(message, "message");
                fail(detail != null ? detail : Jsons.text(message, "problem"));
            }
            else if (message.path("version").asInt(-1) != ControlMessages.PROTOCOL_VERSION) {
                fail(peer.label() + " speaks an unsupported protocol version");
            }
            else {
                succeed();
            }
        }
        else {
            log.debug("Ignoring {} from superuser bridge before init", Jsons.text(message, "command"));
        }
    }

    private void peerControl(Command command, ObjectNode message)
    {
        String peerId = Jsons.text(message, "channel");
        if (peerId != null) {
            Optional<PeerRoutedChannel> routed = peer.routed(peerId);
            if (routed.isPresent()) {
                routed.get().fromPeer(message);
            }
            else {
                log.debug("Ignoring {} from superuser bridge for unknown channel {}",
                        Jsons.text(message, "command"), peerId);
            }
            return;
        }
        if (command == Command.PING) {
            ObjectNode pong = message.deepCopy();
            pong.put("command", Command.PONG.wireName());
            peer.sendControl(pong);
        }
        else {
            log.debug("Ignoring {} from superuser bridge", Jsons.text(message, "command"));
        }
    }

    private void succeed()
    {
        ObjectNode init = ControlMessages.init();
        init.put("host", "localhost");
        peer.sendControl(init);
        peer.markInitialized();

        Elevation requester = elevation;
        elevation = null;
        setCurrent(peer.label());
        requester.succeeded();
    }

    private void fail(String reason)
    {
        Elevation requester = elevation;
        if (peer.isInitialized()) {
            teardown();
            return;
        }
        peer.connection().stop();
        peer = null;
        elevation = null;
        setCurrent(NONE);
        requester.failed(reason);
    }

    private void peerExited(int exitCode, String diagnostics)
    {
        if (peer.isInitialized()) {
            log.info("Superuser bridge {} exited with status {}", peer.label(), exitCode);
            teardown();
            return;
        }
        fail(diagnostics != null ? diagnostics : peer.label() + " exited with status " + exitCode);
    }

    /**
     * Closes every routed channel, stops the peer and returns to {@code none}.
     */
    private void teardown()
    {
        PeerBridge stopping = peer;
        for (PeerRoutedChannel channel : stopping.channels()) {
            channel.detach();
            channel.close(null);
        }
        stopping.connection().stop();
        peer = null;
        elevation = null;
        setCurrent(NONE);
    }

    private void sendAuthorizeResponse(String cookie, String response)
    {
        ObjectNode reply = ControlMessages.command(Command.AUTHORIZE);
        reply.put("cookie", cookie);
        reply.put("response", response);
        peer.sendControl(reply);
        elevation.answered();
    }

    private void setCurrent(String next)
    {
        String previous = current;
        if (previous.equals(next)) {
            return;
        }
        current = next;
        sink.onSuperuserTransition(new SuperuserTransitionEvent(Instant.now(), previous, next));
        propertiesChanged(INTERFACE, "Current");
    }

    // ---------------------------------------------------------------------
    // Requesters
    // ---------------------------------------------------------------------

    private abstract static class AbstractElevation implements Elevation
    {
        private String cookie;

        @Override
        public void prompt(String cookie, String prompt, boolean echo)
        {
            this.cookie = cookie;
            ask(cookie, prompt, echo);
        }

        protected abstract void ask(String cookie, String prompt, boolean echo);

        @Override
        public String pendingCookie()
        {
            return cookie;
        }

        @Override
        public void answered()
        {
            cookie = null;
        }
    }

    /**
     * Started by the {@code Start} method: prompts become {@code Prompt}
     * signals and the outcome completes the call.
     */
    private final class BusElevation extends AbstractElevation
    {
        private final BusCall call;

        BusElevation(BusCall call)
        {
            this.call = call;
        }

        @Override
        protected void ask(String cookie, String prompt, boolean echo)
        {
            emitSignal(INTERFACE, "Prompt",
                    TextNode.valueOf(""),
                    TextNode.valueOf(prompt),
                    TextNode.valueOf(""),
                    BooleanNode.valueOf(echo),
                    TextNode.valueOf(""));
        }

        @Override
        public void succeeded()
        {
            call.reply();
        }

        @Override
        public void failed(String message)
        {
            call.fail(new BusError(ERROR, message));
        }
    }

    /**
     * Started by the front end's {@code init}: prompts become
     * {@code authorize} challenges and the outcome is
     * {@code superuser-init-done}.
     */
    private final class InitElevation extends AbstractElevation
    {
        @Override
        protected void ask(String cookie, String prompt, boolean echo)
        {
            ObjectNode challenge = ControlMessages.command(Command.AUTHORIZE);
            challenge.put("cookie", cookie);
            challenge.put("challenge", "plain1:");
            challenge.put("prompt", prompt);
            frontEnd.send(Frame.control(Jsons.toBytes(challenge)));
        }

        @Override
        public void succeeded()
        {
            done();
        }

        @Override
        public void failed(String message)
        {
            log.info("Superuser bridge failed to start at init: {}", message);
            done();
        }

        private void done()
        {
            frontEnd.send(Frame.control(Jsons.toBytes(ControlMessages.command(Command.SUPERUSER_INIT_DONE))));
        }
    }
}
