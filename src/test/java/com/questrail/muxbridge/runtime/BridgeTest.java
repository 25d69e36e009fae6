package com.questrail.muxbridge.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.questrail.muxbridge.bus.BusInterface;
import com.questrail.muxbridge.bus.BusObject;
import com.questrail.muxbridge.config.BridgeRuntimeConfig;
import com.questrail.muxbridge.config.SuperuserBridgeConfig;
import com.questrail.muxbridge.login.LoginMessages;
import com.questrail.muxbridge.protocol.Problem;
import com.questrail.muxbridge.superuser.SuperuserRule;
import com.questrail.muxbridge.test.InProcessPeerLauncher;
import com.questrail.muxbridge.test.MockFrontEnd;
import com.questrail.muxbridge.test.PseudoPeer;
import com.questrail.muxbridge.util.Jsons;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.FileInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * End-to-end behaviour of a bridge session driven through {@link MockFrontEnd}.
 *
 * <p>The superuser tests elevate to {@link PseudoPeer}, a privileged bridge
 * running in-process behind pipes.</p>
 */
class BridgeTest {

    private static final String PASSWORD = "p4ssw0rd";

    private final MockFrontEnd frontEnd = new MockFrontEnd();
    private final InProcessPeerLauncher launcher = new InProcessPeerLauncher();
    private BridgeRuntime runtime;

    @AfterEach
    void tearDown() {
        if (runtime != null) {
            runtime.stop();
        }
    }

    private void startBridge(Map<String, String> environment, boolean withPassword) {
        List<String> environ = withPassword
                ? List.of(PseudoPeer.PASSWORD_VARIABLE + "=" + PASSWORD)
                : List.of();
        SuperuserBridgeConfig pseudo = new SuperuserBridgeConfig(
                PseudoPeer.LABEL, List.of("pseudo"), environ, true);

        runtime = BridgeRuntime.builder()
                .withConfig(BridgeRuntimeConfig.builder()
                        .withSuperuserBridges(List.of(pseudo))
                        .withEnvironment(environment)
                        .build())
                .withTransport(frontEnd)
                .withPeerLauncher(launcher)
                .build();
        runtime.start();

        ObjectNode init = frontEnd.assertMsg("", "command", "init");
        assertEquals(1, init.get("version").asInt());
        assertTrue(init.path("capabilities").path("explicit-superuser").asBoolean());
    }

    private void startAndInit() {
        startAndInit(false);
    }

    private void startAndInit(boolean withPassword) {
        startBridge(Map.of(), withPassword);
        frontEnd.sendInit();
    }

    private <T> T onDriver(Function<BridgeSession, T> query) throws Exception {
        AtomicReference<T> result = new AtomicReference<>();
        runtime.execute(session -> result.set(query.apply(session))).get(10, TimeUnit.SECONDS);
        return result.get();
    }

    private boolean holdsOnDriver(Predicate<BridgeSession> condition) throws Exception {
        return this.<Boolean>onDriver(condition::test);
    }

    private static ArrayNode strings(String... values) {
        ArrayNode array = Jsons.array();
        for (String value : values) {
            array.add(value);
        }
        return array;
    }

    private static ObjectNode superuserProps(String current, String... bridges) {
        ObjectNode props = Jsons.object();
        props.set("Bridges", strings(bridges));
        props.put("Current", current);
        return props;
    }

    private void verifyRootBridgeNotRunning() throws Exception {
        assertFalse(holdsOnDriver(session -> session.superuser().isRunning()));
        frontEnd.assertBusProps(SuperuserRule.PATH, SuperuserRule.INTERFACE,
                superuserProps(SuperuserRule.NONE, PseudoPeer.LABEL));

        String channel = frontEnd.checkOpen("null", Jsons.object().put("superuser", true), Problem.ACCESS_DENIED);
        assertFalse(holdsOnDriver(session -> session.registry().contains(channel)));
    }

    private void verifyRootBridgeRunning() throws Exception {
        frontEnd.assertBusProps(SuperuserRule.PATH, SuperuserRule.INTERFACE,
                superuserProps(PseudoPeer.LABEL, PseudoPeer.LABEL));
        assertTrue(holdsOnDriver(session -> session.superuser().isRunning()));

        ObjectNode options = Jsons.object().put("bus", "internal").put("superuser", true);
        String rootBus = frontEnd.checkOpen("dbus-json3", options, null);

        // the peer is privileged and has no bridges of its own
        frontEnd.assertBusProps(rootBus, SuperuserRule.PATH, SuperuserRule.INTERFACE,
                superuserProps(SuperuserRule.ROOT));

        frontEnd.checkClose(rootBus);
    }

    @Test
    void echoesDataAndPingsAndFinishes() {
        startAndInit();
        String echo = frontEnd.checkOpen("echo");

        frontEnd.sendData(echo, "foo".getBytes(StandardCharsets.UTF_8));
        frontEnd.assertData(echo, "foo".getBytes(StandardCharsets.UTF_8));

        frontEnd.sendPing(echo);
        frontEnd.assertMsg("", "command", "pong", "channel", echo);

        frontEnd.sendDone(echo);
        frontEnd.assertMsg("", "command", "done", "channel", echo);
        frontEnd.assertMsg("", "command", "close", "channel", echo);
    }

    @Test
    void checksHostBeforeSuperuser() {
        startAndInit();

        frontEnd.checkOpen("null", Jsons.object().put("host", MockFrontEnd.HOST), null);
        frontEnd.checkOpen("null");
        frontEnd.checkOpen("null", Jsons.object().put("host", "¡invalid!"), Problem.NO_HOST);
        frontEnd.checkOpen("null", Jsons.object().put("host", "¡invalid!").put("superuser", true),
                Problem.NO_HOST);
        frontEnd.checkOpen("null", Jsons.object().put("host", MockFrontEnd.HOST).put("superuser", true),
                Problem.ACCESS_DENIED);
    }

    @Test
    void rejectsUnknownPayload() {
        startAndInit();
        frontEnd.checkOpen("fsread1", Jsons.object(), Problem.NOT_SUPPORTED);
    }

    @Test
    void callsInternalBusObject() throws Exception {
        startAndInit();
        TestObject object = new TestObject();
        onDriver(session -> {
            session.internalBus().export("/foo", object);
            return null;
        });
        assertEquals("/foo", object.path());

        ArrayNode values = frontEnd.checkBusCall("/foo", "org.freedesktop.DBus.Properties", "GetAll",
                strings("test.iface"));
        assertEquals(Jsons.mapper().readTree("{\"Prop\": {\"t\": \"s\", \"v\": \"none\"}}"), values.get(0));

        ArrayNode result = frontEnd.checkBusCall("/foo", "test.iface", "GetProp", Jsons.array());
        assertEquals(strings("none"), result);
    }

    @Test
    void watchSendsMetaThenNotifyThenReply() throws Exception {
        startAndInit();
        TestObject object = new TestObject();
        onDriver(session -> {
            session.internalBus().export("/foo", object);
            return null;
        });

        String internal = frontEnd.ensureInternalBus();
        ObjectNode watch = Jsons.object();
        watch.putObject("watch").put("path", "/foo").put("interface", "test.iface");
        watch.put("id", "4");
        frontEnd.sendJson(internal, watch);

        ObjectNode meta = frontEnd.nextMsg(internal);
        assertEquals(Jsons.mapper().readTree("{"
                + "\"methods\": {\"GetProp\": {\"in\": [], \"out\": [\"s\"]}},"
                + "\"properties\": {\"Prop\": {\"flags\": \"r\", \"type\": \"s\"}},"
                + "\"signals\": {\"Sig\": {\"in\": [\"s\"]}}"
                + "}"), meta.get("meta").get("test.iface"));

        ObjectNode notify = frontEnd.nextMsg(internal);
        assertEquals(Jsons.object().put("Prop", "none"), notify.get("notify").get("/foo").get("test.iface"));

        ObjectNode reply = frontEnd.nextMsg(internal);
        assertEquals(Jsons.mapper().readTree("{\"id\": \"4\", \"reply\": []}"), reply);

        onDriver(session -> {
            object.setProp("xyz");
            return null;
        });
        notify = frontEnd.nextMsg(internal);
        assertEquals(Jsons.object().put("Prop", "xyz"), notify.get("notify").get("/foo").get("test.iface"));
    }

    @Test
    void superuserStartWithoutPassword() throws Exception {
        startAndInit();
        verifyRootBridgeNotRunning();

        ArrayNode started = frontEnd.checkBusCall(SuperuserRule.PATH, SuperuserRule.INTERFACE, "Start",
                strings(PseudoPeer.LABEL));
        assertEquals(0, started.size());

        verifyRootBridgeRunning();

        String rootNull = frontEnd.checkOpen("null", Jsons.object().put("superuser", true), null);

        String internal = frontEnd.ensureInternalBus();
        String stop = frontEnd.sendBusCall(SuperuserRule.PATH, SuperuserRule.INTERFACE, "Stop", Jsons.array());

        // stopping closes the routed channel before the call returns
        frontEnd.assertMsg("", "command", "close", "channel", rootNull);
        assertEquals(0, frontEnd.assertBusReply(internal, stop).size());
        assertFalse(holdsOnDriver(session -> session.registry().contains(rootNull)));
        assertEquals(SuperuserRule.NONE, onDriver(session -> session.superuser().current()));
    }

    @Test
    void transportLossEndsChannelsAndPeerWithoutOutput() throws Exception {
        startAndInit();
        frontEnd.checkBusCall(SuperuserRule.PATH, SuperuserRule.INTERFACE, "Start", strings(PseudoPeer.LABEL));

        String routed = frontEnd.checkOpen("echo", Jsons.object().put("superuser", true), null);
        String local = frontEnd.checkOpen("echo");
        assertTrue(holdsOnDriver(session -> session.registry().contains(routed)
                && session.registry().contains(local)
                && session.superuser().isRunning()));
        BridgeSession session = onDriver(s -> s);

        frontEnd.disconnect();

        assertTrue(runtime.awaitTermination(10, TimeUnit.SECONDS));
        frontEnd.assertQuiet(200);
        assertEquals(0, session.registry().size());
        assertFalse(session.superuser().isRunning());
        assertTrue(launcher.awaitAllExited(10, TimeUnit.SECONDS));
        assertTrue(frontEnd.isStopped());
    }

    private ObjectNode watchedSuperuserProps() {
        ObjectNode label = Jsons.object();
        label.set("label", variant("s", TextNode.valueOf(PseudoPeer.LABEL)));
        ObjectNode methods = Jsons.object();
        methods.set(PseudoPeer.LABEL, variant("a{sv}", label));

        ObjectNode props = superuserProps(SuperuserRule.NONE, PseudoPeer.LABEL);
        props.set("Methods", methods);
        return props;
    }

    private static ObjectNode variant(String type, JsonNode value) {
        ObjectNode variant = Jsons.object();
        variant.put("t", type);
        variant.set("v", value);
        return variant;
    }

    private ArrayNode expectedPrompt() {
        ArrayNode args = Jsons.array();
        args.add("").add(PseudoPeer.PROMPT).add("").add(BooleanNode.FALSE).add("");
        return args;
    }

    private String startWithPrompt() {
        frontEnd.addBusMatch(SuperuserRule.PATH, SuperuserRule.INTERFACE);
        frontEnd.watchBus(SuperuserRule.PATH, SuperuserRule.INTERFACE, watchedSuperuserProps());

        String start = frontEnd.sendBusCall(SuperuserRule.PATH, SuperuserRule.INTERFACE, "Start",
                strings(PseudoPeer.LABEL));
        frontEnd.assertBusNotify(SuperuserRule.PATH, SuperuserRule.INTERFACE,
                Jsons.object().put("Current", SuperuserRule.INIT));
        frontEnd.assertBusSignal(SuperuserRule.PATH, SuperuserRule.INTERFACE, "Prompt", expectedPrompt());
        return start;
    }

    @Test
    void superuserStartWithPassword() throws Exception {
        startAndInit(true);
        verifyRootBridgeNotRunning();

        String start = startWithPrompt();
        frontEnd.checkBusCall(SuperuserRule.PATH, SuperuserRule.INTERFACE, "Answer", strings(PASSWORD));

        frontEnd.assertBusNotify(SuperuserRule.PATH, SuperuserRule.INTERFACE,
                Jsons.object().put("Current", PseudoPeer.LABEL));
        assertEquals(0, frontEnd.assertBusReply(frontEnd.ensureInternalBus(), start).size());

        verifyRootBridgeRunning();
    }

    @Test
    void superuserStartWithWrongPassword() throws Exception {
        startAndInit(true);
        verifyRootBridgeNotRunning();

        String start = startWithPrompt();
        frontEnd.checkBusCall(SuperuserRule.PATH, SuperuserRule.INTERFACE, "Answer", strings("p5ssw0rd"));

        frontEnd.assertBusNotify(SuperuserRule.PATH, SuperuserRule.INTERFACE,
                Jsons.object().put("Current", SuperuserRule.NONE));
        frontEnd.assertBusError(start, SuperuserRule.ERROR, PseudoPeer.BAD_PASSWORD);

        verifyRootBridgeNotRunning();
    }

    @Test
    void answerWithoutPromptFails() {
        startAndInit();
        String id = frontEnd.sendBusCall(SuperuserRule.PATH, SuperuserRule.INTERFACE, "Answer", strings("x"));
        frontEnd.assertBusError(id, SuperuserRule.ERROR, null);
    }

    @Test
    void startUnknownBridgeFails() {
        startAndInit();
        String id = frontEnd.sendBusCall(SuperuserRule.PATH, SuperuserRule.INTERFACE, "Start", strings("sudo"));
        frontEnd.assertBusError(id, SuperuserRule.ERROR, null);
        assertEquals(0, launcher.launches());
    }

    @Test
    void superuserAtInit() throws Exception {
        startBridge(Map.of(), false);
        ObjectNode superuser = Jsons.object().put("id", PseudoPeer.LABEL);
        frontEnd.sendInit((ObjectNode) Jsons.object().set("superuser", superuser));

        frontEnd.assertMsg("", "command", "superuser-init-done");

        verifyRootBridgeRunning();
    }

    @Test
    void superuserAtInitWithPassword() throws Exception {
        startBridge(Map.of(), true);
        ObjectNode superuser = Jsons.object().put("id", PseudoPeer.LABEL);
        frontEnd.sendInit((ObjectNode) Jsons.object().set("superuser", superuser));

        ObjectNode challenge = frontEnd.assertMsg("", "command", "authorize",
                "challenge", "plain1:", "prompt", PseudoPeer.PROMPT);
        String cookie = Jsons.text(challenge, "cookie");
        assertNotNull(cookie);

        ObjectNode authorize = MockFrontEnd.command("authorize");
        authorize.put("cookie", cookie);
        authorize.put("response", PASSWORD);
        frontEnd.sendControl(authorize);

        frontEnd.assertMsg("", "command", "superuser-init-done");

        verifyRootBridgeRunning();
    }

    @Test
    void superuserAtInitForUnknownBridgeStillCompletes() throws Exception {
        startBridge(Map.of(), false);
        ObjectNode superuser = Jsons.object().put("id", "sudo");
        frontEnd.sendInit((ObjectNode) Jsons.object().set("superuser", superuser));

        frontEnd.assertMsg("", "command", "superuser-init-done");
        verifyRootBridgeNotRunning();
    }

    @Test
    void noLoginMessages() {
        startAndInit();
        assertEquals(strings("{}"), loginCall("Get"));
        assertEquals(Jsons.array(), loginCall("Dismiss"));
        assertEquals(strings("{}"), loginCall("Get"));
    }

    @Test
    @EnabledOnOs(OS.LINUX)
    void loginMessagesFromInheritedDescriptor(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("login-messages");
        Files.write(file, "msg".getBytes(StandardCharsets.UTF_8));

        try (FileInputStream open = new FileInputStream(file.toFile())) {
            String fd = descriptorOf(file);
            startBridge(Map.of(LoginMessages.ENVIRONMENT_VARIABLE, fd), false);
            frontEnd.sendInit();

            assertEquals(strings("msg"), loginCall("Get"));
            assertEquals(strings("msg"), loginCall("Get"));
            assertEquals(Jsons.array(), loginCall("Dismiss"));
            assertEquals(strings("{}"), loginCall("Get"));
            assertEquals(Jsons.array(), loginCall("Dismiss"));
            assertEquals(strings("{}"), loginCall("Get"));
        }
    }

    private ArrayNode loginCall(String method) {
        return frontEnd.checkBusCall(LoginMessages.PATH, LoginMessages.INTERFACE, method, Jsons.array());
    }

    private static String descriptorOf(Path file) throws IOException {
        Path target = file.toRealPath();
        try (Stream<Path> fds = Files.list(Path.of("/proc/self/fd"))) {
            for (Path fd : (Iterable<Path>) fds::iterator) {
                try {
                    if (target.equals(Files.readSymbolicLink(fd))) {
                        return fd.getFileName().toString();
                    }
                } catch (IOException e) {
                    // descriptor closed while listing
                }
            }
        }
        throw new IOException("no open descriptor for " + file);
    }

    @Test
    void frozenChannelKeepsOrderWithoutDelayingOthers() throws Exception {
        startAndInit();
        String koelle = frontEnd.checkOpen("echo");
        String malle = frontEnd.checkOpen("echo");

        onDriver(session -> {
            session.registry().find(koelle).orElseThrow().freeze();
            return null;
        });
        frontEnd.sendData(koelle, bytes("x1"));
        frontEnd.sendData(koelle, bytes("x2"));
        frontEnd.sendData(koelle, bytes("x3"));
        frontEnd.sendDone(koelle);

        frontEnd.sendData(malle, bytes("yy"));
        frontEnd.sendDone(malle);

        onDriver(session -> {
            session.registry().find(koelle).orElseThrow().thaw();
            return null;
        });

        frontEnd.assertData(malle, bytes("yy"));
        frontEnd.assertMsg("", "command", "done", "channel", malle);
        frontEnd.assertMsg("", "command", "close", "channel", malle);

        frontEnd.assertData(koelle, bytes("x1"));
        frontEnd.assertData(koelle, bytes("x2"));
        frontEnd.assertData(koelle, bytes("x3"));
        frontEnd.assertMsg("", "command", "done", "channel", koelle);
        frontEnd.assertMsg("", "command", "close", "channel", koelle);
    }

    @Test
    void killClosesChannelsOfGroup() {
        startAndInit();
        String plain = frontEnd.checkOpen("null");
        String grouped = frontEnd.checkOpen("null", Jsons.object().put("group", "g1"), null);

        ObjectNode kill = MockFrontEnd.command("kill");
        kill.put("group", "g1");
        frontEnd.sendControl(kill);

        frontEnd.assertMsg("", "command", "close", "channel", grouped, "problem", Problem.TERMINATED);
        frontEnd.checkClose(plain);
    }

    @Test
    void pingWithoutChannelIsAnswered() {
        startAndInit();
        frontEnd.sendPing(null);
        ObjectNode pong = frontEnd.assertMsg("", "command", "pong");
        assertFalse(pong.has("channel"));
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Object with one read-only property, one method and one signal.
     */
    static final class TestObject extends BusObject {
        private String prop = "none";

        private final BusInterface iface = BusInterface.builder("test.iface")
                .method("GetProp", List.of(), List.of("s"), (args, call) -> call.reply(TextNode.valueOf(prop)))
                .property("Prop", "s", () -> TextNode.valueOf(prop))
                .signal("Sig", "s")
                .build();

        void setProp(String value) {
            prop = value;
            propertiesChanged("test.iface", "Prop");
        }

        @Override
        protected List<BusInterface> interfaces() {
            return List.of(iface);
        }
    }
}
