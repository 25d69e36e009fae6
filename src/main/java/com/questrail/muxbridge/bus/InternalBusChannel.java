package com.questrail.muxbridge.bus;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.muxbridge.channel.AbstractChannel;
import com.questrail.muxbridge.channel.ChannelContext;
import com.questrail.muxbridge.channel.ChannelOpenException;
import com.questrail.muxbridge.protocol.Problem;
import com.questrail.muxbridge.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.HashSet;
import java.util.Set;

/**
 * InternalBusChannel
 * =============================================================================
 * The {@code dbus-json3} channel with {@code bus: "internal"}.
 *
 * <p>Each data frame is one JSON message: {@code call}, {@code watch},
 * {@code unwatch}, {@code add-match}, {@code remove-match} or {@code meta}.
 * Anything else closes the channel with {@code protocol-error}.</p>
 *
 * <p>A watch answers with {@code meta} (the first time this channel watches
 * that interface), then the current properties as {@code notify}, then the
 * {@code reply}.</p>
 */
public final class InternalBusChannel extends AbstractChannel implements BusClient
{
    public static final String PAYLOAD = "dbus-json3";
    public static final String INTERNAL = "internal";

    private static final Logger log = LoggerFactory.getLogger(InternalBusChannel.class);

    private final InternalBus bus;
    private final Set<String> described = new HashSet<>();

    public InternalBusChannel(ChannelContext context)
    {
        super(context);
        this.bus = context.bus();
    }

    @Override
    protected void doOpen(ObjectNode options) throws ChannelOpenException
    {
        String name = Jsons.text(options, "bus");
        if (!INTERNAL.equals(name)) {
            throw new ChannelOpenException(Problem.NOT_SUPPORTED, "Only the internal bus is available");
        }
        ready();
    }

    @Override
    protected void doData(byte[] data)
    {
        ObjectNode message;
        try {
            message = Jsons.parseObject(data);
        } catch (IOException e) {
            log.debug("Channel {}: unparseable bus message", id(), e);
            close(Problem.PROTOCOL_ERROR, "Invalid bus message");
            return;
        }

        boolean valid;
        if (message.has("call")) {
            valid = handleCall(message.get("call"), message.get("id"));
        }
        else if (message.has("watch")) {
            valid = handleWatch(message.get("watch"), message.get("id"));
        }
        else if (message.has("unwatch")) {
            valid = handleUnwatch(message.get("unwatch"));
        }
        else if (message.has("add-match")) {
            valid = handleMatch(message.get("add-match"), message.get("id"), true);
        }
        else if (message.has("remove-match")) {
            valid = handleMatch(message.get("remove-match"), message.get("id"), false);
        }
        else {
            // client-supplied meta only matters for real bus peers
            valid = message.has("meta");
        }

        if (!valid) {
            close(Problem.PROTOCOL_ERROR, "Invalid bus message");
        }
    }

    @Override
    protected void doDone()
    {
        done();
    }

    @Override
    protected void onClosing()
    {
        bus.detach(this);
    }

    // ---------------------------------------------------------------------
    // BusClient
    // ---------------------------------------------------------------------

    @Override
    public void busNotify(String path, String iface, ObjectNode changed)
    {
        ObjectNode message = Jsons.object();
        message.putObject("notify").putObject(path).set(iface, changed);
        send(message);
    }

    @Override
    public void busSignal(String path, String iface, String member, ArrayNode args)
    {
        ObjectNode message = Jsons.object();
        message.putArray("signal").add(path).add(iface).add(member).add(args);
        send(message);
    }

    // ---------------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------------

    private boolean handleCall(JsonNode call, JsonNode id)
    {
        if (call == null || !call.isArray() || call.size() != 4
                || !call.get(0).isTextual() || !call.get(1).isTextual()
                || !call.get(2).isTextual() || !call.get(3).isArray()) {
            return false;
        }
        bus.call(call.get(0).asText(), call.get(1).asText(), call.get(2).asText(),
                (ArrayNode) call.get(3), new PendingCall(id));
        return true;
    }

    private boolean handleWatch(JsonNode watch, JsonNode id)
    {
        String path = Jsons.text(watch, "path");
        String iface = Jsons.text(watch, "interface");
        if (path == null || iface == null) {
            return false;
        }

        PendingCall call = new PendingCall(id);
        InternalBus.WatchResult result;
        try {
            result = bus.watch(this, path, iface);
        } catch (BusError e) {
            call.fail(e);
            return true;
        }

        if (described.add(iface)) {
            ObjectNode meta = Jsons.object();
            meta.putObject("meta").set(iface, result.descriptor().describe());
            send(meta);
        }
        busNotify(path, iface, result.snapshot());
        acknowledge(id);
        return true;
    }

    private boolean handleUnwatch(JsonNode unwatch)
    {
        String path = Jsons.text(unwatch, "path");
        String iface = Jsons.text(unwatch, "interface");
        if (path == null || iface == null) {
            return false;
        }
        bus.unwatch(this, path, iface);
        return true;
    }

    private boolean handleMatch(JsonNode match, JsonNode id, boolean add)
    {
        if (match == null || !match.isObject()) {
            return false;
        }
        String path = Jsons.text(match, "path");
        String iface = Jsons.text(match, "interface");
        String member = Jsons.text(match, "member");
        if (add) {
            bus.addMatch(this, path, iface, member);
        }
        else {
            bus.removeMatch(this, path, iface, member);
        }
        acknowledge(id);
        return true;
    }

    /**
     * Answers a watch or match request, which carries no return values.
     */
    private void acknowledge(JsonNode id)
    {
        if (id == null) {
            return;
        }
        ObjectNode message = Jsons.object();
        message.putArray("reply");
        message.set("id", id);
        send(message);
    }

    private void send(ObjectNode message)
    {
        sendData(Jsons.toBytes(message));
    }

    /**
     * A call awaiting its outcome. Without an {@code id} no reply is sent.
     */
    private final class PendingCall implements BusCall
    {
        private final JsonNode id;
        private boolean completed;

        PendingCall(JsonNode id)
        {
            this.id = id;
        }

        @Override
        public void reply(JsonNode... values)
        {
            if (!complete()) {
                return;
            }
            ObjectNode message = Jsons.object();
            ArrayNode outs = message.putArray("reply").addArray();
            for (JsonNode value : values) {
                outs.add(value);
            }
            message.set("id", id);
            send(message);
        }

        @Override
        public void fail(BusError error)
        {
            if (!complete()) {
                return;
            }
            ObjectNode message = Jsons.object();
            ArrayNode body = message.putArray("error");
            body.add(error.name());
            body.addArray().add(error.getMessage() == null ? "" : error.getMessage());
            message.set("id", id);
            send(message);
        }

        @Override
        public boolean isCompleted()
        {
            return completed;
        }

        private boolean complete()
        {
            if (completed) {
                return false;
            }
            completed = true;
            return id != null && !isClosed();
        }
    }
}
