package com.questrail.muxbridge.protocol;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.muxbridge.util.Jsons;

/**
 * Factory helpers for outbound control messages.
 */
public final class ControlMessages
{
    public static final int PROTOCOL_VERSION = 1;

    private ControlMessages() {}

    public static ObjectNode command(Command command) {
        ObjectNode message = Jsons.object();
        message.put("command", command.wireName());
        return message;
    }

    public static ObjectNode forChannel(Command command, String channel) {
        ObjectNode message = command(command);
        message.put("channel", channel);
        return message;
    }

    /**
     * The handshake the bridge sends as soon as its transport comes up.
     */
    public static ObjectNode init() {
        ObjectNode message = command(Command.INIT);
        message.put("version", PROTOCOL_VERSION);
        message.putObject("capabilities").put("explicit-superuser", true);
        return message;
    }

    public static ObjectNode close(String channel, String problem, String detail) {
        ObjectNode message = forChannel(Command.CLOSE, channel);
        if (problem != null) {
            message.put("problem", problem);
        }
        if (detail != null) {
            message.put("message", detail);
        }
        return message;
    }
}
