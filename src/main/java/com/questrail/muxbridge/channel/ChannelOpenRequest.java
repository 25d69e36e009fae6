package com.questrail.muxbridge.channel;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.muxbridge.protocol.ProtocolException;
import com.questrail.muxbridge.util.Jsons;

import java.util.Objects;

/**
 * Decoded {@code open} control message.
 *
 * @param channel   channel id chosen by the initiator
 * @param payload   payload type tag, or {@code null} when the request omitted it
 * @param host      requested host, or {@code null} for the local host
 * @param superuser superuser routing mode
 * @param group     channel group used by {@code kill}, or {@code null}
 * @param options   the complete original message, for type-specific arguments
 */
public record ChannelOpenRequest(String channel,
                                 String payload,
                                 String host,
                                 SuperuserMode superuser,
                                 String group,
                                 ObjectNode options)
{
    public ChannelOpenRequest {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(superuser, "superuser");
        Objects.requireNonNull(options, "options");
    }

    /**
     * Decodes an {@code open} message.
     *
     * @throws ProtocolException if the message has no usable channel id
     */
    public static ChannelOpenRequest fromMessage(ObjectNode message) {
        String channel = Jsons.text(message, "channel");
        if (channel == null || channel.isEmpty()) {
            throw new ProtocolException("open is missing a channel id");
        }
        if (channel.indexOf('\n') >= 0) {
            throw new ProtocolException("invalid channel id");
        }
        return new ChannelOpenRequest(
                channel,
                Jsons.text(message, "payload"),
                Jsons.text(message, "host"),
                SuperuserMode.parse(message.get("superuser")),
                Jsons.text(message, "group"),
                message.deepCopy());
    }
}
