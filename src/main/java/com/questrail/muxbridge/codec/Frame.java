package com.questrail.muxbridge.codec;

import java.util.Arrays;
import java.util.Objects;

/**
 * Frame
 * -----------------------------------------------------------------------------
 * Smallest transport unit of the multiplexing protocol.
 *
 * <p>A frame with an empty channel id is a <em>control frame</em> whose payload
 * is one JSON object. Any other frame is a <em>data frame</em> whose payload
 * belongs to the byte stream of the named channel.</p>
 *
 * <p>The payload array is owned by the frame once constructed; callers must not
 * mutate it afterwards.</p>
 */
public record Frame(String channel, byte[] payload)
{
    public static final String CONTROL_CHANNEL = "";

    public Frame {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(payload, "payload");
        if (channel.indexOf('\n') >= 0) {
            throw new IllegalArgumentException("channel id must not contain a newline");
        }
    }

    public static Frame control(byte[] json) {
        return new Frame(CONTROL_CHANNEL, json);
    }

    public boolean isControl() {
        return channel.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Frame other)) {
            return false;
        }
        return channel.equals(other.channel) && Arrays.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        return 31 * channel.hashCode() + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "Frame[channel=" + channel + ", " + payload.length + " bytes]";
    }
}
