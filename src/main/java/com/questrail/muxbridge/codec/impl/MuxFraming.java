package com.questrail.muxbridge.codec.impl;

import com.questrail.muxbridge.codec.Frame;
import com.questrail.muxbridge.codec.FramingException;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * MuxFraming
 * -----------------------------------------------------------------------------
 * Wire rules shared by the stream decoder and the Netty pipeline decoder.
 *
 * <p>A frame is a decimal length header terminated by a newline, followed by
 * exactly that many bytes of body. The body is the channel id, a newline, and
 * the payload.</p>
 *
 * <p>This class is responsible only for validating the header and splitting
 * the body. It does not do any I/O.</p>
 */
public final class MuxFraming
{
    /** Separator between header, channel id and payload. */
    public static final byte NEWLINE = '\n';

    /** Longest accepted length header; 8 digits keeps a frame under 100 MB. */
    public static final int MAX_HEADER_DIGITS = 8;

    private MuxFraming() {}

    /**
     * Returns true if {@code b} may appear in a length header.
     */
    public static boolean isDigit(int b)
    {
        return b >= '0' && b <= '9';
    }

    /**
     * Parses the length header digits (without the trailing newline).
     *
     * @throws FramingException if the header is empty, too long, has a leading
     *         zero, or contains anything other than ASCII digits
     */
    public static int parseLength(byte[] digits, int count)
            throws FramingException
    {
        if (count == 0) {
            throw new FramingException("empty frame length header");
        }
        if (count > MAX_HEADER_DIGITS) {
            throw new FramingException("frame length header too long");
        }
        if (digits[0] == '0') {
            throw new FramingException("frame length header has a leading zero");
        }

        int length = 0;
        for (int i = 0; i < count; i++) {
            final int b = digits[i] & 0xFF;
            if (!isDigit(b)) {
                throw new FramingException("invalid character in frame length header: " + b);
            }
            length = length * 10 + (b - '0');
        }
        return length;
    }

    /**
     * Splits a frame body into channel id and payload.
     *
     * @param body exactly the bytes counted by the length header
     * @throws FramingException if the body has no channel separator
     */
    public static Frame split(byte[] body)
            throws FramingException
    {
        for (int i = 0; i < body.length; i++) {
            if (body[i] == NEWLINE) {
                String channel = new String(body, 0, i, StandardCharsets.UTF_8);
                byte[] payload = Arrays.copyOfRange(body, i + 1, body.length);
                return new Frame(channel, payload);
            }
        }
        throw new FramingException("frame body has no channel separator");
    }

    /**
     * Builds the complete wire image of {@code frame}.
     */
    public static byte[] join(Frame frame)
    {
        final byte[] channel = frame.channel().getBytes(StandardCharsets.UTF_8);
        final byte[] payload = frame.payload();
        final int bodyLength = channel.length + 1 + payload.length;
        final byte[] header = (bodyLength + "\n").getBytes(StandardCharsets.US_ASCII);

        byte[] out = new byte[header.length + bodyLength];
        System.arraycopy(header, 0, out, 0, header.length);
        System.arraycopy(channel, 0, out, header.length, channel.length);
        out[header.length + channel.length] = NEWLINE;
        System.arraycopy(payload, 0, out, header.length + channel.length + 1, payload.length);
        return out;
    }
}
