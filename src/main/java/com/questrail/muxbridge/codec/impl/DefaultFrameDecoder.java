package com.questrail.muxbridge.codec.impl;

import com.questrail.muxbridge.codec.Frame;
import com.questrail.muxbridge.codec.FrameDecoder;
import com.questrail.muxbridge.codec.FramingException;

import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;

/**
 * DefaultFrameDecoder
 * -----------------------------------------------------------------------------
 * Concrete implementation of {@link FrameDecoder} over a blocking stream.
 *
 * <p>This decoder performs the following steps, in order:</p>
 * <ol>
 *   <li>Read header digits one byte at a time up to the newline</li>
 *   <li>Validate and parse the length</li>
 *   <li>Read exactly that many body bytes</li>
 *   <li>Split the body into channel id and payload</li>
 * </ol>
 *
 * <p>End of stream before the first header byte is a clean close. End of
 * stream anywhere else means the peer died mid-frame and is reported as a
 * {@link FramingException}.</p>
 */
public final class DefaultFrameDecoder implements FrameDecoder
{
    @Override
    public Optional<Frame> decode(InputStream in) throws IOException
    {
        final byte[] digits = new byte[MuxFraming.MAX_HEADER_DIGITS + 1];
        int count = 0;

        while (true) {
            final int b = in.read();
            if (b < 0) {
                if (count == 0) {
                    return Optional.empty();
                }
                throw new FramingException("end of stream inside frame length header");
            }
            if (b == MuxFraming.NEWLINE) {
                break;
            }
            if (!MuxFraming.isDigit(b) || count == MuxFraming.MAX_HEADER_DIGITS) {
                throw new FramingException("invalid frame length header");
            }
            digits[count++] = (byte) b;
        }

        final int length = MuxFraming.parseLength(digits, count);
        final byte[] body = in.readNBytes(length);
        if (body.length != length) {
            throw new FramingException("end of stream inside frame body: expected "
                    + length + " bytes, got " + body.length);
        }

        return Optional.of(MuxFraming.split(body));
    }
}
