package com.questrail.muxbridge.transport.tcp.netty;

import com.questrail.muxbridge.codec.FramingException;
import com.questrail.muxbridge.codec.impl.MuxFraming;
import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;

import java.util.List;

/**
 * FrameByteDecoder
 * -----------------------------------------------------------------------------
 * Netty inbound handler that cuts the TCP byte stream into
 * {@link com.questrail.muxbridge.codec.Frame}s.
 *
 * <p>Bytes stay in the cumulation buffer until a whole frame is present; the
 * header and body rules are the ones in {@link MuxFraming}. A framing defect
 * surfaces as a {@link io.netty.handler.codec.DecoderException} wrapping a
 * {@link FramingException}; the offending bytes are discarded first so the
 * defect is reported once.</p>
 */
final class FrameByteDecoder extends ByteToMessageDecoder
{
    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out)
            throws FramingException
    {
        try {
            decodeFrames(in, out);
        } catch (FramingException e) {
            in.skipBytes(in.readableBytes());
            throw e;
        }
    }

    private static void decodeFrames(ByteBuf in, List<Object> out)
            throws FramingException
    {
        while (true) {
            final int start = in.readerIndex();
            final int searchable = Math.min(in.readableBytes(), MuxFraming.MAX_HEADER_DIGITS + 1);
            final int newline = in.indexOf(start, start + searchable, MuxFraming.NEWLINE);

            if (newline < 0) {
                if (searchable > MuxFraming.MAX_HEADER_DIGITS) {
                    throw new FramingException("frame length header too long");
                }
                validateDigits(in, start, searchable);
                return;
            }

            final int count = newline - start;
            final byte[] digits = new byte[count];
            in.getBytes(start, digits);
            final int length = MuxFraming.parseLength(digits, count);

            if (in.readableBytes() < count + 1 + length) {
                return;
            }

            in.skipBytes(count + 1);
            final byte[] body = new byte[length];
            in.readBytes(body);
            out.add(MuxFraming.split(body));
        }
    }

    private static void validateDigits(ByteBuf in, int start, int count)
            throws FramingException
    {
        for (int i = 0; i < count; i++) {
            if (!MuxFraming.isDigit(in.getByte(start + i) & 0xFF)) {
                throw new FramingException("invalid frame length header");
            }
        }
    }
}
