package com.questrail.muxbridge.transport.tcp.netty;

import com.questrail.muxbridge.codec.Frame;
import com.questrail.muxbridge.codec.FramingException;
import com.questrail.muxbridge.codec.impl.DefaultFrameEncoder;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.DecoderException;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * FrameByteDecoderTest
 * -----------------------------------------------------------------------------
 * Pipeline tests for the TCP frame codec on an {@link EmbeddedChannel}.
 */
final class FrameByteDecoderTest
{
    private static ByteBuf bytes(String s)
    {
        return Unpooled.copiedBuffer(s, StandardCharsets.UTF_8);
    }

    @Test
    void reassemblesFrameSplitAcrossReads()
    {
        EmbeddedChannel channel = new EmbeddedChannel(new FrameByteDecoder());

        assertFalse(channel.writeInbound(bytes("7")));
        assertFalse(channel.writeInbound(bytes("\nch\nda")));
        assertTrue(channel.writeInbound(bytes("ta")));

        Frame frame = channel.readInbound();
        assertEquals("ch", frame.channel());
        assertEquals("data", new String(frame.payload(), StandardCharsets.UTF_8));
        assertNull(channel.readInbound());
        channel.finishAndReleaseAll();
    }

    @Test
    void decodesSeveralFramesFromOneRead()
    {
        EmbeddedChannel channel = new EmbeddedChannel(new FrameByteDecoder());

        assertTrue(channel.writeInbound(bytes("3\na\nx3\n\n{}")));

        Frame first = channel.readInbound();
        Frame second = channel.readInbound();
        assertEquals("a", first.channel());
        assertTrue(second.isControl());
        channel.finishAndReleaseAll();
    }

    @Test
    void rejectsInvalidHeader()
    {
        EmbeddedChannel channel = new EmbeddedChannel(new FrameByteDecoder());

        DecoderException e = assertThrows(DecoderException.class,
                () -> channel.writeInbound(bytes("1x")));
        assertInstanceOf(FramingException.class, e.getCause());
        assertFalse(channel.finishAndReleaseAll());
    }

    @Test
    void discardsBadHeaderSoItIsReportedOnce()
    {
        EmbeddedChannel channel = new EmbeddedChannel(new FrameByteDecoder());

        DecoderException e = assertThrows(DecoderException.class,
                () -> channel.writeInbound(bytes("ab\nch\nxy")));
        assertInstanceOf(FramingException.class, e.getCause());

        assertFalse(channel.writeInbound(Unpooled.EMPTY_BUFFER));
        assertFalse(channel.finishAndReleaseAll());
    }

    @Test
    void discardsOverlongHeader()
    {
        EmbeddedChannel channel = new EmbeddedChannel(new FrameByteDecoder());

        assertThrows(DecoderException.class, () -> channel.writeInbound(bytes("12345678901234567890")));
        assertFalse(channel.finishAndReleaseAll());
    }

    @Test
    void encoderWritesWireImage()
    {
        EmbeddedChannel channel = new EmbeddedChannel(new FrameByteEncoder(new DefaultFrameEncoder()));

        assertTrue(channel.writeOutbound(new Frame("ch", "hi".getBytes(StandardCharsets.UTF_8))));
        ByteBuf out = channel.readOutbound();
        assertEquals("5\nch\nhi", out.toString(StandardCharsets.UTF_8));
        out.release();
        channel.finishAndReleaseAll();
    }
}
