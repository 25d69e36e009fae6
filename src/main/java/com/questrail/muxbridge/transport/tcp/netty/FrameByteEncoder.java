package com.questrail.muxbridge.transport.tcp.netty;

import com.questrail.muxbridge.codec.Frame;
import com.questrail.muxbridge.codec.FrameEncoder;
import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;

import java.util.Objects;

/**
 * Netty outbound handler writing {@link Frame}s in wire format.
 */
final class FrameByteEncoder extends MessageToByteEncoder<Frame>
{
    private final FrameEncoder encoder;

    FrameByteEncoder(FrameEncoder encoder)
    {
        this.encoder = Objects.requireNonNull(encoder, "encoder");
    }

    @Override
    protected void encode(ChannelHandlerContext ctx, Frame frame, ByteBuf out)
    {
        out.writeBytes(encoder.encode(frame));
    }
}
