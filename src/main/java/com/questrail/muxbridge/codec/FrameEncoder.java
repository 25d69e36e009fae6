package com.questrail.muxbridge.codec;

/**
 * FrameEncoder
 * -----------------------------------------------------------------------------
 * Outbound counterpart of {@link FrameDecoder}.
 *
 * <p>The encoder returns the complete wire image of a frame so that callers can
 * hand it to the transport in a single write. That single write is what keeps
 * frames from interleaving.</p>
 */
public interface FrameEncoder
{
    byte[] encode(Frame frame);
}
