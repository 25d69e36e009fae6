package com.questrail.muxbridge.transport;

import com.questrail.muxbridge.codec.Frame;

/**
 * Outbound side of a frame transport.
 *
 * <p>A single call to {@link #send(Frame)} delivers the whole frame or nothing;
 * concurrent callers never see their frames interleaved.</p>
 */
@FunctionalInterface
public interface FrameSink
{
    void send(Frame frame);
}
