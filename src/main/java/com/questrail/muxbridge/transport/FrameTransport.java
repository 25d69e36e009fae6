package com.questrail.muxbridge.transport;

import com.questrail.muxbridge.codec.Frame;

/**
 * FrameTransport
 * -----------------------------------------------------------------------------
 * Minimal port for a reliable, ordered, frame-carrying transport.
 *
 * <p>Higher layers are responsible for:</p>
 * <ul>
 *   <li>turning inbound frames into driver events</li>
 *   <li>routing control frames and channel data</li>
 *   <li>deciding what is written back</li>
 * </ul>
 *
 * <p>Implementations may be backed by blocking streams (stdio, child process
 * pipes), Netty, or a test harness.</p>
 */
public interface FrameTransport extends FrameSink
{
    /**
     * Start the transport and begin receiving frames.
     *
     * <p>On successful activation, the transport MUST notify its listener via
     * {@link FrameTransportListener#onTransportUp()} exactly once.</p>
     */
    void start();

    /**
     * Stop the transport and release its resources.
     *
     * <p>The listener is notified through
     * {@link FrameTransportListener#onTransportDown(Throwable)} at most once.</p>
     */
    void stop();

    /**
     * Send a frame. Frames sent after the transport went down are dropped.
     */
    @Override
    void send(Frame frame);

    /**
     * Register the listener that receives inbound frames and lifecycle events.
     *
     * <p>This must be called before {@link #start()}.</p>
     */
    void setListener(FrameTransportListener listener);
}
