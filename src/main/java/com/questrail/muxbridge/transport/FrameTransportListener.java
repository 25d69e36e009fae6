package com.questrail.muxbridge.transport;

import com.questrail.muxbridge.codec.Frame;

/**
 * Callback sink for {@link FrameTransport}.
 *
 * <p>Callbacks are delivered serially by each transport, in the order the
 * frames arrived on the wire.</p>
 */
public interface FrameTransportListener
{
    /**
     * Called once when the transport becomes usable.
     */
    void onTransportUp();

    /**
     * Called once when the transport becomes unusable.
     *
     * @param cause the failure, or {@code null} for a clean end of stream
     */
    void onTransportDown(Throwable cause);

    /**
     * Called for each complete inbound frame.
     */
    void onFrame(Frame frame);
}
