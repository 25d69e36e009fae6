package com.questrail.muxbridge.superuser;

import com.questrail.muxbridge.codec.Frame;

/**
 * Callbacks from a peer's reader threads. Implementations must only hand the
 * information over to the driver.
 */
public interface PeerListener
{
    void onFrame(PeerConnection peer, Frame frame);

    /**
     * Called once, after the peer's output has ended and the peer has exited.
     *
     * @param diagnostics last non-empty stderr line, or {@code null}
     */
    void onExit(PeerConnection peer, int exitCode, String diagnostics);
}
