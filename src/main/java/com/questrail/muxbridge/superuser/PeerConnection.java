package com.questrail.muxbridge.superuser;

import com.questrail.muxbridge.codec.Frame;

/**
 * The framed stdio of one running superuser peer.
 */
public interface PeerConnection
{
    String label();

    /** Writes one frame to the peer's stdin. Ignored once the peer is gone. */
    void send(Frame frame);

    /**
     * Closes the peer's streams and terminates it. The listener still receives
     * {@link PeerListener#onExit} afterwards.
     */
    void stop();
}
