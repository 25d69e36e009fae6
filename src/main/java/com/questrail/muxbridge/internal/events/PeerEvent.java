package com.questrail.muxbridge.internal.events;

import com.questrail.muxbridge.codec.Frame;
import com.questrail.muxbridge.superuser.PeerConnection;

import java.time.Instant;
import java.util.Objects;

/**
 * PeerEvent
 * -----------------------------------------------------------------------------
 * Output of a spawned superuser peer.
 *
 * <p>Each event names the connection it came from so that events still queued
 * from a peer that has since been replaced are recognised and dropped.</p>
 */
public sealed interface PeerEvent extends BridgeEvent
        permits PeerEvent.PeerFrameReceived, PeerEvent.PeerExited
{
    PeerConnection peer();

    /** The peer wrote one frame on its stdout. */
    final class PeerFrameReceived extends BridgeEvent.Base implements PeerEvent {
        private final PeerConnection peer;
        private final Frame frame;

        public PeerFrameReceived(Instant timestamp, PeerConnection peer, Frame frame) {
            super(timestamp);
            this.peer = Objects.requireNonNull(peer, "peer");
            this.frame = Objects.requireNonNull(frame, "frame");
        }

        @Override
        public PeerConnection peer() {
            return peer;
        }

        public Frame frame() {
            return frame;
        }
    }

    /**
     * The peer's protocol stream ended and the process is gone.
     */
    final class PeerExited extends BridgeEvent.Base implements PeerEvent {
        private final PeerConnection peer;
        private final int exitCode;
        private final String diagnostics;

        /**
         * @param diagnostics last non-empty line the peer wrote to stderr, or {@code null}
         */
        public PeerExited(Instant timestamp, PeerConnection peer, int exitCode, String diagnostics) {
            super(timestamp);
            this.peer = Objects.requireNonNull(peer, "peer");
            this.exitCode = exitCode;
            this.diagnostics = diagnostics;
        }

        @Override
        public PeerConnection peer() {
            return peer;
        }

        public int exitCode() {
            return exitCode;
        }

        public String diagnostics() {
            return diagnostics;
        }
    }
}
