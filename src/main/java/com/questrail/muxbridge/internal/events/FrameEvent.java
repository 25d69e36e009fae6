package com.questrail.muxbridge.internal.events;

import com.questrail.muxbridge.codec.Frame;

import java.time.Instant;
import java.util.Objects;

/**
 * A frame decoded from the front-end transport.
 */
public sealed interface FrameEvent extends BridgeEvent
        permits FrameEvent.FrameReceived
{
    final class FrameReceived extends BridgeEvent.Base implements FrameEvent {
        private final Frame frame;

        public FrameReceived(Instant timestamp, Frame frame) {
            super(timestamp);
            this.frame = Objects.requireNonNull(frame, "frame");
        }

        public Frame frame() {
            return frame;
        }
    }
}
