package com.questrail.muxbridge.internal.events;

import java.time.Instant;

/**
 * TransportEvent
 * -----------------------------------------------------------------------------
 * Availability changes of the front-end transport.
 */
public sealed interface TransportEvent extends BridgeEvent
        permits TransportEvent.TransportUp, TransportEvent.TransportDown
{
    /** Transport became available; the bridge greets with {@code init}. */
    final class TransportUp extends BridgeEvent.Base implements TransportEvent {
        public TransportUp(Instant timestamp) {
            super(timestamp);
        }
    }

    /** Transport is gone; nothing more can be written. */
    final class TransportDown extends BridgeEvent.Base implements TransportEvent {
        private final Throwable cause;

        /**
         * @param cause the failure, or {@code null} for a clean end of stream
         */
        public TransportDown(Instant timestamp, Throwable cause) {
            super(timestamp);
            this.cause = cause;
        }

        public Throwable cause() {
            return cause;
        }
    }
}
