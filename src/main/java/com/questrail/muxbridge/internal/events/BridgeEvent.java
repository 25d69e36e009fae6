package com.questrail.muxbridge.internal.events;

import java.time.Instant;
import java.util.Objects;

/**
 * BridgeEvent
 * -----------------------------------------------------------------------------
 * Marker interface for everything the bridge's event loop processes.
 *
 * <h2>Role in the architecture</h2>
 * All session state (open channels, the internal bus, the superuser state
 * machine) is touched only by the driver thread, in response to events taken
 * one at a time from its queue. Reader threads of the front-end transport and
 * of spawned peers produce events; they never touch state themselves.
 *
 * <p>Events are immutable and carry only what is needed to advance state.</p>
 */
public interface BridgeEvent
{
    /**
     * Time at which the event was generated.
     */
    Instant timestamp();

    /**
     * Convenience base class for simple events.
     */
    abstract class Base implements BridgeEvent {
        private final Instant timestamp;

        protected Base(Instant timestamp) {
            this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        }

        @Override
        public Instant timestamp() {
            return timestamp;
        }
    }
}
