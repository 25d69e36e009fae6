package com.questrail.muxbridge.observability;

import java.time.Instant;

/**
 * Record describing a change of the superuser {@code Current} value.
 */
public record SuperuserTransitionEvent(
    Instant timestamp,
    String from,
    String to
) {
}
