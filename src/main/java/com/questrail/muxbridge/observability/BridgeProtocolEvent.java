package com.questrail.muxbridge.observability;

import java.time.Instant;

/**
 * Record representing a notable but non-fatal protocol occurrence.
 */
public record BridgeProtocolEvent(
    Instant timestamp,
    String description
) {
}
