package com.questrail.muxbridge.observability;

import com.questrail.muxbridge.channel.ChannelState;

import java.time.Instant;

/**
 * Record describing one channel lifecycle transition.
 *
 * @param problem the problem code when the transition is a failing close, else {@code null}
 */
public record ChannelTransitionEvent(
    Instant timestamp,
    String channel,
    String payload,
    ChannelState from,
    ChannelState to,
    String problem
) {
}
