package com.questrail.muxbridge.channel;

/**
 * Lifecycle of one channel.
 *
 * <pre>
 *   OPENING → READY → ACTIVE → DONE_RECEIVED / DONE_SENT → CLOSED
 *   OPENING → CLOSED                  (failed open, never READY)
 * </pre>
 */
public enum ChannelState {
    /** Endpoint is being constructed and may still fail. */
    OPENING,

    /** Endpoint accepted the open; data may flow. */
    READY,

    /** At least one data frame has flowed. */
    ACTIVE,

    /** The front end signalled end of its stream. */
    DONE_RECEIVED,

    /** The endpoint signalled end of its stream. */
    DONE_SENT,

    /** Terminal; the id is released once the close frame is written. */
    CLOSED
}
