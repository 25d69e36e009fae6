package com.questrail.muxbridge.bus;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Completion handle of one method call.
 *
 * <p>Exactly one of {@link #reply} or {@link #fail} takes effect; later
 * completions are ignored. A handler may keep the handle and complete it from
 * a later driver task, which is how {@code Start} waits for the peer.</p>
 */
public interface BusCall
{
    void reply(JsonNode... values);

    void fail(BusError error);

    boolean isCompleted();
}
