package com.questrail.muxbridge.channel;

import com.fasterxml.jackson.databind.JsonNode;
import com.questrail.muxbridge.protocol.ProtocolException;

/**
 * Value of the {@code superuser} field of an {@code open} request.
 */
public enum SuperuserMode {
    /** Open locally. */
    NONE,

    /** Route to the superuser peer when one is running, else open locally. */
    TRY,

    /** Route to the superuser peer or fail with {@code access-denied}. */
    REQUIRE;

    public static SuperuserMode parse(JsonNode value) {
        if (value == null || value.isNull()) {
            return NONE;
        }
        if (value.isBoolean()) {
            return value.booleanValue() ? REQUIRE : NONE;
        }
        if (value.isTextual()) {
            switch (value.asText()) {
                case "require":
                    return REQUIRE;
                case "try":
                    return TRY;
                case "none":
                    return NONE;
                default:
                    break;
            }
        }
        throw new ProtocolException("invalid superuser value: " + value);
    }
}
