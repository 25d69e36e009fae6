package com.questrail.muxbridge.protocol;

/**
 * Machine-readable failure reasons attached to a channel {@code close}.
 */
public final class Problem
{
    public static final String ACCESS_DENIED = "access-denied";
    public static final String NO_HOST = "no-host";
    public static final String NOT_FOUND = "not-found";
    public static final String NOT_SUPPORTED = "not-supported";
    public static final String INTERNAL_ERROR = "internal-error";
    public static final String PROTOCOL_ERROR = "protocol-error";
    public static final String TERMINATED = "terminated";

    private Problem() {}
}
