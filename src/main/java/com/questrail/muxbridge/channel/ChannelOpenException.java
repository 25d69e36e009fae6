package com.questrail.muxbridge.channel;

import java.util.Objects;

/**
 * An endpoint refused to open.
 *
 * <p>The registry turns this into a {@code close} carrying {@link #problem()}
 * and the detail message. It never reaches the session.</p>
 */
public class ChannelOpenException extends Exception
{
    private final String problem;

    public ChannelOpenException(String problem, String message) {
        super(message);
        this.problem = Objects.requireNonNull(problem, "problem");
    }

    public String problem() {
        return problem;
    }
}
