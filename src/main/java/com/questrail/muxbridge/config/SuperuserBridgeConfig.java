package com.questrail.muxbridge.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;
import java.util.Objects;

/**
 * One candidate superuser peer.
 *
 * @param label      name shown in {@code Bridges} and passed to {@code Start}
 * @param spawn      argv of the peer process
 * @param environ    {@code KEY=VALUE} entries added to the inherited environment
 * @param privileged whether the peer runs with elevated privileges
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SuperuserBridgeConfig(
    String label,
    List<String> spawn,
    List<String> environ,
    boolean privileged
) {
    public SuperuserBridgeConfig {
        Objects.requireNonNull(label, "label");
        if (label.isEmpty()) {
            throw new IllegalArgumentException("label must not be empty");
        }
        if (spawn == null || spawn.isEmpty()) {
            throw new IllegalArgumentException("spawn must name a command for " + label);
        }
        spawn = List.copyOf(spawn);
        environ = environ == null ? List.of() : List.copyOf(environ);
    }
}
