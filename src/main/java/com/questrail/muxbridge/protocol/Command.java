package com.questrail.muxbridge.protocol;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Control commands understood on the control channel.
 */
public enum Command
{
    INIT("init"),
    OPEN("open"),
    READY("ready"),
    DONE("done"),
    CLOSE("close"),
    PING("ping"),
    PONG("pong"),
    KILL("kill"),
    AUTHORIZE("authorize"),
    SUPERUSER_INIT_DONE("superuser-init-done");

    private static final Map<String, Command> BY_WIRE_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(Command::wireName, Function.identity()));

    private final String wireName;

    Command(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static Optional<Command> fromWireName(String name) {
        return Optional.ofNullable(name == null ? null : BY_WIRE_NAME.get(name));
    }
}
