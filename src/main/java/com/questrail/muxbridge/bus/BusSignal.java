package com.questrail.muxbridge.bus;

import java.util.List;
import java.util.Objects;

public record BusSignal(String name, List<String> args)
{
    public BusSignal {
        Objects.requireNonNull(name, "name");
        args = List.copyOf(args);
    }
}
