package com.questrail.muxbridge.bus;

import java.util.List;
import java.util.Objects;

public record BusMethod(String name, List<String> in, List<String> out, BusMethodHandler handler)
{
    public BusMethod {
        Objects.requireNonNull(name, "name");
        in = List.copyOf(in);
        out = List.copyOf(out);
        Objects.requireNonNull(handler, "handler");
    }
}
