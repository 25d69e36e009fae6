package com.questrail.muxbridge.bus;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * @param setter {@code null} for a read-only property
 */
public record BusProperty(String name, String type, Supplier<JsonNode> getter, PropertySetter setter)
{
    public BusProperty {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(getter, "getter");
    }

    public boolean writable()
    {
        return setter != null;
    }

    public String flags()
    {
        return writable() ? "rw" : "r";
    }
}
