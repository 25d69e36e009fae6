package com.questrail.muxbridge.bus;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.muxbridge.util.Jsons;

import java.util.List;

/**
 * Base class for objects exported on the {@link InternalBus}.
 *
 * <p>Subclasses describe themselves with {@link BusInterface} tables and call
 * {@link #propertiesChanged} after every property mutation, which pushes the
 * new values to watchers before returning.</p>
 */
public abstract class BusObject
{
    private InternalBus bus;
    private String path;

    protected abstract List<BusInterface> interfaces();

    final void attach(InternalBus bus, String path)
    {
        if (this.bus != null) {
            throw new IllegalStateException("Object already exported at " + this.path);
        }
        this.bus = bus;
        this.path = path;
    }

    final void detach()
    {
        this.bus = null;
        this.path = null;
    }

    /** Export path, or {@code null} when not exported. */
    public final String path()
    {
        return path;
    }

    protected final void propertiesChanged(String iface, String... names)
    {
        if (bus == null) {
            return;
        }
        BusInterface descriptor = bus.descriptor(path, iface).orElseThrow(
                () -> new IllegalArgumentException("Not an interface of " + path + ": " + iface));
        ObjectNode changed = Jsons.object();
        for (String name : names) {
            BusProperty property = descriptor.property(name).orElseThrow(
                    () -> new IllegalArgumentException("No property " + name + " on " + iface));
            changed.set(name, property.getter().get());
        }
        bus.propertiesChanged(path, iface, changed);
    }

    protected final void emitSignal(String iface, String signal, JsonNode... args)
    {
        if (bus == null) {
            return;
        }
        ArrayNode array = Jsons.array();
        for (JsonNode arg : args) {
            array.add(arg);
        }
        bus.emitSignal(path, iface, signal, array);
    }
}
