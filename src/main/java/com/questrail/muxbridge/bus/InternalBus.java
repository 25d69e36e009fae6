package com.questrail.muxbridge.bus;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.muxbridge.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * InternalBus
 * =============================================================================
 * In-process object bus with D-Bus call, property and signal semantics.
 *
 * <p>Objects are exported by path; each carries one or more
 * {@link BusInterface} tables. Clients (bus channels) call methods, watch
 * interfaces for property changes and subscribe to signals.</p>
 *
 * <h2>Delivery</h2>
 * <ul>
 *   <li>{@link #propertiesChanged} calls every matching watcher before it
 *       returns, so a notify is always sent ahead of the reply of the call
 *       that caused the change.</li>
 *   <li>{@code org.freedesktop.DBus.Properties} is answered by the bus itself
 *       for every exported interface.</li>
 * </ul>
 *
 * <p>Not thread-safe; owned by the driver thread.</p>
 */
public final class InternalBus
{
    public static final String PROPERTIES_INTERFACE = "org.freedesktop.DBus.Properties";

    private static final Logger log = LoggerFactory.getLogger(InternalBus.class);

    private record Exported(BusObject object, Map<String, BusInterface> interfaces) {}

    private record Watch(BusClient client, String path, String iface) {}

    private record Match(BusClient client, String path, String iface, String member)
    {
        boolean accepts(String p, String i, String m)
        {
            return (path == null || path.equals(p))
                    && (iface == null || iface.equals(i))
                    && (member == null || member.equals(m));
        }
    }

    /**
     * Result of a successful {@link #watch}.
     *
     * @param descriptor the watched interface
     * @param snapshot   current property values, unwrapped
     */
    public record WatchResult(BusInterface descriptor, ObjectNode snapshot) {}

    private final Map<String, Exported> objects = new LinkedHashMap<>();
    private final List<Watch> watches = new ArrayList<>();
    private final List<Match> matches = new ArrayList<>();

    // ---------------------------------------------------------------------
    // Export
    // ---------------------------------------------------------------------

    public void export(String path, BusObject object)
    {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(object, "object");
        if (objects.containsKey(path)) {
            throw new IllegalArgumentException("Path already exported: " + path);
        }

        Map<String, BusInterface> interfaces = new LinkedHashMap<>();
        for (BusInterface iface : object.interfaces()) {
            interfaces.put(iface.name(), iface);
        }
        object.attach(this, path);
        objects.put(path, new Exported(object, interfaces));
        log.debug("Exported {} with {}", path, interfaces.keySet());
    }

    public void unexport(String path)
    {
        Exported removed = objects.remove(path);
        if (removed != null) {
            removed.object().detach();
        }
    }

    public Optional<BusInterface> descriptor(String path, String iface)
    {
        Exported exported = objects.get(path);
        return Optional.ofNullable(exported == null ? null : exported.interfaces().get(iface));
    }

    // ---------------------------------------------------------------------
    // Calls
    // ---------------------------------------------------------------------

    /**
     * Dispatches one method call. The outcome, immediate or later, is
     * delivered through {@code call}.
     */
    public void call(String path, String iface, String method, ArrayNode args, BusCall call)
    {
        try {
            if (PROPERTIES_INTERFACE.equals(iface)) {
                callProperties(path, method, args, call);
                return;
            }
            BusInterface descriptor = resolve(path, iface);
            BusMethod target = descriptor.method(method)
                    .orElseThrow(() -> BusError.unknownMethod(iface, method));
            Signatures.check(target.in(), args);
            target.handler().invoke(args, call);
        } catch (BusError e) {
            call.fail(e);
        }
    }

    private void callProperties(String path, String method, ArrayNode args, BusCall call) throws BusError
    {
        switch (method) {
            case "Get": {
                Signatures.check(List.of("s", "s"), args);
                BusProperty property = property(path, args.get(0).asText(), args.get(1).asText());
                call.reply(Signatures.variant(property.type(), property.getter().get()));
                break;
            }
            case "GetAll": {
                Signatures.check(List.of("s"), args);
                BusInterface descriptor = resolve(path, args.get(0).asText());
                ObjectNode all = Jsons.object();
                for (BusProperty property : descriptor.properties().values()) {
                    all.set(property.name(), Signatures.variant(property.type(), property.getter().get()));
                }
                call.reply(all);
                break;
            }
            case "Set": {
                Signatures.check(List.of("s", "s", "v"), args);
                String iface = args.get(0).asText();
                BusProperty property = property(path, iface, args.get(1).asText());
                if (!property.writable()) {
                    throw BusError.readOnly(iface, property.name());
                }
                JsonNode value = args.get(2).get("v");
                if (!Signatures.matches(property.type(), value)) {
                    throw BusError.invalidArgs("Value does not match type '" + property.type() + "'");
                }
                property.setter().set(value);
                call.reply();
                break;
            }
            default:
                throw BusError.unknownMethod(PROPERTIES_INTERFACE, method);
        }
    }

    // ---------------------------------------------------------------------
    // Watches and matches
    // ---------------------------------------------------------------------

    public WatchResult watch(BusClient client, String path, String iface) throws BusError
    {
        BusInterface descriptor = resolve(path, iface);
        Watch watch = new Watch(client, path, iface);
        if (!watches.contains(watch)) {
            watches.add(watch);
        }
        return new WatchResult(descriptor, descriptor.snapshot());
    }

    public void unwatch(BusClient client, String path, String iface)
    {
        watches.remove(new Watch(client, path, iface));
    }

    /**
     * Subscribes {@code client} to signals. {@code null} fields match anything.
     */
    public void addMatch(BusClient client, String path, String iface, String member)
    {
        matches.add(new Match(client, path, iface, member));
    }

    public void removeMatch(BusClient client, String path, String iface, String member)
    {
        matches.remove(new Match(client, path, iface, member));
    }

    /**
     * Drops every watch and match held by {@code client}.
     */
    public void detach(BusClient client)
    {
        watches.removeIf(w -> w.client() == client);
        matches.removeIf(m -> m.client() == client);
    }

    public int watchCount()
    {
        return watches.size();
    }

    // ---------------------------------------------------------------------
    // Delivery (from BusObject)
    // ---------------------------------------------------------------------

    void propertiesChanged(String path, String iface, ObjectNode changed)
    {
        for (Watch watch : List.copyOf(watches)) {
            if (watch.path().equals(path) && watch.iface().equals(iface)) {
                watch.client().busNotify(path, iface, changed.deepCopy());
            }
        }
    }

    void emitSignal(String path, String iface, String member, ArrayNode args)
    {
        for (Match match : List.copyOf(matches)) {
            if (match.accepts(path, iface, member)) {
                match.client().busSignal(path, iface, member, args.deepCopy());
            }
        }
    }

    private BusInterface resolve(String path, String iface) throws BusError
    {
        Exported exported = objects.get(path);
        if (exported == null) {
            throw BusError.unknownObject(path);
        }
        BusInterface descriptor = exported.interfaces().get(iface);
        if (descriptor == null) {
            throw BusError.unknownInterface(path, iface);
        }
        return descriptor;
    }

    private BusProperty property(String path, String iface, String name) throws BusError
    {
        return resolve(path, iface).property(name)
                .orElseThrow(() -> BusError.unknownProperty(iface, name));
    }
}
