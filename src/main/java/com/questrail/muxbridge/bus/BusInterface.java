package com.questrail.muxbridge.bus;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.muxbridge.util.Jsons;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * BusInterface
 * =============================================================================
 * Explicit descriptor table of one exported interface.
 *
 * <p>The same table drives dispatch and introspection: {@link #describe()}
 * renders it as the {@code meta} document sent on first watch. Entries keep
 * their declaration order.</p>
 *
 * <pre>
 * BusInterface.builder("test.iface")
 *     .method("GetProp", List.of(), List.of("s"), (args, call) -&gt; call.reply(...))
 *     .property("Prop", "s", () -&gt; ...)
 *     .signal("Sig", "s")
 *     .build();
 * </pre>
 */
public final class BusInterface
{
    private final String name;
    private final Map<String, BusMethod> methods;
    private final Map<String, BusProperty> properties;
    private final Map<String, BusSignal> signals;

    private BusInterface(Builder b)
    {
        this.name = b.name;
        this.methods = Collections.unmodifiableMap(new LinkedHashMap<>(b.methods));
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(b.properties));
        this.signals = Collections.unmodifiableMap(new LinkedHashMap<>(b.signals));
    }

    public static Builder builder(String name)
    {
        return new Builder(name);
    }

    public String name()
    {
        return name;
    }

    public Optional<BusMethod> method(String method)
    {
        return Optional.ofNullable(methods.get(method));
    }

    public Optional<BusProperty> property(String property)
    {
        return Optional.ofNullable(properties.get(property));
    }

    public Optional<BusSignal> signal(String signal)
    {
        return Optional.ofNullable(signals.get(signal));
    }

    public Map<String, BusProperty> properties()
    {
        return properties;
    }

    /**
     * Current values of all properties, unwrapped (as carried by {@code notify}).
     */
    public ObjectNode snapshot()
    {
        ObjectNode values = Jsons.object();
        for (BusProperty p : properties.values()) {
            values.set(p.name(), p.getter().get());
        }
        return values;
    }

    public ObjectNode describe()
    {
        ObjectNode meta = Jsons.object();

        ObjectNode m = meta.putObject("methods");
        for (BusMethod method : methods.values()) {
            ObjectNode entry = m.putObject(method.name());
            entry.set("in", signatures(method.in()));
            entry.set("out", signatures(method.out()));
        }

        ObjectNode p = meta.putObject("properties");
        for (BusProperty property : properties.values()) {
            ObjectNode entry = p.putObject(property.name());
            entry.put("flags", property.flags());
            entry.put("type", property.type());
        }

        ObjectNode s = meta.putObject("signals");
        for (BusSignal signal : signals.values()) {
            s.putObject(signal.name()).set("in", signatures(signal.args()));
        }
        return meta;
    }

    private static ArrayNode signatures(List<String> types)
    {
        ArrayNode array = Jsons.array();
        types.forEach(array::add);
        return array;
    }

    public static final class Builder
    {
        private final String name;
        private final Map<String, BusMethod> methods = new LinkedHashMap<>();
        private final Map<String, BusProperty> properties = new LinkedHashMap<>();
        private final Map<String, BusSignal> signals = new LinkedHashMap<>();

        private Builder(String name)
        {
            this.name = Objects.requireNonNull(name, "name");
        }

        public Builder method(String method, List<String> in, List<String> out, BusMethodHandler handler)
        {
            methods.put(method, new BusMethod(method, in, out, handler));
            return this;
        }

        public Builder property(String property, String type, Supplier<JsonNode> getter)
        {
            properties.put(property, new BusProperty(property, type, getter, null));
            return this;
        }

        public Builder writableProperty(String property, String type,
                                        Supplier<JsonNode> getter, PropertySetter setter)
        {
            properties.put(property, new BusProperty(property, type, getter,
                    Objects.requireNonNull(setter, "setter")));
            return this;
        }

        public Builder signal(String signal, String... args)
        {
            signals.put(signal, new BusSignal(signal, List.of(args)));
            return this;
        }

        public BusInterface build()
        {
            return new BusInterface(this);
        }
    }
}
