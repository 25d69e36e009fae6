package com.questrail.muxbridge.channel;

import com.questrail.muxbridge.bus.InternalBusChannel;
import com.questrail.muxbridge.channel.types.EchoChannel;
import com.questrail.muxbridge.channel.types.NullChannel;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Payload type tag to endpoint factory.
 */
public final class ChannelTypeRegistry
{
    private final Map<String, ChannelFactory> factories = new LinkedHashMap<>();

    public ChannelTypeRegistry register(String payload, ChannelFactory factory)
    {
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(factory, "factory");
        if (factories.putIfAbsent(payload, factory) != null) {
            throw new IllegalArgumentException("Payload type already registered: " + payload);
        }
        return this;
    }

    public Optional<ChannelFactory> find(String payload)
    {
        return Optional.ofNullable(payload == null ? null : factories.get(payload));
    }

    public Set<String> payloads()
    {
        return Set.copyOf(factories.keySet());
    }

    /**
     * The payload types every bridge offers: {@code echo}, {@code null} and {@code dbus-json3}.
     */
    public static ChannelTypeRegistry defaults()
    {
        return new ChannelTypeRegistry()
                .register(EchoChannel.PAYLOAD, EchoChannel::new)
                .register(NullChannel.PAYLOAD, NullChannel::new)
                .register(InternalBusChannel.PAYLOAD, InternalBusChannel::new);
    }
}
