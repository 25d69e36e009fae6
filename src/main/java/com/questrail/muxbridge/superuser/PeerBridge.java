package com.questrail.muxbridge.superuser;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.muxbridge.codec.Frame;
import com.questrail.muxbridge.util.Jsons;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A running (or starting) peer and the channels routed to it.
 *
 * <p>The peer has its own channel-id namespace. Ids on the peer side are
 * allocated here ({@code su1}, {@code su2}, ...) and translated at this
 * boundary in both directions.</p>
 */
final class PeerBridge
{
    private static final String ID_PREFIX = "su";

    private final PeerConnection connection;
    private final Map<String, PeerRoutedChannel> byPeerId = new LinkedHashMap<>();
    private long nextId;
    private boolean initialized;

    PeerBridge(PeerConnection connection)
    {
        this.connection = Objects.requireNonNull(connection, "connection");
    }

    PeerConnection connection()
    {
        return connection;
    }

    String label()
    {
        return connection.label();
    }

    boolean isInitialized()
    {
        return initialized;
    }

    void markInitialized()
    {
        initialized = true;
    }

    String allocate(PeerRoutedChannel channel)
    {
        String peerId = ID_PREFIX + (++nextId);
        byPeerId.put(peerId, channel);
        return peerId;
    }

    Optional<PeerRoutedChannel> routed(String peerId)
    {
        return Optional.ofNullable(peerId == null ? null : byPeerId.get(peerId));
    }

    void forget(String peerId)
    {
        byPeerId.remove(peerId);
    }

    List<PeerRoutedChannel> channels()
    {
        return new ArrayList<>(byPeerId.values());
    }

    void sendControl(ObjectNode message)
    {
        connection.send(Frame.control(Jsons.toBytes(message)));
    }

    void sendData(String peerId, byte[] data)
    {
        connection.send(new Frame(peerId, data));
    }
}
