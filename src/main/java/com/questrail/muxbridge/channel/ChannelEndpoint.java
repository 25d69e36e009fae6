package com.questrail.muxbridge.channel;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * ChannelEndpoint
 * -----------------------------------------------------------------------------
 * Uniform capability set of one open channel.
 *
 * <p>Every payload type, and the proxy for channels routed to the superuser
 * peer, implements this interface. The router and registry only ever talk to
 * channels through it, so adding a payload type is a registry entry and never
 * a router change.</p>
 *
 * <p>All methods are invoked on the driver thread.</p>
 */
public interface ChannelEndpoint
{
    String id();

    String payload();

    /** Group named in the {@code open} request, or {@code null}. */
    String group();

    ChannelState state();

    /**
     * Starts the endpoint. On success the endpoint has sent, or will later
     * send, {@code ready}.
     *
     * @throws ChannelOpenException if the endpoint cannot open; nothing has been sent
     */
    void open() throws ChannelOpenException;

    void receiveData(byte[] data);

    void receiveDone();

    /**
     * The front end closed the channel.
     *
     * @param problem problem code sent by the front end, or {@code null}
     */
    void receiveClose(String problem);

    void receivePing(ObjectNode message);

    /** Holds back outbound frames of this channel until {@link #thaw()}. */
    void freeze();

    /** Releases held frames in order and resumes passthrough. */
    void thaw();

    boolean isFrozen();

    /**
     * Closes the channel from the bridge side, sending {@code close} to the front end.
     *
     * @param problem problem code, or {@code null} for a clean close
     */
    void close(String problem);

    /**
     * Releases the endpoint without writing anything. Used when the transport is gone.
     */
    void abandon();
}
