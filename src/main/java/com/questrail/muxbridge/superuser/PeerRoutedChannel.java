package com.questrail.muxbridge.superuser;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.muxbridge.channel.AbstractChannel;
import com.questrail.muxbridge.channel.ChannelContext;
import com.questrail.muxbridge.protocol.Command;
import com.questrail.muxbridge.protocol.ControlMessages;

/**
 * Local stand-in for a channel that lives inside the superuser peer.
 *
 * <p>Everything the front end sends is forwarded to the peer under the
 * peer-side id; everything the peer sends for that id is relayed back. The
 * lifecycle seen by the front end is the one the peer drives, so a
 * front-end {@code close} is only forwarded and completes when the peer
 * answers with its own {@code close}. When the bridge closes the channel
 * itself, as {@code kill} does, the peer is told with a {@code close} of its
 * own unless the whole peer is being torn down.</p>
 */
final class PeerRoutedChannel extends AbstractChannel
{
    private final PeerBridge peer;
    private String peerId;
    private boolean detached;

    PeerRoutedChannel(ChannelContext context, PeerBridge peer)
    {
        super(context);
        this.peer = peer;
    }

    String peerId()
    {
        return peerId;
    }

    @Override
    protected void doOpen(ObjectNode options)
    {
        peerId = peer.allocate(this);
        ObjectNode open = options.deepCopy();
        open.remove("host");
        open.remove("superuser");
        open.put("channel", peerId);
        peer.sendControl(open);
    }

    @Override
    protected void doData(byte[] data)
    {
        peer.sendData(peerId, data);
    }

    @Override
    protected void doDone()
    {
        peer.sendControl(ControlMessages.forChannel(Command.DONE, peerId));
    }

    @Override
    protected void doClose(String problem)
    {
        peer.sendControl(ControlMessages.close(peerId, problem, null));
    }

    @Override
    public void receivePing(ObjectNode message)
    {
        if (isClosed()) {
            return;
        }
        ObjectNode ping = message.deepCopy();
        ping.put("channel", peerId);
        peer.sendControl(ping);
    }

    @Override
    protected void onLocalClose(String problem)
    {
        if (!detached) {
            peer.sendControl(ControlMessages.close(peerId, problem, null));
        }
    }

    @Override
    protected void onClosing()
    {
        peer.forget(peerId);
    }

    /** The peer is going away; closing no longer concerns it. */
    void detach()
    {
        detached = true;
    }

    /** Data the peer sent on this channel. */
    void fromPeer(byte[] data)
    {
        sendData(data);
    }

    /** A control message the peer sent for this channel. */
    void fromPeer(ObjectNode message)
    {
        relayControl(message);
    }
}
