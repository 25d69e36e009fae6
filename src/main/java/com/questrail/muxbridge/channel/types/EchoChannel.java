package com.questrail.muxbridge.channel.types;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.muxbridge.channel.AbstractChannel;
import com.questrail.muxbridge.channel.ChannelContext;

/**
 * Sends every data frame straight back. On {@code done} it answers
 * {@code done} and closes.
 */
public final class EchoChannel extends AbstractChannel
{
    public static final String PAYLOAD = "echo";

    public EchoChannel(ChannelContext context)
    {
        super(context);
    }

    @Override
    protected void doOpen(ObjectNode options)
    {
        ready();
    }

    @Override
    protected void doData(byte[] data)
    {
        sendData(data);
    }

    @Override
    protected void doDone()
    {
        done();
        close(null);
    }
}
