package com.questrail.muxbridge.channel.types;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.muxbridge.channel.AbstractChannel;
import com.questrail.muxbridge.channel.ChannelContext;

/**
 * Discards all data. Closes when the front end closes.
 */
public final class NullChannel extends AbstractChannel
{
    public static final String PAYLOAD = "null";

    public NullChannel(ChannelContext context)
    {
        super(context);
    }

    @Override
    protected void doOpen(ObjectNode options)
    {
        ready();
    }
}
