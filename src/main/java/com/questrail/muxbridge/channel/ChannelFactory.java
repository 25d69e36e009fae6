package com.questrail.muxbridge.channel;

/**
 * Creates the endpoint for one {@code open} request.
 */
@FunctionalInterface
public interface ChannelFactory
{
    /**
     * @throws ChannelOpenException if the request's options are unacceptable
     */
    ChannelEndpoint create(ChannelContext context) throws ChannelOpenException;
}
