package com.questrail.muxbridge.bus;

import com.fasterxml.jackson.databind.node.ArrayNode;

@FunctionalInterface
public interface BusMethodHandler
{
    /**
     * Handles a call whose arguments already match the declared input signature.
     *
     * @throws BusError to fail the call immediately
     */
    void invoke(ArrayNode args, BusCall call) throws BusError;
}
