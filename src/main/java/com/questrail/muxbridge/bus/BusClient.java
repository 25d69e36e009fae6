package com.questrail.muxbridge.bus;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Receiver of watch notifications and matched signals.
 */
public interface BusClient
{
    /**
     * @param changed property name to new (unwrapped) value
     */
    void busNotify(String path, String iface, ObjectNode changed);

    void busSignal(String path, String iface, String member, ArrayNode args);
}
