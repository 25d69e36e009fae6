package com.questrail.muxbridge.internal.exec;

import com.questrail.muxbridge.internal.events.BridgeEvent;

/**
 * Consumer of driver events; always invoked on the driver thread.
 */
@FunctionalInterface
public interface BridgeEventHandler
{
    void handle(BridgeEvent event);
}
