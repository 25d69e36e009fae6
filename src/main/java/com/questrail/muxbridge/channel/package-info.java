/**
 * Channel lifecycle: endpoints, the registry of open channels and the
 * per-channel outbound flow-control gate.
 */
package com.questrail.muxbridge.channel;
