package com.questrail.muxbridge.superuser;

import com.questrail.muxbridge.config.SuperuserBridgeConfig;

import java.io.IOException;
import java.util.Map;

/**
 * Starts superuser peers.
 */
@FunctionalInterface
public interface PeerLauncher
{
    /**
     * Spawns the peer described by {@code config} and starts reading its output.
     *
     * @param environment base environment; {@code config.environ()} is applied on top
     * @throws IOException if the peer could not be started
     */
    PeerConnection launch(SuperuserBridgeConfig config,
                          Map<String, String> environment,
                          PeerListener listener) throws IOException;
}
