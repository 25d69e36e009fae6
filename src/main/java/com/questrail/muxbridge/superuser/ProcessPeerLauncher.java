package com.questrail.muxbridge.superuser;

import com.questrail.muxbridge.config.SuperuserBridgeConfig;
import com.questrail.muxbridge.login.LoginMessages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;

/**
 * Spawns superuser peers as operating system processes.
 */
public final class ProcessPeerLauncher implements PeerLauncher
{
    private static final Logger log = LoggerFactory.getLogger(ProcessPeerLauncher.class);

    @Override
    public PeerConnection launch(SuperuserBridgeConfig config,
                                 Map<String, String> environment,
                                 PeerListener listener) throws IOException
    {
        ProcessBuilder builder = new ProcessBuilder(config.spawn());
        Map<String, String> env = builder.environment();
        env.clear();
        env.putAll(environment);
        env.remove(LoginMessages.ENVIRONMENT_VARIABLE);
        for (String entry : config.environ()) {
            int eq = entry.indexOf('=');
            if (eq <= 0) {
                log.warn("Ignoring malformed environment entry for {}: {}", config.label(), entry);
                continue;
            }
            env.put(entry.substring(0, eq), entry.substring(eq + 1));
        }

        log.info("Starting superuser bridge {}: {}", config.label(), config.spawn());
        Process process = builder.start();

        StreamPeerConnection connection = new StreamPeerConnection(
                config.label(),
                process.getInputStream(),
                process.getOutputStream(),
                process.getErrorStream(),
                process::waitFor,
                process::destroy);
        connection.start(listener);
        return connection;
    }
}
