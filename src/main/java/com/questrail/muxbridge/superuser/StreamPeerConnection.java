package com.questrail.muxbridge.superuser;

import com.questrail.muxbridge.codec.Frame;
import com.questrail.muxbridge.transport.FrameTransportListener;
import com.questrail.muxbridge.transport.stream.StreamFrameTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * StreamPeerConnection
 * =============================================================================
 * {@link PeerConnection} over the three standard streams of a peer.
 *
 * <p>Frames are read from the peer's stdout by a {@link StreamFrameTransport}.
 * A second thread drains stderr, logging each line and remembering the last
 * non-empty one as the peer's diagnostics. When stdout ends, the connection
 * waits for stderr to drain and for the exit status, then reports the exit.</p>
 */
public final class StreamPeerConnection implements PeerConnection
{
    private static final Logger log = LoggerFactory.getLogger(StreamPeerConnection.class);

    private static final long STDERR_DRAIN_MILLIS = 5000;

    /**
     * Source of the peer's exit status.
     */
    @FunctionalInterface
    public interface ExitStatus
    {
        int await() throws InterruptedException;
    }

    private final String label;
    private final StreamFrameTransport transport;
    private final InputStream stderr;
    private final ExitStatus exitStatus;
    private final Runnable terminate;

    private volatile String diagnostics;
    private Thread stderrReader;

    public StreamPeerConnection(String label,
                                InputStream stdout,
                                OutputStream stdin,
                                InputStream stderr,
                                ExitStatus exitStatus,
                                Runnable terminate)
    {
        this.label = Objects.requireNonNull(label, "label");
        this.transport = new StreamFrameTransport(stdout, stdin, "peer-" + label);
        this.stderr = Objects.requireNonNull(stderr, "stderr");
        this.exitStatus = Objects.requireNonNull(exitStatus, "exitStatus");
        this.terminate = Objects.requireNonNull(terminate, "terminate");
    }

    /**
     * Starts the reader threads. Call once, before any {@link #send}.
     */
    public void start(PeerListener listener)
    {
        Objects.requireNonNull(listener, "listener");

        stderrReader = new Thread(this::drainStderr, "peer-" + label + "-stderr");
        stderrReader.setDaemon(true);
        stderrReader.start();

        transport.setListener(new FrameTransportListener() {
            @Override
            public void onTransportUp() {
                log.debug("Peer {} started", label);
            }

            @Override
            public void onTransportDown(Throwable cause) {
                if (cause != null) {
                    log.debug("Peer {} output failed", label, cause);
                }
                // stop() reports down on the caller's thread, which must not block
                Thread reaper = new Thread(
                        () -> listener.onExit(StreamPeerConnection.this, awaitExit(), diagnostics),
                        "peer-" + label + "-exit");
                reaper.setDaemon(true);
                reaper.start();
            }

            @Override
            public void onFrame(Frame frame) {
                listener.onFrame(StreamPeerConnection.this, frame);
            }
        });
        transport.start();
    }

    @Override
    public String label()
    {
        return label;
    }

    @Override
    public void send(Frame frame)
    {
        transport.send(frame);
    }

    @Override
    public void stop()
    {
        terminate.run();
        transport.stop();
    }

    private int awaitExit()
    {
        try {
            stderrReader.join(STDERR_DRAIN_MILLIS);
            return exitStatus.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return -1;
        }
    }

    private void drainStderr()
    {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stderr, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                log.info("{}: {}", label, line);
                if (!line.isBlank()) {
                    diagnostics = line.strip();
                }
            }
        } catch (IOException e) {
            log.debug("Peer {} stderr closed", label, e);
        }
    }
}
