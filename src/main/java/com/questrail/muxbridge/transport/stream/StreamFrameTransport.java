package com.questrail.muxbridge.transport.stream;

import com.questrail.muxbridge.codec.Frame;
import com.questrail.muxbridge.codec.FrameDecoder;
import com.questrail.muxbridge.codec.FrameEncoder;
import com.questrail.muxbridge.codec.impl.DefaultFrameDecoder;
import com.questrail.muxbridge.codec.impl.DefaultFrameEncoder;
import com.questrail.muxbridge.transport.FrameTransport;
import com.questrail.muxbridge.transport.FrameTransportListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * StreamFrameTransport
 * =============================================================================
 * {@link FrameTransport} over a pair of blocking byte streams.
 *
 * <p>Used for the bridge's own stdin/stdout and for the stdio of a spawned
 * superuser peer. A dedicated reader thread decodes frames and hands them to
 * the listener; it does nothing else.</p>
 *
 * <h2>Lifecycle</h2>
 * <ul>
 *   <li>{@link #start()} reports transport up and starts the reader thread.</li>
 *   <li>End of input reports transport down with a {@code null} cause; a
 *       framing or I/O failure reports it with that failure.</li>
 *   <li>{@link #stop()} closes both streams, which also unblocks the reader.</li>
 * </ul>
 */
public final class StreamFrameTransport implements FrameTransport
{
    private static final Logger log = LoggerFactory.getLogger(StreamFrameTransport.class);

    private final InputStream in;
    private final OutputStream out;
    private final FrameDecoder decoder;
    private final FrameEncoder encoder;
    private final String name;

    private final Object writeLock = new Object();
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean down = new AtomicBoolean(false);

    private volatile FrameTransportListener listener;
    private volatile boolean outputBroken;

    public StreamFrameTransport(InputStream in, OutputStream out, String name)
    {
        this(in, out, new DefaultFrameDecoder(), new DefaultFrameEncoder(), name);
    }

    public StreamFrameTransport(InputStream in,
                                OutputStream out,
                                FrameDecoder decoder,
                                FrameEncoder encoder,
                                String name)
    {
        Objects.requireNonNull(in, "in");
        this.in = in instanceof BufferedInputStream ? in : new BufferedInputStream(in);
        this.out = Objects.requireNonNull(out, "out");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.name = Objects.requireNonNull(name, "name");
    }

    @Override
    public void setListener(FrameTransportListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void start()
    {
        FrameTransportListener l = requireListener();
        if (!started.compareAndSet(false, true)) {
            return;
        }

        l.onTransportUp();

        Thread reader = new Thread(() -> readLoop(l), name + "-reader");
        reader.setDaemon(true);
        reader.start();
    }

    @Override
    public void stop()
    {
        closeQuietly(out);
        closeQuietly(in);
        reportDown(null);
    }

    @Override
    public void send(Frame frame)
    {
        Objects.requireNonNull(frame, "frame");
        if (outputBroken || down.get()) {
            return;
        }

        byte[] bytes = encoder.encode(frame);
        synchronized (writeLock) {
            try {
                out.write(bytes);
                out.flush();
            } catch (IOException e) {
                // The reader will observe the same failure and report it.
                outputBroken = true;
                log.debug("{}: write failed, dropping further output", name, e);
            }
        }
    }

    private void readLoop(FrameTransportListener l)
    {
        Throwable cause = null;
        try {
            while (!down.get()) {
                Optional<Frame> frame = decoder.decode(in);
                if (frame.isEmpty()) {
                    break;
                }
                l.onFrame(frame.get());
            }
        } catch (IOException e) {
            if (!down.get()) {
                cause = e;
            }
        }
        reportDown(cause);
    }

    private void reportDown(Throwable cause)
    {
        if (down.compareAndSet(false, true)) {
            FrameTransportListener l = listener;
            if (l != null && started.get()) {
                l.onTransportDown(cause);
            }
        }
    }

    private FrameTransportListener requireListener()
    {
        FrameTransportListener l = listener;
        if (l == null) {
            throw new IllegalStateException("FrameTransportListener must be set before start()");
        }
        return l;
    }

    private void closeQuietly(AutoCloseable closeable)
    {
        try {
            closeable.close();
        } catch (Exception e) {
            log.debug("{}: close failed", name, e);
        }
    }
}
