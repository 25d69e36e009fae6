package com.questrail.muxbridge.internal.exec;

import com.questrail.muxbridge.internal.events.BridgeEvent;
import com.questrail.muxbridge.internal.events.TaskEvent;
import com.questrail.muxbridge.observability.BridgeErrorEvent;
import com.questrail.muxbridge.observability.BridgeObservabilitySink;
import com.questrail.muxbridge.observability.NullObservabilitySink;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * BridgeDriver
 * =============================================================================
 * Serialized event loop of one bridge session.
 *
 * <h2>Threading Model</h2>
 * The driver runs a single event-processing thread. Transport and peer reader
 * threads submit events to a queue, which the loop drains one at a time into
 * the {@link BridgeEventHandler}. This ensures:
 * <ul>
 *   <li>No concurrent modification of session state</li>
 *   <li>Per-source event ordering is preserved</li>
 * </ul>
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   driver.start()           → starts event loop thread
 *   driver.submitEvent(...)  → enqueues event for processing
 *   driver.stop()            → stops the loop (safe from the loop thread itself)
 * </pre>
 *
 * <p>An exception escaping the handler is reported to the observability sink
 * and the loop carries on with the next event.</p>
 */
public final class BridgeDriver {

    private final BridgeEventHandler handler;
    private final BridgeObservabilitySink observabilitySink;
    private final String threadName;

    private final BlockingQueue<BridgeEvent> eventQueue = new LinkedBlockingQueue<>();
    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile Thread eventLoopThread;

    public BridgeDriver(BridgeEventHandler handler,
                        BridgeObservabilitySink observabilitySink,
                        String threadName)
    {
        this.handler = Objects.requireNonNull(handler, "handler");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
        this.threadName = Objects.requireNonNull(threadName, "threadName");
    }

    /**
     * Starts the event loop thread.
     * Idempotent: calling start() multiple times has no effect after the first call.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            eventLoopThread = new Thread(this::runEventLoop, threadName);
            eventLoopThread.start();
        }
    }

    /**
     * Stops the event loop. Events still queued are discarded.
     * Called from another thread, blocks until the loop thread terminates.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            Thread loop = eventLoopThread;
            if (loop == null || loop == Thread.currentThread()) {
                return;
            }
            loop.interrupt();
            try {
                loop.join(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public boolean isDriverThread() {
        return Thread.currentThread() == eventLoopThread;
    }

    /**
     * Waits for the loop thread to finish.
     *
     * @return {@code true} if it finished within the timeout
     */
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        Thread loop = eventLoopThread;
        if (loop == null) {
            return true;
        }
        loop.join(unit.toMillis(timeout));
        return !loop.isAlive();
    }

    /**
     * Submits an event for processing.
     * Events are processed sequentially in submission order; events submitted
     * while the driver is not running are dropped.
     *
     * @param event the event to process (must not be null)
     */
    public void submitEvent(BridgeEvent event) {
        Objects.requireNonNull(event, "event");
        if (running.get()) {
            eventQueue.offer(event);
        }
    }

    /**
     * Runs {@code task} on the loop thread.
     *
     * @return completes when the task has run, exceptionally if it threw or
     *         the driver is not running
     */
    public CompletableFuture<Void> execute(Runnable task) {
        CompletableFuture<Void> completion = new CompletableFuture<>();
        if (!running.get()) {
            completion.completeExceptionally(new IllegalStateException("driver is not running"));
            return completion;
        }
        submitEvent(new TaskEvent(Instant.now(), task, completion));
        return completion;
    }

    /**
     * Main event loop - runs on dedicated thread.
     */
    private void runEventLoop() {
        while (running.get()) {
            try {
                BridgeEvent event = eventQueue.take(); // Blocks until event available
                if (running.get()) {
                    handler.handle(event);
                }
            } catch (InterruptedException e) {
                // Expected during shutdown
                if (running.get()) {
                    Thread.currentThread().interrupt();
                }
            } catch (Exception e) {
                observabilitySink.onError(new BridgeErrorEvent(
                    Instant.now(),
                    "Event processing error",
                    e
                ));
            }
        }
        eventQueue.clear();
    }
}
