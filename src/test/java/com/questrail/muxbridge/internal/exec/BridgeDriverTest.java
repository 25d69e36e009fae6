package com.questrail.muxbridge.internal.exec;

import com.questrail.muxbridge.internal.events.BridgeEvent;
import com.questrail.muxbridge.internal.events.TaskEvent;
import com.questrail.muxbridge.internal.events.TransportEvent;
import com.questrail.muxbridge.observability.BridgeErrorEvent;
import com.questrail.muxbridge.observability.RecordingObservabilitySink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * BridgeDriverTest
 * -----------------------------------------------------------------------------
 * Ordering, error isolation and shutdown of the session event loop.
 */
class BridgeDriverTest
{
    private final List<BridgeEvent> handled = new CopyOnWriteArrayList<>();
    private final RecordingObservabilitySink sink = new RecordingObservabilitySink();

    private final BridgeDriver driver = new BridgeDriver(event -> {
        if (event instanceof TaskEvent) {
            ((TaskEvent) event).run();
        }
        else {
            handled.add(event);
        }
    }, sink, "test-driver");

    @AfterEach
    void tearDown()
    {
        driver.stop();
    }

    @Test
    void processesEventsInSubmissionOrder() throws Exception
    {
        driver.start();
        TransportEvent.TransportUp up = new TransportEvent.TransportUp(Instant.now());
        TransportEvent.TransportDown down = new TransportEvent.TransportDown(Instant.now(), null);

        driver.submitEvent(up);
        driver.submitEvent(down);
        driver.execute(() -> {}).get(5, TimeUnit.SECONDS);

        assertEquals(List.of(up, down), handled);
    }

    @Test
    void executeRunsOnLoopThread() throws Exception
    {
        driver.start();
        AtomicBoolean onLoop = new AtomicBoolean();

        driver.execute(() -> onLoop.set(driver.isDriverThread())).get(5, TimeUnit.SECONDS);

        assertTrue(onLoop.get());
        assertFalse(driver.isDriverThread());
    }

    @Test
    void failingTaskIsReportedAndLoopContinues() throws Exception
    {
        driver.start();

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> driver.execute(() -> {
                    throw new IllegalStateException("boom");
                }).get(5, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, e.getCause());

        driver.execute(() -> {}).get(5, TimeUnit.SECONDS);
        assertTrue(sink.hasEventOfType(BridgeErrorEvent.class));
        assertTrue(driver.isRunning());
    }

    @Test
    void executeFailsWhenNotRunning()
    {
        assertThrows(ExecutionException.class, () -> driver.execute(() -> {}).get(1, TimeUnit.SECONDS));
    }

    @Test
    void stopFromLoopThreadEndsLoop() throws Exception
    {
        driver.start();
        driver.execute(driver::stop).get(5, TimeUnit.SECONDS);

        assertTrue(driver.awaitTermination(5, TimeUnit.SECONDS));
        assertFalse(driver.isRunning());
    }

    @Test
    void eventsAfterStopAreDropped() throws Exception
    {
        driver.start();
        driver.stop();
        driver.submitEvent(new TransportEvent.TransportUp(Instant.now()));

        assertTrue(driver.awaitTermination(5, TimeUnit.SECONDS));
        assertTrue(handled.isEmpty());
    }
}
