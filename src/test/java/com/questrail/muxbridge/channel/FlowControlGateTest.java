package com.questrail.muxbridge.channel;

import com.questrail.muxbridge.codec.Frame;
import com.questrail.muxbridge.util.Jsons;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

final class FlowControlGateTest
{
    private final List<Frame> written = new ArrayList<>();
    private final AtomicInteger released = new AtomicInteger();
    private final FlowControlGate gate = new FlowControlGate("ch", written::add, released::incrementAndGet);

    private static byte[] bytes(String s)
    {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void thawedGatePassesFramesThrough()
    {
        gate.sendData(bytes("a"));
        gate.sendControl(Jsons.object().put("command", "done").put("channel", "ch"));

        assertEquals(2, written.size());
        assertEquals("ch", written.get(0).channel());
        assertTrue(written.get(1).isControl());
    }

    @Test
    void frozenGateQueuesInOrderUntilThawed()
    {
        gate.freeze();
        gate.sendData(bytes("1"));
        gate.sendData(bytes("2"));
        gate.sendTerminal(Jsons.object().put("command", "close").put("channel", "ch"));

        assertTrue(written.isEmpty());
        assertEquals(3, gate.pendingFrames());
        assertEquals(0, released.get());

        gate.thaw();

        assertEquals(3, written.size());
        assertArrayEquals(bytes("1"), written.get(0).payload());
        assertArrayEquals(bytes("2"), written.get(1).payload());
        assertTrue(written.get(2).isControl());
        assertEquals(1, released.get());
    }

    @Test
    void terminalFrameReleasesOnceAndSilencesGate()
    {
        gate.sendTerminal(Jsons.object().put("command", "close").put("channel", "ch"));
        gate.sendData(bytes("late"));
        gate.sendTerminal(Jsons.object().put("command", "close").put("channel", "ch"));

        assertEquals(1, written.size());
        assertEquals(1, released.get());
    }

    @Test
    void discardDropsQueueWithoutWriting()
    {
        gate.freeze();
        gate.sendData(bytes("x"));
        gate.discard();
        gate.thaw();

        assertTrue(written.isEmpty());
        assertEquals(0, gate.pendingFrames());
        assertEquals(1, released.get());
    }
}
