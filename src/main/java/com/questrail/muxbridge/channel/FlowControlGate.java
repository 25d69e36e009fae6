package com.questrail.muxbridge.channel;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.muxbridge.codec.Frame;
import com.questrail.muxbridge.transport.FrameSink;
import com.questrail.muxbridge.util.Jsons;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * FlowControlGate
 * -----------------------------------------------------------------------------
 * Per-channel outbound gate between an endpoint and the front-end transport.
 *
 * <p>While thawed, frames pass straight through. While frozen, they are queued
 * and released in arrival order by {@link #thaw()}. A gate only ever holds
 * frames of its own channel, so freezing one channel never delays another.</p>
 *
 * <p>The channel's final {@code close} is marked terminal. The release callback
 * runs when that frame is actually written, which is the moment the channel id
 * becomes free again.</p>
 */
public final class FlowControlGate
{
    private record Pending(Frame frame, boolean terminal) {}

    private final String channel;
    private final FrameSink sink;
    private final Runnable onReleased;
    private final Deque<Pending> pending = new ArrayDeque<>();

    private boolean frozen;
    private boolean released;

    public FlowControlGate(String channel, FrameSink sink, Runnable onReleased)
    {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.onReleased = Objects.requireNonNull(onReleased, "onReleased");
    }

    public void sendData(byte[] data)
    {
        emit(new Pending(new Frame(channel, data), false));
    }

    public void sendControl(ObjectNode message)
    {
        emit(new Pending(Frame.control(Jsons.toBytes(message)), false));
    }

    /**
     * Sends the channel's last frame; nothing may follow it.
     */
    public void sendTerminal(ObjectNode message)
    {
        emit(new Pending(Frame.control(Jsons.toBytes(message)), true));
    }

    public void freeze()
    {
        frozen = true;
    }

    public void thaw()
    {
        frozen = false;
        while (!pending.isEmpty() && !frozen) {
            write(pending.pollFirst());
        }
    }

    public boolean isFrozen()
    {
        return frozen;
    }

    public int pendingFrames()
    {
        return pending.size();
    }

    /**
     * Drops everything still queued and releases the id without writing.
     */
    public void discard()
    {
        pending.clear();
        release();
    }

    private void emit(Pending entry)
    {
        if (released) {
            return;
        }
        if (frozen) {
            pending.addLast(entry);
        }
        else {
            write(entry);
        }
    }

    private void write(Pending entry)
    {
        sink.send(entry.frame());
        if (entry.terminal()) {
            release();
        }
    }

    private void release()
    {
        if (!released) {
            released = true;
            onReleased.run();
        }
    }
}
