package com.questrail.muxbridge.test;

import com.questrail.muxbridge.codec.Frame;
import com.questrail.muxbridge.transport.FrameTransportListener;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * {@link FrameTransportListener} that records what a transport reports.
 */
public final class RecordingTransportListener implements FrameTransportListener {

    private final CountDownLatch up = new CountDownLatch(1);
    private final CompletableFuture<Throwable> down = new CompletableFuture<>();
    private final BlockingQueue<Frame> frames = new LinkedBlockingQueue<>();

    @Override
    public void onTransportUp() {
        up.countDown();
    }

    @Override
    public void onTransportDown(Throwable cause) {
        down.complete(cause);
    }

    @Override
    public void onFrame(Frame frame) {
        frames.add(frame);
    }

    public boolean awaitUp() throws InterruptedException {
        return up.await(10, TimeUnit.SECONDS);
    }

    /**
     * Waits for transport down and returns its cause, {@code null} for a clean end.
     */
    public Throwable awaitDown() throws Exception {
        return down.get(10, TimeUnit.SECONDS);
    }

    public boolean isDown() {
        return down.isDone();
    }

    public Frame nextFrame() throws InterruptedException {
        return frames.poll(10, TimeUnit.SECONDS);
    }
}
