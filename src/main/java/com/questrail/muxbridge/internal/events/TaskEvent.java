package com.questrail.muxbridge.internal.events;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Arbitrary work to run on the driver thread, such as a test inspecting or
 * mutating session state.
 */
public final class TaskEvent extends BridgeEvent.Base
{
    private final Runnable task;
    private final CompletableFuture<Void> completion;

    public TaskEvent(Instant timestamp, Runnable task, CompletableFuture<Void> completion) {
        super(timestamp);
        this.task = Objects.requireNonNull(task, "task");
        this.completion = Objects.requireNonNull(completion, "completion");
    }

    public void run() {
        try {
            task.run();
            completion.complete(null);
        } catch (RuntimeException e) {
            completion.completeExceptionally(e);
            throw e;
        }
    }

    public CompletableFuture<Void> completion() {
        return completion;
    }
}
