package com.craftsman.coordinator.service;

import com.craftsman.coordinator.model.Outcome;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/**
 * Caller-side handle on a submitted root task. Exposes no task ids.
 */
public final class RootTaskHandle {

    private final CompletableFuture<Outcome> outcome;
    private final Runnable                   canceller;

    RootTaskHandle(CompletableFuture<Outcome> outcome, Runnable canceller) {
        this.outcome   = outcome;
        this.canceller = canceller;
    }

    /** Completes with the terminal outcome; never completes exceptionally. */
    public CompletableFuture<Outcome> outcome() {
        return outcome.copy();
    }

    /** Cancel the root task and every task it delegated. No-op once finished. */
    public void cancel() {
        canceller.run();
    }

    public boolean isDone() {
        return outcome.isDone();
    }

    /**
     * Block until the task resolves. If the waiting thread is interrupted the
     * task is cancelled and its CANCELLED outcome is returned.
     */
    public Outcome await() {
        try {
            return outcome.get();
        } catch (InterruptedException e) {
            cancel();
            Outcome cancelled = outcome.join();
            Thread.currentThread().interrupt();
            return cancelled;
        } catch (ExecutionException e) {
            throw new IllegalStateException("Root task completion failed", e.getCause());
        }
    }
}
