package com.example.pdfcompress.application.service;

import com.example.pdfcompress.domain.model.CompressionOutcome;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Caller-side handle of a submitted request.
 */
public final class CompressionHandle {

    private final CompletableFuture<CompressionOutcome> outcome;
    private final Future<?> task;
    private final AtomicBoolean cancelled;

    CompressionHandle(CompletableFuture<CompressionOutcome> outcome, Future<?> task, AtomicBoolean cancelled) {
        this.outcome = outcome;
        this.task = task;
        this.cancelled = cancelled;
    }

    /**
     * @return future completed with the terminal outcome, or cancelled when {@link #cancel()} won
     */
    public CompletableFuture<CompressionOutcome> outcome() {
        return outcome;
    }

    /**
     * Terminates the request. No further message reaches the listener and no partial result is kept.
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            task.cancel(true);
            outcome.cancel(false);
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
