package com.example.pdfcompress.application.service;

import com.example.pdfcompress.domain.model.CompressionOutcome;
import com.example.pdfcompress.domain.model.PipelineStage;
import com.example.pdfcompress.domain.model.ProgressEvent;

import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.function.BooleanSupplier;

/**
 * Producer side of one request's message channel.
 * <p>
 * Progress never decreases and stays below 100 until the terminal success. After the outcome has
 * been delivered, or once the request is cancelled, nothing else is emitted. Created per request.
 * </p>
 */
public final class ProgressReporter {

    private static final int MAX_INTERMEDIATE_PROGRESS = 99;

    private final CompressionListener listener;
    private final BooleanSupplier cancelled;
    private int lastProgress;
    private boolean terminated;

    public ProgressReporter(CompressionListener listener, BooleanSupplier cancelled) {
        this.listener = Objects.requireNonNull(listener, "listener");
        this.cancelled = Objects.requireNonNull(cancelled, "cancelled");
    }

    public void report(PipelineStage stage) {
        report(stage.progress(), stage.label());
    }

	/**
	 * Emits an intermediate progress event.
	 *
	 * @param progress requested percentage; lowered to 99 and raised to the last emitted value if needed
	 * @param message  stage label
	 * @throws CancellationException when the request was cancelled, so the pipeline unwinds
	 */
    public synchronized void report(int progress, String message) {
        checkNotCancelled();
        if (terminated) {
            return;
        }
        lastProgress = Math.max(lastProgress, Math.min(Math.max(progress, 0), MAX_INTERMEDIATE_PROGRESS));
        listener.onProgress(new ProgressEvent(lastProgress, message));
    }

	/**
	 * Delivers the terminal outcome, preceded by a 100% event on success. Only the first call has an effect.
	 *
	 * @param outcome terminal outcome
	 * @return the same outcome, for chaining
	 */
    public synchronized CompressionOutcome complete(CompressionOutcome outcome) {
        if (terminated || cancelled.getAsBoolean()) {
            return outcome;
        }
        terminated = true;
        if (outcome.isSuccess()) {
            lastProgress = PipelineStage.DONE.progress();
            listener.onProgress(new ProgressEvent(lastProgress, PipelineStage.DONE.label()));
        }
        listener.onOutcome(outcome);
        return outcome;
    }

    public void checkNotCancelled() {
        if (cancelled.getAsBoolean()) {
            throw new CancellationException("Compression request was cancelled");
        }
    }

    public synchronized int lastProgress() {
        return lastProgress;
    }
}
