package com.example.pdfcompress.application.service;

import com.example.pdfcompress.domain.model.CompressionOutcome;
import com.example.pdfcompress.domain.model.CompressionRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs each compression request as its own background task.
 * <p>
 * The caller submits a request and listens; the worker thread is the only producer of that
 * request's messages. Nothing is kept between requests: each task builds its own reporter and graph
 * and drops them when it ends.
 * </p>
 */
@Service
public class CompressionWorker {

    private static final Logger log = LoggerFactory.getLogger(CompressionWorker.class);

    private final CompressionPipeline pipeline;
    private final CompressionResultPackager packager;
    private final AsyncTaskExecutor taskExecutor;

    public CompressionWorker(CompressionPipeline pipeline,
                             CompressionResultPackager packager,
                             @Qualifier("compressionTaskExecutor") AsyncTaskExecutor taskExecutor) {
        this.pipeline = pipeline;
        this.packager = packager;
        this.taskExecutor = taskExecutor;
    }

	/**
	 * Schedules the request.
	 *
	 * @param request  request to run
	 * @param listener receives progress events and then exactly one outcome, unless cancelled
	 * @return handle to await or cancel the request
	 */
    public CompressionHandle submit(CompressionRequest request, CompressionListener listener) {
        CompletableFuture<CompressionOutcome> outcome = new CompletableFuture<>();
        AtomicBoolean cancelled = new AtomicBoolean();
        ProgressReporter reporter = new ProgressReporter(listener, cancelled::get);
        Future<?> task = taskExecutor.submit(() -> execute(request, reporter, outcome));
        return new CompressionHandle(outcome, task, cancelled);
    }

    private void execute(CompressionRequest request, ProgressReporter reporter,
                         CompletableFuture<CompressionOutcome> outcome) {
        try {
            outcome.complete(pipeline.run(request, reporter));
        } catch (CancellationException ex) {
            log.info("Compression request cancelled; discarding its document");
            outcome.cancel(false);
        } catch (Throwable ex) {
            log.error("Compression request failed unexpectedly", ex);
            outcome.complete(reporter.complete(packager.failure(ex)));
            if (ex instanceof VirtualMachineError error) {
                throw error;
            }
        }
    }
}
