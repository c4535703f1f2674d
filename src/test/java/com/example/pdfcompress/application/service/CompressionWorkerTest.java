package com.example.pdfcompress.application.service;

import com.example.pdfcompress.application.service.ProgressReporterTest.RecordingListener;
import com.example.pdfcompress.application.service.stage.CompressionStage;
import com.example.pdfcompress.application.service.stage.OptimizeContentStreamsStage;
import com.example.pdfcompress.application.service.stage.OptimizeStructureStage;
import com.example.pdfcompress.application.service.stage.ProcessImagesStage;
import com.example.pdfcompress.application.service.stage.StripMetadataStage;
import com.example.pdfcompress.config.CompressionProperties;
import com.example.pdfcompress.domain.model.CompressionLevel;
import com.example.pdfcompress.domain.model.CompressionOptions;
import com.example.pdfcompress.domain.model.CompressionOutcome;
import com.example.pdfcompress.domain.model.CompressionRequest;
import com.example.pdfcompress.domain.model.PipelineStage;
import com.example.pdfcompress.domain.model.ProgressEvent;
import com.example.pdfcompress.infrastructure.pdf.DocumentGraph;
import com.example.pdfcompress.infrastructure.pdf.PdfBoxDocumentGateway;
import com.example.pdfcompress.infrastructure.pdf.PdfBoxImageResampler;
import com.example.pdfcompress.support.RawPdfBuilder;
import com.example.pdfcompress.support.TestPdfs;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;

/**
 * Tests for background execution, message delivery and cancellation.
 */
class CompressionWorkerTest {

    private static final CompressionOptions OPTIONS = new CompressionOptions(60, CompressionLevel.HIGH, false);

    private ThreadPoolTaskExecutor executor;

    @BeforeEach
    void setUp() {
        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(2);
        executor.setThreadNamePrefix("test-compress-");
        executor.initialize();
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    void runsRequestInBackgroundAndDeliversOneOutcome() throws Exception {
        CompressionWorker worker = new CompressionWorker(realPipeline(), new CompressionResultPackager(), executor);
        RecordingListener listener = new RecordingListener();

        CompressionHandle handle = worker.submit(new CompressionRequest(TestPdfs.richDocumentBytes(), OPTIONS), listener);
        CompressionOutcome outcome = handle.outcome().get(30, TimeUnit.SECONDS);

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(listener.outcomes).containsExactly(outcome);
        assertThat(listener.events).extracting(ProgressEvent::progress).isSorted().last().isEqualTo(100);
        assertThat(handle.isCancelled()).isFalse();
    }

    @Test
    void concurrentRequestsDoNotShareState() throws Exception {
        CompressionWorker worker = new CompressionWorker(realPipeline(), new CompressionResultPackager(), executor);
        RecordingListener first = new RecordingListener();
        RecordingListener second = new RecordingListener();

        CompressionHandle a = worker.submit(new CompressionRequest(TestPdfs.richDocumentBytes(), OPTIONS), first);
        CompressionHandle b = worker.submit(new CompressionRequest(TestPdfs.noiseImageDocument(200, 200), OPTIONS), second);

        assertThat(a.outcome().get(30, TimeUnit.SECONDS).isSuccess()).isTrue();
        assertThat(b.outcome().get(30, TimeUnit.SECONDS).isSuccess()).isTrue();
        assertThat(first.events).extracting(ProgressEvent::progress).containsExactly(5, 10, 15, 25, 40, 70, 85, 100);
        assertThat(second.events).extracting(ProgressEvent::progress).containsExactly(5, 10, 15, 25, 40, 70, 85, 100);
    }

    @Test
    void cancelledRequestDeliversNothingFurther() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch finished = new CountDownLatch(1);
        CompressionPipeline pipeline = mock(CompressionPipeline.class);
        given(pipeline.run(any(), any())).willAnswer(invocation -> {
            ProgressReporter reporter = invocation.getArgument(1);
            try {
                reporter.report(PipelineStage.LOAD);
                started.countDown();
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                }
                reporter.report(PipelineStage.STRIP_METADATA);
                return reporter.complete(new CompressionOutcome.Failure("should never be seen"));
            } finally {
                finished.countDown();
            }
        });
        CompressionWorker worker = new CompressionWorker(pipeline, new CompressionResultPackager(), executor);
        RecordingListener listener = new RecordingListener();

        CompressionHandle handle = worker.submit(new CompressionRequest(new byte[]{1}, OPTIONS), listener);
        assertThat(started.await(10, TimeUnit.SECONDS)).isTrue();
        handle.cancel();
        release.countDown();

        assertThat(finished.await(10, TimeUnit.SECONDS)).isTrue();
        assertThat(handle.isCancelled()).isTrue();
        assertThat(handle.outcome()).isCancelled();
        assertThatThrownBy(() -> handle.outcome().get()).isInstanceOf(CancellationException.class);
        assertThat(listener.events).extracting(ProgressEvent::progress).containsExactly(5);
        assertThat(listener.outcomes).isEmpty();
    }

    @Test
    void unexpectedErrorBecomesAFailureOutcome() throws Exception {
        CompressionPipeline pipeline = mock(CompressionPipeline.class);
        given(pipeline.run(any(), any())).willThrow(new IllegalStateException());
        CompressionWorker worker = new CompressionWorker(pipeline, new CompressionResultPackager(), executor);
        RecordingListener listener = new RecordingListener();

        CompressionOutcome outcome = worker.submit(new CompressionRequest(new byte[]{1}, OPTIONS), listener)
                .outcome().get(10, TimeUnit.SECONDS);

        assertThat(outcome).isEqualTo(new CompressionOutcome.Failure("Failed to compress PDF. Please try again."));
        assertThat(listener.outcomes).containsExactly(outcome);
    }

    @Test
    void errorThrownInsideAStageStillDeliversAFailure() throws Exception {
        CompressionStage exhausted = new CompressionStage() {
            @Override
            public PipelineStage stage() {
                return PipelineStage.PROCESS_IMAGES;
            }

            @Override
            public int apply(DocumentGraph graph, CompressionOptions options) {
                throw new OutOfMemoryError();
            }
        };
        CompressionPipeline pipeline = new CompressionPipeline(new PdfBoxDocumentGateway(), List.of(exhausted),
                new CompressionResultPackager(), CompressionProperties.defaults());
        CompressionWorker worker = new CompressionWorker(pipeline, new CompressionResultPackager(), executor);
        RecordingListener listener = new RecordingListener();

        CompressionOutcome outcome = worker.submit(new CompressionRequest(TestPdfs.richDocumentBytes(), OPTIONS), listener)
                .outcome().get(10, TimeUnit.SECONDS);

        assertThat(outcome).isEqualTo(new CompressionOutcome.Failure("Failed to compress PDF. Please try again."));
        assertThat(listener.outcomes).containsExactly(outcome);
        assertThat(listener.events).extracting(ProgressEvent::progress).doesNotContain(100);
    }

    @Test
    void deeplyNestedPageTreeReachesATerminalOutcome() throws Exception {
        CompressionProperties unpacked = new CompressionProperties(75, CompressionLevel.MEDIUM, true, false,
                Duration.ofMinutes(2), CompressionProperties.Worker.defaults());
        CompressionWorker worker = new CompressionWorker(realPipeline(unpacked), new CompressionResultPackager(), executor);
        RecordingListener listener = new RecordingListener();

        CompressionHandle handle = worker.submit(
                new CompressionRequest(RawPdfBuilder.deepPageTreeDocument(60_000), OPTIONS), listener);
        CompressionOutcome outcome = handle.outcome().get(60, TimeUnit.SECONDS);

        assertThat(listener.outcomes).containsExactly(outcome);
        assertThat(listener.events).extracting(ProgressEvent::progress).startsWith(5, 10, 15, 25, 40, 70);
    }

    private static CompressionPipeline realPipeline() {
        return realPipeline(CompressionProperties.defaults());
    }

    private static CompressionPipeline realPipeline(CompressionProperties properties) {
        GraphPruner pruner = new GraphPruner();
        return new CompressionPipeline(new PdfBoxDocumentGateway(), List.of(
                new StripMetadataStage(pruner),
                new OptimizeContentStreamsStage(pruner),
                new ProcessImagesStage(new ImageTransformPolicy(), new PdfBoxImageResampler()),
                new OptimizeStructureStage(pruner)
        ), new CompressionResultPackager(), properties);
    }
}
