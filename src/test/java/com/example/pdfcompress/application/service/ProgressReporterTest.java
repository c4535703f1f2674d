package com.example.pdfcompress.application.service;

import com.example.pdfcompress.domain.model.CompressionOutcome;
import com.example.pdfcompress.domain.model.PipelineStage;
import com.example.pdfcompress.domain.model.ProgressEvent;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for the per-request message channel.
 */
class ProgressReporterTest {

    private final RecordingListener listener = new RecordingListener();
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final ProgressReporter reporter = new ProgressReporter(listener, cancelled::get);

    @Test
    void progressNeverDecreasesAndStaysBelowOneHundred() {
        reporter.report(PipelineStage.PROCESS_IMAGES);
        reporter.report(10, "late analysis");
        reporter.report(100, "too early");

        assertThat(listener.events).extracting(ProgressEvent::progress).containsExactly(40, 40, 99);
        assertThat(reporter.lastProgress()).isEqualTo(99);
    }

    @Test
    void successEndsWithOneHundredThenTheOutcome() {
        reporter.report(PipelineStage.SAVE);
        CompressionOutcome success = new CompressionOutcome.Success(new byte[]{1}, 2, 1, 0.5);

        assertThat(reporter.complete(success)).isSameAs(success);

        assertThat(listener.events).extracting(ProgressEvent::progress).containsExactly(85, 100);
        assertThat(listener.events.get(1).message()).isEqualTo("Compression complete!");
        assertThat(listener.outcomes).containsExactly(success);
    }

    @Test
    void failureIsDeliveredWithoutAFinalProgressEvent() {
        reporter.report(PipelineStage.LOAD);
        CompressionOutcome failure = new CompressionOutcome.Failure("broken");

        reporter.complete(failure);

        assertThat(listener.events).extracting(ProgressEvent::progress).containsExactly(5);
        assertThat(listener.outcomes).containsExactly(failure);
    }

    @Test
    void onlyTheFirstOutcomeIsDelivered() {
        reporter.complete(new CompressionOutcome.Failure("first"));
        reporter.complete(new CompressionOutcome.Failure("second"));
        reporter.report(PipelineStage.SAVE);

        assertThat(listener.outcomes).containsExactly(new CompressionOutcome.Failure("first"));
        assertThat(listener.events).isEmpty();
    }

    @Test
    void cancellationSuppressesEveryLaterMessage() {
        reporter.report(PipelineStage.LOAD);
        cancelled.set(true);

        assertThatThrownBy(() -> reporter.report(PipelineStage.STRIP_METADATA))
                .isInstanceOf(CancellationException.class);
        reporter.complete(new CompressionOutcome.Failure("too late"));

        assertThat(listener.events).hasSize(1);
        assertThat(listener.outcomes).isEmpty();
    }

    static final class RecordingListener implements CompressionListener {

        final List<ProgressEvent> events = new ArrayList<>();
        final List<CompressionOutcome> outcomes = new ArrayList<>();

        @Override
        public synchronized void onProgress(ProgressEvent event) {
            events.add(event);
        }

        @Override
        public synchronized void onOutcome(CompressionOutcome outcome) {
            outcomes.add(outcome);
        }
    }
}
