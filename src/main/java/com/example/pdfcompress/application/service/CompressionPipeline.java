package com.example.pdfcompress.application.service;

import com.example.pdfcompress.application.service.stage.CompressionStage;
import com.example.pdfcompress.config.CompressionProperties;
import com.example.pdfcompress.domain.model.CompressionOptions;
import com.example.pdfcompress.domain.model.CompressionOutcome;
import com.example.pdfcompress.domain.model.CompressionRequest;
import com.example.pdfcompress.domain.model.PipelineStage;
import com.example.pdfcompress.domain.model.StageResult;
import com.example.pdfcompress.infrastructure.exception.PdfLoadException;
import com.example.pdfcompress.infrastructure.exception.PdfSaveException;
import com.example.pdfcompress.infrastructure.pdf.DocumentGraph;
import com.example.pdfcompress.infrastructure.pdf.PdfBoxDocumentGateway;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orchestrates one compression request:
 * {@code Load -> StripMetadata -> OptimizeContentStreams -> ProcessImages -> OptimizeStructure -> Save -> Done}.
 * <p>
 * {@code Load} and {@code Save} are fatal and end the request with a failure outcome. Interior stages
 * are isolated: a failure becomes a failed {@link StageResult}, the graph keeps whatever partial edits
 * the stage made, and the next stage runs.
 * </p>
 */
@Service
public class CompressionPipeline {

    private static final Logger log = LoggerFactory.getLogger(CompressionPipeline.class);
    private static final int ANALYZE_PROGRESS = 10;

    private final PdfBoxDocumentGateway gateway;
    private final List<CompressionStage> stages;
    private final CompressionResultPackager packager;
    private final CompressionProperties properties;

    /**
     * Creates the pipeline. Stages are ordered by their {@link PipelineStage}, not by injection order.
     *
     * @param gateway    PDFBox parse/serialize adapter
     * @param stages     interior stages
     * @param packager   terminal payload builder
     * @param properties compression settings
     */
    public CompressionPipeline(PdfBoxDocumentGateway gateway,
                               List<CompressionStage> stages,
                               CompressionResultPackager packager,
                               CompressionProperties properties) {
        this.gateway = gateway;
        this.stages = stages.stream()
                .sorted(Comparator.comparing(CompressionStage::stage))
                .toList();
        this.packager = packager;
        this.properties = properties;
        for (CompressionStage stage : this.stages) {
            if (stage.stage().isFatal() || stage.stage() == PipelineStage.DONE) {
                throw new IllegalArgumentException("Only interior stages can be plugged in: " + stage.stage());
            }
        }
    }

	/**
	 * Runs every stage over a freshly parsed graph and delivers exactly one outcome through {@code reporter}.
	 *
	 * @param request  request to compress
	 * @param reporter per-request message channel
	 * @return the delivered outcome
	 * @throws java.util.concurrent.CancellationException when the request is cancelled at a message boundary
	 */
    public CompressionOutcome run(CompressionRequest request, ProgressReporter reporter) {
        reporter.report(PipelineStage.LOAD);
        DocumentGraph graph;
        try {
            graph = gateway.parse(request.documentBytes());
        } catch (PdfLoadException ex) {
            log.warn("Load failed: {}", ex.getMessage(), ex.getCause());
            return reporter.complete(packager.failure(ex));
        }

        try (graph) {
            reporter.report(ANALYZE_PROGRESS, "Analyzing document structure...");
            log.info("Compressing {} byte document with {}", request.originalSize(), request.options());

            List<StageResult> results = new ArrayList<>();
            for (CompressionStage stage : stages) {
                reporter.report(stage.stage());
                results.add(runIsolated(stage, graph, request.options()));
            }
            logSummary(results);

            reporter.report(PipelineStage.SAVE);
            byte[] output = gateway.serialize(graph, properties.packObjectStreams());
            reporter.checkNotCancelled();

            CompressionOutcome.Success success = packager.success(request.originalSize(), output);
            log.info("Compressed {} -> {} bytes (ratio {})",
                    success.originalSize(), success.outputSize(), String.format("%.3f", success.ratio()));
            return reporter.complete(success);
        } catch (PdfSaveException ex) {
            log.error("Save failed", ex);
            return reporter.complete(packager.failure(ex));
        }
    }

    private StageResult runIsolated(CompressionStage stage, DocumentGraph graph, CompressionOptions options) {
        try {
            int edits = stage.apply(graph, options);
            log.debug("Stage {} applied {} edits", stage.stage(), edits);
            return StageResult.completed(stage.stage(), edits);
        } catch (IOException | RuntimeException ex) {
            log.warn("Stage {} failed and was skipped: {}", stage.stage(), ex.getMessage(), ex);
            return StageResult.failed(stage.stage(), ex);
        }
    }

    private void logSummary(List<StageResult> results) {
        long failed = results.stream().filter(result -> !result.succeeded()).count();
        int edits = results.stream().mapToInt(StageResult::edits).sum();
        if (failed > 0) {
            log.info("{} of {} stages failed; {} edits applied", failed, results.size(), edits);
        } else {
            log.debug("All {} stages completed; {} edits applied", results.size(), edits);
        }
    }
}
