package com.example.pdfcompress.application.service.stage;

import com.example.pdfcompress.application.service.GraphPruner;
import com.example.pdfcompress.application.service.PruningRule;
import com.example.pdfcompress.domain.model.CompressionOptions;
import com.example.pdfcompress.domain.model.PipelineStage;
import com.example.pdfcompress.infrastructure.pdf.DocumentGraph;

import org.springframework.stereotype.Component;

/**
 * Removes heavy document-level structures: the structure tree and optional content at
 * {@code HIGH}, embedded files always. Unreferenced objects are dropped later by the writer.
 */
@Component
public class OptimizeStructureStage implements CompressionStage {

    private final GraphPruner pruner;

    public OptimizeStructureStage(GraphPruner pruner) {
        this.pruner = pruner;
    }

    @Override
    public PipelineStage stage() {
        return PipelineStage.OPTIMIZE_STRUCTURE;
    }

    @Override
    public int apply(DocumentGraph graph, CompressionOptions options) {
        return pruner.prune(graph, PruningRule.CATALOG_STRUCTURE, options)
                + pruner.prune(graph, PruningRule.CATALOG_EMBEDDED_FILES, options);
    }
}
