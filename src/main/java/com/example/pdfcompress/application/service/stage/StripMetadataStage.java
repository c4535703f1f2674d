package com.example.pdfcompress.application.service.stage;

import com.example.pdfcompress.application.service.GraphPruner;
import com.example.pdfcompress.application.service.PruningRule;
import com.example.pdfcompress.domain.model.CompressionOptions;
import com.example.pdfcompress.domain.model.PipelineStage;
import com.example.pdfcompress.infrastructure.pdf.DocumentGraph;

import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Drops document-wide metadata: catalog metadata links, the trailer's info dictionary and page thumbnails.
 */
@Component
public class StripMetadataStage implements CompressionStage {

    private static final List<PruningRule> RULES = List.of(
            PruningRule.TRAILER_INFO,
            PruningRule.CATALOG_METADATA,
            PruningRule.PAGE_THUMBNAIL
    );

    private final GraphPruner pruner;

    public StripMetadataStage(GraphPruner pruner) {
        this.pruner = pruner;
    }

    @Override
    public PipelineStage stage() {
        return PipelineStage.STRIP_METADATA;
    }

    @Override
    public int apply(DocumentGraph graph, CompressionOptions options) {
        int edits = 0;
        for (PruningRule rule : RULES) {
            edits += pruner.prune(graph, rule, options);
        }
        return edits;
    }
}
