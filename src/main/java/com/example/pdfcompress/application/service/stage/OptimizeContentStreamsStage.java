package com.example.pdfcompress.application.service.stage;

import com.example.pdfcompress.application.service.GraphPruner;
import com.example.pdfcompress.application.service.PruningRule;
import com.example.pdfcompress.domain.model.CompressionOptions;
import com.example.pdfcompress.domain.model.PipelineStage;
import com.example.pdfcompress.infrastructure.pdf.DocumentGraph;
import com.example.pdfcompress.infrastructure.pdf.PageNode;

import org.apache.pdfbox.cos.COSArray;
import org.apache.pdfbox.cos.COSBase;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.cos.COSStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Trims page-level interactive entries and resource procedure sets, then Flate-encodes
 * page content streams that were stored without any filter.
 */
@Component
public class OptimizeContentStreamsStage implements CompressionStage {

    private static final Logger log = LoggerFactory.getLogger(OptimizeContentStreamsStage.class);

    private final GraphPruner pruner;

    public OptimizeContentStreamsStage(GraphPruner pruner) {
        this.pruner = pruner;
    }

    @Override
    public PipelineStage stage() {
        return PipelineStage.OPTIMIZE_CONTENT_STREAMS;
    }

    @Override
    public int apply(DocumentGraph graph, CompressionOptions options) {
        int edits = pruner.prune(graph, PruningRule.PAGE_ANNOTATIONS, options)
                + pruner.prune(graph, PruningRule.PAGE_INTERACTIVITY, options)
                + pruner.prune(graph, PruningRule.RESOURCE_PROC_SET, options);

        Set<COSStream> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (PageNode page : graph.pages()) {
            for (COSStream content : contentStreams(graph, page)) {
                if (!seen.add(content) || content.getDictionaryObject(COSName.FILTER) != null) {
                    continue;
                }
                try {
                    flate(content);
                    edits++;
                } catch (IOException ex) {
                    log.warn("Skipping content stream of page {}: {}", page.index() + 1, ex.getMessage());
                }
            }
        }
        return edits;
    }

    private List<COSStream> contentStreams(DocumentGraph graph, PageNode page) {
        COSBase contents = page.dictionary().getItem(COSName.CONTENTS);
        List<COSStream> streams = new ArrayList<>();
        graph.resolveStream(contents).ifPresent(streams::add);
        graph.resolveArray(contents).ifPresent(array -> {
            for (COSBase element : array) {
                graph.resolveStream(element).ifPresent(streams::add);
            }
        });
        return streams;
    }

    private void flate(COSStream stream) throws IOException {
        byte[] plain;
        try (InputStream in = stream.createRawInputStream()) {
            plain = in.readAllBytes();
        }
        try (OutputStream out = stream.createOutputStream(COSName.FLATE_DECODE)) {
            out.write(plain);
        }
    }
}
