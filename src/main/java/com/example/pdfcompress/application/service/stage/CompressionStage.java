package com.example.pdfcompress.application.service.stage;

import com.example.pdfcompress.domain.model.CompressionOptions;
import com.example.pdfcompress.domain.model.PipelineStage;
import com.example.pdfcompress.infrastructure.pdf.DocumentGraph;

import java.io.IOException;

/**
 * One isolated step of the compression pipeline.
 * Implementations mutate the graph in place; whatever they throw is contained by the orchestrator.
 */
public interface CompressionStage {

    /**
     * @return the interior pipeline state this step implements
     */
    PipelineStage stage();

	/**
	 * Applies the step.
	 *
	 * @param graph   graph owned by the current request
	 * @param options request options
	 * @return number of edits applied
	 * @throws IOException when a stream cannot be read or written
	 */
    int apply(DocumentGraph graph, CompressionOptions options) throws IOException;
}
