package com.example.pdfcompress.domain.model;

import java.util.Objects;

/**
 * Explicit result of one interior pipeline stage.
 * The orchestrator inspects it and always proceeds; a failure is logged but never propagated.
 *
 * @param stage   stage that produced the result
 * @param edits   number of graph edits the stage applied; {@code 0} when it failed
 * @param failure description of the failure, {@code null} on success
 */
public record StageResult(PipelineStage stage, int edits, String failure) {

    public StageResult {
        Objects.requireNonNull(stage, "stage");
    }

    public static StageResult completed(PipelineStage stage, int edits) {
        return new StageResult(stage, edits, null);
    }

    public static StageResult failed(PipelineStage stage, Throwable cause) {
        String description = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new StageResult(stage, 0, description);
    }

    public boolean succeeded() {
        return failure == null;
    }
}
