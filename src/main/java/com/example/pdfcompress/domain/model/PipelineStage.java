package com.example.pdfcompress.domain.model;

/**
 * Ordered states of the compression pipeline together with their progress milestone.
 * Fatal stages abort the request; every other stage is isolated and the pipeline moves on.
 */
public enum PipelineStage {
    LOAD(5, "Loading PDF document...", true),
    STRIP_METADATA(15, "Removing unnecessary metadata...", false),
    OPTIMIZE_CONTENT_STREAMS(25, "Optimizing content streams...", false),
    PROCESS_IMAGES(40, "Processing embedded images...", false),
    OPTIMIZE_STRUCTURE(70, "Optimizing document structure...", false),
    SAVE(85, "Finalizing compressed document...", true),
    DONE(100, "Compression complete!", false);

    private final int progress;
    private final String label;
    private final boolean fatal;

    PipelineStage(int progress, String label, boolean fatal) {
        this.progress = progress;
        this.label = label;
        this.fatal = fatal;
    }

    public int progress() {
        return progress;
    }

    public String label() {
        return label;
    }

    public boolean isFatal() {
        return fatal;
    }
}
