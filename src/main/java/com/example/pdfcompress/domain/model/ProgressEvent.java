package com.example.pdfcompress.domain.model;

/**
 * Progress message emitted while a request runs.
 *
 * @param progress percentage between 0 and 100, non-decreasing within one request
 * @param message  optional human readable stage label
 */
public record ProgressEvent(int progress, String message) {

    public ProgressEvent {
        if (progress < 0 || progress > 100) {
            throw new IllegalArgumentException("progress must be within 0..100 but was " + progress);
        }
    }
}
