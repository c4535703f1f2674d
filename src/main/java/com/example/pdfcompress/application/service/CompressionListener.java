package com.example.pdfcompress.application.service;

import com.example.pdfcompress.domain.model.CompressionOutcome;
import com.example.pdfcompress.domain.model.ProgressEvent;

/**
 * Receiving end of a request's message channel: zero or more progress events, then exactly one outcome.
 * Callbacks arrive on the worker thread that runs the request.
 */
public interface CompressionListener {

    CompressionListener NONE = new CompressionListener() {
        @Override
        public void onProgress(ProgressEvent event) {
        }

        @Override
        public void onOutcome(CompressionOutcome outcome) {
        }
    };

    void onProgress(ProgressEvent event);

    void onOutcome(CompressionOutcome outcome);
}
