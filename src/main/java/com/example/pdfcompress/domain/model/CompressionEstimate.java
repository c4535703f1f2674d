package com.example.pdfcompress.domain.model;

/**
 * Quick size estimate returned before a document is actually compressed.
 */
public record CompressionEstimate(
        long fileSize,
        long estimatedSize,
        CompressionOptions options
) {
}
