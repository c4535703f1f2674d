package com.example.pdfcompress.domain.model;

import com.example.pdfcompress.domain.exception.PdfFileRequiredException;

import java.util.Objects;

/**
 * Immutable input of one compression run: the raw document bytes plus the chosen options.
 * The byte array is copied on the way in and on the way out so callers cannot mutate a running request.
 */
public final class CompressionRequest {

    private final byte[] documentBytes;
    private final CompressionOptions options;

    public CompressionRequest(byte[] documentBytes, CompressionOptions options) {
        if (documentBytes == null || documentBytes.length == 0) {
            throw new PdfFileRequiredException();
        }
        this.documentBytes = documentBytes.clone();
        this.options = Objects.requireNonNull(options, "options");
    }

    public byte[] documentBytes() {
        return documentBytes.clone();
    }

    public long originalSize() {
        return documentBytes.length;
    }

    public CompressionOptions options() {
        return options;
    }

    @Override
    public String toString() {
        return "CompressionRequest[size=" + documentBytes.length + ", options=" + options + "]";
    }
}
