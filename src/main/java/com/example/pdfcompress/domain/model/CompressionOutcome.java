package com.example.pdfcompress.domain.model;

/**
 * Terminal result of one compression request. Exactly one outcome is produced per request.
 */
public sealed interface CompressionOutcome permits CompressionOutcome.Success, CompressionOutcome.Failure {

    boolean isSuccess();

    /**
     * Successful run.
     *
     * @param outputBytes  serialized, compressed document
     * @param originalSize size of the submitted document in bytes
     * @param outputSize   size of {@code outputBytes}
     * @param ratio        {@code (originalSize - outputSize) / originalSize}; negative when the output grew
     */
    record Success(byte[] outputBytes, long originalSize, long outputSize, double ratio) implements CompressionOutcome {

        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    /**
     * Failed run carrying a single human readable description.
     *
     * @param errorMessage message suitable for display
     */
    record Failure(String errorMessage) implements CompressionOutcome {

        @Override
        public boolean isSuccess() {
            return false;
        }
    }
}
