package com.example.pdfcompress.application.service;

import com.example.pdfcompress.domain.model.CompressionOutcome;

import org.springframework.stereotype.Component;

/**
 * Assembles the terminal payload of a request: either the output and its size statistics or one error message.
 */
@Component
public class CompressionResultPackager {

    static final String DEFAULT_ERROR_MESSAGE = "Failed to compress PDF. Please try again.";

	/**
	 * Builds the success payload.
	 *
	 * @param originalSize size of the submitted document
	 * @param outputBytes  serialized output
	 * @return success outcome with the unclamped ratio
	 */
    public CompressionOutcome.Success success(long originalSize, byte[] outputBytes) {
        long outputSize = outputBytes.length;
        return new CompressionOutcome.Success(outputBytes, originalSize, outputSize, ratio(originalSize, outputSize));
    }

	/**
	 * Builds the failure payload from the exception that ended the request.
	 *
	 * @param cause fatal error
	 * @return failure outcome with a human readable message
	 */
    public CompressionOutcome.Failure failure(Throwable cause) {
        String message = cause != null ? cause.getMessage() : null;
        return new CompressionOutcome.Failure(message == null || message.isBlank() ? DEFAULT_ERROR_MESSAGE : message);
    }

	/**
	 * {@code (originalSize - outputSize) / originalSize}; negative when the output grew.
	 *
	 * @param originalSize input size in bytes
	 * @param outputSize   output size in bytes
	 * @return the ratio, or {@code 0} for an empty input
	 */
    public static double ratio(long originalSize, long outputSize) {
        if (originalSize == 0) {
            return 0.0;
        }
        return (double) (originalSize - outputSize) / originalSize;
    }
}
