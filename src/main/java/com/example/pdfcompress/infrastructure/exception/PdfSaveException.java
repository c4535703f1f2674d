package com.example.pdfcompress.infrastructure.exception;

/**
 * The mutated document graph could not be serialized. No partial output is ever emitted.
 */
public class PdfSaveException extends InfrastructureException {

	/**
	 * Creates the exception with a contextual message and the root cause from PDFBox.
	 *
	 * @param message description shared with the caller
	 * @param cause   low-level writer exception
	 */
    public PdfSaveException(String message, Throwable cause) {
        super(message, cause);
    }
}
