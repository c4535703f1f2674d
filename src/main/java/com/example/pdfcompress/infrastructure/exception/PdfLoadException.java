package com.example.pdfcompress.infrastructure.exception;

/**
 * The submitted bytes could not be parsed into a usable document graph,
 * or the document is protected by a password that cannot be bypassed.
 */
public class PdfLoadException extends InfrastructureException {

	/**
	 * Creates the exception with a contextual message and the root cause from PDFBox.
	 *
	 * @param message description shared with the caller
	 * @param cause   low-level PDFBox exception
	 */
    public PdfLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
