package com.example.pdfcompress.application.exception;

/**
 * Signals that a synchronous compression request ended with a terminal failure outcome.
 * Controllers translate it into an HTTP 422 response carrying the outcome's message.
 */
public class DocumentCompressionException extends ApplicationException {

	/**
	 * Creates the exception from the failure outcome's message.
	 *
	 * @param message human readable failure description
	 */
    public DocumentCompressionException(String message) {
        super(message);
    }

    public DocumentCompressionException(String message, Throwable cause) {
        super(message, cause);
    }
}
