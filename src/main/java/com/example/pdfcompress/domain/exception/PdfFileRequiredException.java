package com.example.pdfcompress.domain.exception;

/**
 * Raised when a compression request arrives without any document bytes.
 */
public class PdfFileRequiredException extends DomainException {

	/**
	 * Creates the exception with a user-friendly explanation.
	 */
    public PdfFileRequiredException() {
        super("Please choose a PDF file to compress.");
    }
}
