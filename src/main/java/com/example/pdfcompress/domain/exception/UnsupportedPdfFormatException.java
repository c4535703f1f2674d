package com.example.pdfcompress.domain.exception;

/**
 * Raised when the uploaded file does not resemble a PDF by name, content type or header bytes.
 */
public class UnsupportedPdfFormatException extends DomainException {

	/**
	 * Creates the exception and mentions the offending file so the user can react.
	 *
	 * @param fileName original file name supplied by the client
	 */
    public UnsupportedPdfFormatException(String fileName) {
        super("Only PDF files can be compressed" + (fileName != null ? ": " + fileName : "."));
    }
}
