package com.example.pdfcompress.domain.exception;

/**
 * Raised when quality or compression level are outside their allowed ranges.
 */
public class InvalidCompressionOptionsException extends DomainException {

    public InvalidCompressionOptionsException(String message) {
        super(message);
    }
}
