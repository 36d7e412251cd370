package com.example.statements.infrastructure.exception;

/**
 * Raised when any optical recognition stage (rasterizing, preprocessing, Tesseract) fails.
 * The whole document is abandoned; no partial page output is kept.
 */
public class OcrProcessingException extends InfrastructureException {

    public OcrProcessingException(String message) {
        super(message);
    }

    public OcrProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
