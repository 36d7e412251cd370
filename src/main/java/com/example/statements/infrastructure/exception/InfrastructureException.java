package com.example.statements.infrastructure.exception;

/**
 * Base unchecked exception for adapter failures (PDFBox, Tesseract, HTTP calls to the language model).
 * Keeps library exceptions out of the domain language.
 */
public abstract class InfrastructureException extends RuntimeException {

	/**
	 * @param message context about the failure
	 */
    protected InfrastructureException(String message) {
        super(message);
    }

	/**
	 * Creates a new infrastructure exception while preserving the root cause.
	 *
	 * @param message context about the failure
	 * @param cause   exception bubbling up from lower level libraries
	 */
    protected InfrastructureException(String message, Throwable cause) {
        super(message, cause);
    }
}
