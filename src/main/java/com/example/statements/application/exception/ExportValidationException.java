package com.example.statements.application.exception;

/**
 * Thrown when a statement export is requested but no row survives normalization.
 */
public class ExportValidationException extends UseCaseValidationException {

	/**
	 * @param message validation message suitable for display
	 */
    public ExportValidationException(String message) {
        super(message);
    }
}
