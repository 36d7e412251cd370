package com.example.statements.domain.exception;

/**
 * Raised when a statement upload arrives without any PDF content.
 */
public class PdfFileRequiredException extends DomainException {

	/**
	 * Creates the exception with a user-facing explanation.
	 */
    public PdfFileRequiredException() {
        super("Please choose a bank statement PDF to upload.");
    }
}
