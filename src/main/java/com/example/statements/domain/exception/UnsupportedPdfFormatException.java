package com.example.statements.domain.exception;

/**
 * Raised when an uploaded file is not declared as a PDF by either its content type or its name.
 */
public class UnsupportedPdfFormatException extends DomainException {

	/**
	 * @param fileName original file name supplied by the client, may be {@code null}
	 */
    public UnsupportedPdfFormatException(String fileName) {
        super("Only PDF bank statements are accepted" + (fileName != null ? ": " + fileName : "."));
    }
}
