package com.example.statements.application.exception;

/**
 * Signals validation issues detected while running an application use case.
 * The HTTP adapter translates it into a 400 or 422 response depending on the subtype.
 */
public class UseCaseValidationException extends ApplicationException {

    public UseCaseValidationException(String message) {
        super(message);
    }
}
