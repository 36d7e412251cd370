package com.example.statements.domain.exception;

/**
 * Raised when a {@link com.example.statements.domain.model.Transaction} would be created with a missing
 * date, a blank label or a missing amount.
 */
public class InvalidTransactionException extends DomainException {

    public InvalidTransactionException(String message) {
        super(message);
    }
}
