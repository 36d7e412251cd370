package com.example.statements.infrastructure.exception;

/**
 * Raised by the language model client for missing credentials, transport errors and unusable replies.
 */
public class LanguageModelException extends InfrastructureException {

    public LanguageModelException(String message) {
        super(message);
    }

    public LanguageModelException(String message, Throwable cause) {
        super(message, cause);
    }
}
