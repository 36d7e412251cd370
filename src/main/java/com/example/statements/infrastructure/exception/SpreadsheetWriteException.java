package com.example.statements.infrastructure.exception;

/**
 * Raised when Apache POI cannot serialize the statement workbook.
 */
public class SpreadsheetWriteException extends InfrastructureException {

    public SpreadsheetWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
