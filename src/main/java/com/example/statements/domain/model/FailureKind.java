package com.example.statements.domain.model;

/**
 * Terminal, user-facing failure categories of the pipeline.
 */
public enum FailureKind {
    SCANNED,
    BANK_NOT_SUPPORTED,
    UNREADABLE,
    NO_TRANSACTIONS_FOUND,
    EXTRACTION_ERROR;

    /**
     * Maps an incompatible verdict onto the failure taxonomy.
     *
     * @param errorKind validator error kind
     * @return matching failure kind
     */
    public static FailureKind fromValidation(ValidationErrorKind errorKind) {
        if (errorKind == null) {
            return EXTRACTION_ERROR;
        }
        return switch (errorKind) {
            case SCANNED -> SCANNED;
            case BANK_NOT_SUPPORTED -> BANK_NOT_SUPPORTED;
            case UNREADABLE -> UNREADABLE;
            case UNKNOWN -> EXTRACTION_ERROR;
        };
    }
}
