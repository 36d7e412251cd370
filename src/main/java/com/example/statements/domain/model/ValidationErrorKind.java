package com.example.statements.domain.model;

/**
 * Reason a statement was judged incompatible with the extraction pipeline.
 */
public enum ValidationErrorKind {
    SCANNED,
    BANK_NOT_SUPPORTED,
    UNREADABLE,
    UNKNOWN
}
