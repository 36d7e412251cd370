package com.example.statements.domain.model;

/**
 * Validation verdict of an uploaded statement with a preview of the expected yield.
 *
 * @param result                compatibility verdict
 * @param estimatedTransactions lines the bank's layout parser recognizes, 0 when incompatible
 */
public record StatementValidation(
        ValidationResult result,
        int estimatedTransactions
) {
}
