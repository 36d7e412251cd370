package com.example.statements.domain.model;

/**
 * Typed failure returned instead of transactions.
 *
 * @param kind       failure category
 * @param message    user facing explanation
 * @param validation verdict that stopped the pipeline, {@code null} when the failure happened later
 */
public record ExtractionFailure(
        FailureKind kind,
        String message,
        ValidationResult validation
) {

    public static ExtractionFailure of(FailureKind kind, String message) {
        return new ExtractionFailure(kind, message, null);
    }

    public static ExtractionFailure rejected(ValidationResult validation) {
        return new ExtractionFailure(FailureKind.fromValidation(validation.errorKind()), validation.message(), validation);
    }

    /**
     * Scans are too frequent to be worth a failed-conversion record.
     *
     * @return {@code true} when callers should keep a failed-conversion record
     */
    public boolean reportable() {
        return kind != FailureKind.SCANNED;
    }

    /**
     * @return {@code true} when callers should raise an external alert (unsupported banks only)
     */
    public boolean alertable() {
        return kind == FailureKind.BANK_NOT_SUPPORTED;
    }
}
