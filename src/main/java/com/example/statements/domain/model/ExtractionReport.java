package com.example.statements.domain.model;

/**
 * Either an {@link ExtractionOutcome} or an {@link ExtractionFailure}, never both.
 */
public record ExtractionReport(
        ExtractionOutcome outcome,
        ExtractionFailure failure
) {

    public ExtractionReport {
        if ((outcome == null) == (failure == null)) {
            throw new IllegalArgumentException("Exactly one of outcome or failure must be set.");
        }
    }

    public static ExtractionReport success(ExtractionOutcome outcome) {
        return new ExtractionReport(outcome, null);
    }

    public static ExtractionReport failed(ExtractionFailure failure) {
        return new ExtractionReport(null, failure);
    }

    public boolean successful() {
        return outcome != null;
    }
}
