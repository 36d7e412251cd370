package com.example.statements.application.exception;

import com.example.statements.domain.model.ExtractionFailure;

/**
 * Thrown by use cases that need transactions when the pipeline returned a failure instead.
 */
public class ExtractionFailedException extends ApplicationException {

    private final ExtractionFailure failure;

	/**
	 * @param failure typed failure returned by the pipeline
	 */
    public ExtractionFailedException(ExtractionFailure failure) {
        super(failure.message());
        this.failure = failure;
    }

    public ExtractionFailure getFailure() {
        return failure;
    }
}
