package com.example.statements.interfaces.api.dto;

import com.example.statements.domain.model.StatementValidation;
import com.example.statements.domain.model.ValidationResult;

import java.util.Map;

/**
 * JSON verdict of the validate endpoint.
 */
public record ValidationResponse(
        boolean compatible,
        String bank,
        String errorType,
        String message,
        Map<String, String> supportedBanks,
        int estimatedTransactions
) {

    public static ValidationResponse from(StatementValidation validation) {
        ValidationResult result = validation.result();
        return new ValidationResponse(
                result.compatible(),
                result.bank(),
                result.errorKind() == null ? null : result.errorKind().name(),
                result.message(),
                result.supportedBanks(),
                validation.estimatedTransactions()
        );
    }
}
