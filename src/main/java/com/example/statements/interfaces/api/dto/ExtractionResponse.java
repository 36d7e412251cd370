package com.example.statements.interfaces.api.dto;

import com.example.statements.domain.model.ExtractionFailure;
import com.example.statements.domain.model.ExtractionOutcome;
import com.example.statements.domain.model.ExtractionReport;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

/**
 * JSON summary of a pipeline run: either the transactions or the failure, with the flags callers use to
 * decide on failed-conversion records and alerts.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExtractionResponse(
        boolean success,
        String bank,
        String method,
        Integer transactionCount,
        List<TransactionView> transactions,
        String error,
        String message,
        Boolean reportable,
        Boolean alertable,
        Map<String, String> supportedBanks
) {

    public static ExtractionResponse from(ExtractionReport report) {
        if (report.successful()) {
            ExtractionOutcome outcome = report.outcome();
            List<TransactionView> views = outcome.transactions().stream().map(TransactionView::from).toList();
            return new ExtractionResponse(true, outcome.bank(), outcome.method().name(), views.size(), views,
                    null, null, null, null, null);
        }
        ExtractionFailure failure = report.failure();
        Map<String, String> banks = failure.validation() == null ? null : failure.validation().supportedBanks();
        return new ExtractionResponse(false, null, null, null, null,
                failure.kind().name(), failure.message(), failure.reportable(), failure.alertable(), banks);
    }
}
