package com.example.statements.domain.model;

import java.util.List;

/**
 * Successful result of the pipeline for one document.
 *
 * @param transactions extracted transactions in statement order, never empty
 * @param method       tier that produced them
 * @param bank         matched signature code
 */
public record ExtractionOutcome(
        List<Transaction> transactions,
        ExtractionMethod method,
        String bank
) {

    public ExtractionOutcome {
        transactions = transactions == null ? List.of() : List.copyOf(transactions);
    }
}
