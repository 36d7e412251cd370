package com.example.statements.domain.model;

import java.math.BigDecimal;

/**
 * Row handed to the output normalizer before its date text has been validated.
 *
 * @param date   raw date text, expected as DD/MM/YYYY, DDMMYYYY or DD-MM-YYYY
 * @param label  operation wording
 * @param amount signed amount
 */
public record TransactionCandidate(
        String date,
        String label,
        BigDecimal amount
) {

    /**
     * Re-expresses an extracted transaction as a normalizer row.
     *
     * @param transaction validated transaction
     * @return candidate carrying the DD/MM/YYYY date text
     */
    public static TransactionCandidate from(Transaction transaction) {
        return new TransactionCandidate(
                StatementDates.format(transaction.occurredOn()),
                transaction.label(),
                transaction.amount()
        );
    }
}
