package com.example.statements.domain.model;

import com.example.statements.domain.exception.InvalidTransactionException;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A single statement line after extraction.
 * Amounts follow the debit-negative / credit-positive convention; the label is stored trimmed.
 *
 * @param occurredOn booking date of the operation
 * @param label      merchant or operation wording, never blank
 * @param amount     signed amount
 */
public record Transaction(
        LocalDate occurredOn,
        String label,
        BigDecimal amount
) {

    public Transaction {
        if (occurredOn == null) {
            throw new InvalidTransactionException("Transaction date is required.");
        }
        if (label == null || label.isBlank()) {
            throw new InvalidTransactionException("Transaction label must not be blank.");
        }
        if (amount == null) {
            throw new InvalidTransactionException("Transaction amount is required.");
        }
        label = label.trim();
    }
}
