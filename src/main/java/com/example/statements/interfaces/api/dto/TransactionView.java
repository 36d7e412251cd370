package com.example.statements.interfaces.api.dto;

import com.example.statements.domain.model.StatementDates;
import com.example.statements.domain.model.Transaction;

import java.math.BigDecimal;

/**
 * JSON view of one transaction with the date rendered as {@code DD/MM/YYYY}.
 */
public record TransactionView(String date, String label, BigDecimal amount) {

    public static TransactionView from(Transaction transaction) {
        return new TransactionView(StatementDates.format(transaction.occurredOn()), transaction.label(), transaction.amount());
    }
}
