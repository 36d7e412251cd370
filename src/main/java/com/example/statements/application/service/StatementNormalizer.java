package com.example.statements.application.service;

import com.example.statements.domain.model.StatementDates;
import com.example.statements.domain.model.StatementTable;
import com.example.statements.domain.model.Transaction;
import com.example.statements.domain.model.TransactionCandidate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns extracted rows into the canonical three-column table written to spreadsheets and CSV files.
 */
@Service
public class StatementNormalizer {

    private static final Logger log = LoggerFactory.getLogger(StatementNormalizer.class);

	/**
	 * Normalizes dates to {@code DD/MM/YYYY} and drops rows whose date cannot be read.
	 *
	 * @param candidates rows in extraction order
	 * @return table of surviving rows, empty when none survive
	 */
    public Optional<StatementTable> normalize(List<TransactionCandidate> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }
        List<StatementTable.Row> rows = new ArrayList<>(candidates.size());
        int dropped = 0;
        for (TransactionCandidate candidate : candidates) {
            Optional<String> date = StatementDates.normalize(candidate.date());
            if (date.isEmpty() || candidate.amount() == null) {
                dropped++;
                log.debug("Dropping row with unreadable date or amount: {}", candidate);
                continue;
            }
            String label = candidate.label() == null ? "" : candidate.label().trim();
            rows.add(new StatementTable.Row(date.get(), label, candidate.amount()));
        }
        if (dropped > 0) {
            log.info("Normalizer dropped {} of {} rows", dropped, candidates.size());
        }
        return rows.isEmpty() ? Optional.empty() : Optional.of(new StatementTable(rows));
    }

    public Optional<StatementTable> normalizeTransactions(List<Transaction> transactions) {
        if (transactions == null) {
            return Optional.empty();
        }
        return normalize(transactions.stream().map(TransactionCandidate::from).toList());
    }
}
