package com.example.statements.domain.model;

import java.util.List;

/**
 * Result of one extraction tier. Tier failures are carried as {@link TierStatus#ERROR} values instead of
 * exceptions so the orchestrator can move on to the next tier.
 *
 * @param status       tag
 * @param transactions extracted transactions, non-empty only for {@link TierStatus#SUCCESS}
 * @param reason       why the tier yielded nothing, {@code null} on success
 */
public record TierResult(
        TierStatus status,
        List<Transaction> transactions,
        String reason
) {

    public TierResult {
        transactions = transactions == null ? List.of() : List.copyOf(transactions);
    }

    /**
     * Wraps a transaction list, tagging it {@link TierStatus#EMPTY} when nothing was found.
     *
     * @param transactions tier output
     * @param emptyReason  reason recorded when the list is empty
     * @return tagged result
     */
    public static TierResult of(List<Transaction> transactions, String emptyReason) {
        if (transactions == null || transactions.isEmpty()) {
            return empty(emptyReason);
        }
        return new TierResult(TierStatus.SUCCESS, transactions, null);
    }

    public static TierResult empty(String reason) {
        return new TierResult(TierStatus.EMPTY, List.of(), reason);
    }

    public static TierResult error(String reason) {
        return new TierResult(TierStatus.ERROR, List.of(), reason);
    }
}
