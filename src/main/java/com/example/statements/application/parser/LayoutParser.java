package com.example.statements.application.parser;

import com.example.statements.domain.model.LayoutKind;
import com.example.statements.domain.model.Transaction;

import java.util.List;

/**
 * Structural parser for one bank statement layout.
 * Implementations skip every line they cannot read with certainty; they never merge or guess.
 */
public interface LayoutParser {

    /**
     * @return layout handled by this parser
     */
    LayoutKind layoutKind();

    /**
     * @param lines          non-empty, trimmed statement lines in document order
     * @param processingYear year used when the statement does not state one
     * @return transactions found, possibly empty
     */
    List<Transaction> parse(List<String> lines, int processingYear);
}
