package com.example.statements.application.parser;

import com.example.statements.config.ExtractionProperties;
import com.example.statements.domain.model.LayoutKind;
import com.example.statements.domain.model.TierResult;
import com.example.statements.domain.model.Transaction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Year;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Layout tier of the pipeline: routes statement text to the parser registered for the bank's layout.
 * Parser failures are reported as {@link TierResult#error(String)} and never escape.
 */
@Component
public class LayoutParserSet {

    private static final Logger log = LoggerFactory.getLogger(LayoutParserSet.class);

    private final Map<LayoutKind, LayoutParser> parsers = new EnumMap<>(LayoutKind.class);
    private final ExtractionProperties properties;
    private final Clock clock;

    public LayoutParserSet(List<LayoutParser> parsers, ExtractionProperties properties, Clock clock) {
        for (LayoutParser parser : parsers) {
            this.parsers.put(parser.layoutKind(), parser);
        }
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Parses the statement with the parser of the given layout.
     *
     * @param layoutKind layout of the detected bank
     * @param text       full statement text
     * @return {@code SUCCESS} with transactions, {@code EMPTY} or {@code ERROR}
     */
    public TierResult parse(LayoutKind layoutKind, String text) {
        LayoutParser parser = parsers.get(layoutKind);
        if (parser == null) {
            return TierResult.error("No parser registered for layout " + layoutKind);
        }
        try {
            List<Transaction> transactions = parser.parse(toLines(text), processingYear());
            return TierResult.of(transactions, "No transaction line recognized for layout " + layoutKind);
        } catch (RuntimeException ex) {
            log.warn("Layout parser {} failed: {}", layoutKind, ex.getMessage(), ex);
            return TierResult.error("Layout parser failed: " + ex.getMessage());
        }
    }

    /**
     * @return configured default year, or the current year
     */
    int processingYear() {
        Integer configured = properties.defaultYear();
        return configured != null ? configured : Year.now(clock).getValue();
    }

    /**
     * Splits text into trimmed, non-empty lines.
     *
     * @param text statement text, may be {@code null}
     * @return lines in document order
     */
    public static List<String> toLines(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        return Arrays.stream(text.split("\\R"))
                .map(String::trim)
                .filter(line -> !line.isEmpty())
                .toList();
    }
}
