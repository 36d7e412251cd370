package com.example.statements.application.parser;

import com.example.statements.domain.model.Transaction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Shared plumbing of the layout parsers: boilerplate filtering, French amount parsing, label checks.
 */
abstract class AbstractLayoutParser implements LayoutParser {

    /**
     * French amount with a decimal comma: {@code 12,50}, {@code 1.234,56}.
     * Thousands groups are only read across dots and no-break spaces; a plain space separates the label.
     */
    static final Pattern COMMA_AMOUNT = Pattern.compile("(?<![\\d.,])(\\d{1,3}(?:[.\u00A0\u202F]\\d{3})+|\\d+),(\\d{2})(?!\\d)");
    static final int MIN_LABEL_LENGTH = 3;

    protected final Logger log = LoggerFactory.getLogger(getClass());

    private final List<String> stopKeywords;

    protected AbstractLayoutParser(List<String> stopKeywords) {
        this.stopKeywords = List.copyOf(stopKeywords);
    }

    /**
     * Header, footer and total lines are recognized by case-sensitive keywords.
     *
     * @param line trimmed line
     * @return {@code true} when the line must be ignored
     */
    protected boolean isBoilerplate(String line) {
        for (String keyword : stopKeywords) {
            if (line.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Finds the last comma amount located at or after {@code from}.
     *
     * @param line line to scan
     * @param from first index the amount may start at
     * @return last amount, or {@code null} when the line has none
     */
    protected AmountMatch lastCommaAmount(String line, int from) {
        Matcher matcher = COMMA_AMOUNT.matcher(line);
        matcher.region(from, line.length());
        AmountMatch last = null;
        while (matcher.find()) {
            last = new AmountMatch(matcher.start(), matcher.end(), matcher.group());
        }
        return last;
    }

    /**
     * Parses {@code 1.234,56}, {@code 12.50} or a no-break space grouped amount into a positive decimal.
     *
     * @param token amount text
     * @return parsed amount
     * @throws NumberFormatException when the token is not numeric
     */
    protected BigDecimal parseAmount(String token) {
        int separator = Math.max(token.lastIndexOf(','), token.lastIndexOf('.'));
        String integerPart = separator < 0 ? token : token.substring(0, separator);
        String decimals = separator < 0 ? "" : token.substring(separator + 1);
        String digits = integerPart.replaceAll("[\\s.,\u00A0\u202F]", "");
        return new BigDecimal(decimals.isEmpty() ? digits : digits + "." + decimals);
    }

    /**
     * @return calendar date or empty for impossible combinations such as 31/02
     */
    protected Optional<LocalDate> dateOf(int year, int month, int day) {
        try {
            return Optional.of(LocalDate.of(year, month, day));
        } catch (DateTimeException ex) {
            return Optional.empty();
        }
    }

    /**
     * Builds a debit, dropping candidates whose label is too short to be meaningful.
     *
     * @param date   booking date
     * @param label  raw label
     * @param amount positive amount as printed
     * @param line   source line, for logging
     * @return debit transaction or empty
     */
    protected Optional<Transaction> debit(LocalDate date, String label, BigDecimal amount, String line) {
        String trimmed = label == null ? "" : label.trim();
        if (trimmed.length() < MIN_LABEL_LENGTH) {
            log.debug("Skipping line with short label: {}", line);
            return Optional.empty();
        }
        return Optional.of(new Transaction(date, trimmed, amount.abs().negate()));
    }

    /**
     * Position and text of an amount found on a line.
     */
    record AmountMatch(int start, int end, String text) {
    }
}
