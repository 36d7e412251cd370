package com.example.statements.domain.model;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Date normalization rules shared by the language-model extractor and the output normalizer.
 * Exactly three spellings are accepted: {@code DD/MM/YYYY}, {@code DDMMYYYY} and {@code DD-MM-YYYY}.
 */
public final class StatementDates {

    private static final DateTimeFormatter CANONICAL = DateTimeFormatter.ofPattern("dd/MM/uuuu")
            .withResolverStyle(ResolverStyle.STRICT);
    private static final Pattern SLASHED = Pattern.compile("^\\d{2}/\\d{2}/\\d{4}$");
    private static final Pattern COMPACT = Pattern.compile("^\\d{8}$");
    private static final Pattern DASHED = Pattern.compile("^\\d{2}-\\d{2}-\\d{4}$");

    private StatementDates() {
    }

    /**
     * Parses one of the accepted spellings into a calendar date.
     *
     * @param raw date text, surrounding whitespace is ignored
     * @return parsed date, empty for unknown formats and impossible dates such as {@code 31/13/2025}
     */
    public static Optional<LocalDate> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String value = raw.strip();
        String canonical;
        if (SLASHED.matcher(value).matches()) {
            canonical = value;
        } else if (COMPACT.matcher(value).matches()) {
            canonical = value.substring(0, 2) + "/" + value.substring(2, 4) + "/" + value.substring(4);
        } else if (DASHED.matcher(value).matches()) {
            canonical = value.replace('-', '/');
        } else {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDate.parse(canonical, CANONICAL));
        } catch (DateTimeParseException ex) {
            return Optional.empty();
        }
    }

    /**
     * @param raw date text in one of the accepted spellings
     * @return the same date as {@code DD/MM/YYYY}, empty when rejected
     */
    public static Optional<String> normalize(String raw) {
        return parse(raw).map(StatementDates::format);
    }

    public static String format(LocalDate date) {
        return CANONICAL.format(date);
    }
}
