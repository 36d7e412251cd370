package com.example.statements.application.parser;

import com.example.statements.domain.model.LayoutKind;
import com.example.statements.domain.model.Transaction;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Card payment section of statements that introduce each operation with {@code LE DD/MM}.
 * The statement month and year come from the section heading, e.g. {@code PAIEMENTS PAR CARTE DE JANVIER 2026};
 * operations dated in a later month than the statement belong to the previous year.
 */
@Component
public class AnchorDateLayoutParser extends AbstractLayoutParser {

    private static final int HEADING_SEARCH_LINES = 30;
    private static final String SECTION_START = "PAIEMENTS PAR CARTE";
    private static final String SECTION_END = "TOTAUX";

    private static final Pattern HEADING = Pattern.compile("PAIEMENTS PAR CARTE D[E']?\\s*([A-ZÉÈÊÀÙÛ]+)\\s+(\\d{4})");
    private static final Pattern ANCHOR = Pattern.compile("\\bLE\\s+(\\d{1,2})/(\\d{1,2})\\b");
    private static final Pattern TRAILING_AMOUNT = Pattern.compile("(?<![\\d.,])(\\d{1,3}(?:[.\u00A0\u202F]\\d{3})+,\\d{2}|\\d+[,.]\\d{2})\\s*$");
    private static final Pattern LEADING_AMOUNT = Pattern.compile("^(\\d+[,.]\\d{2})(?!\\d)");

    private static final Map<String, Integer> FRENCH_MONTHS = Map.ofEntries(
            Map.entry("JANVIER", 1),
            Map.entry("FEVRIER", 2),
            Map.entry("FÉVRIER", 2),
            Map.entry("MARS", 3),
            Map.entry("AVRIL", 4),
            Map.entry("MAI", 5),
            Map.entry("JUIN", 6),
            Map.entry("JUILLET", 7),
            Map.entry("AOUT", 8),
            Map.entry("AOÛT", 8),
            Map.entry("SEPTEMBRE", 9),
            Map.entry("OCTOBRE", 10),
            Map.entry("NOVEMBRE", 11),
            Map.entry("DECEMBRE", 12),
            Map.entry("DÉCEMBRE", 12)
    );

    public AnchorDateLayoutParser() {
        super(List.of("SOUS TOTAL", "LIBELLE", "VALEUR", "DEBIT", "CREDIT", "CARTE N°", "Page",
                "Crédit Lyonnais", "SIREN", "RCS", "ORIAS", "Indicatif", "Compte"));
    }

    @Override
    public LayoutKind layoutKind() {
        return LayoutKind.ANCHOR_DATE;
    }

    @Override
    public List<Transaction> parse(List<String> lines, int processingYear) {
        int start = sectionStart(lines);
        if (start < 0) {
            log.info("Anchor-date layout: no card payment section found");
            return List.of();
        }
        int end = sectionEnd(lines, start);
        StatementPeriod period = statementPeriod(lines, processingYear);
        log.debug("Card payment section lines {}..{}, period {}", start, end, period);

        List<Transaction> transactions = new ArrayList<>();
        int index = start;
        while (index < end) {
            String line = lines.get(index);
            index++;
            if (isBoilerplate(line)) {
                continue;
            }
            Matcher anchor = ANCHOR.matcher(line);
            if (!anchor.find()) {
                continue;
            }

            String label;
            String amountText;
            Matcher trailing = TRAILING_AMOUNT.matcher(line);
            trailing.region(anchor.end(), line.length());
            Matcher leading = index < end ? LEADING_AMOUNT.matcher(lines.get(index)) : null;
            if (trailing.find()) {
                label = line.substring(0, trailing.start());
                amountText = trailing.group(1);
            } else if (leading != null && leading.find()) {
                label = line;
                amountText = leading.group(1);
                // amount line belongs to this operation
                index++;
            } else {
                log.debug("Anchor without amount: {}", line);
                continue;
            }

            int day = Integer.parseInt(anchor.group(1));
            int month = Integer.parseInt(anchor.group(2));
            Optional<LocalDate> occurredOn = dateOf(period.yearFor(month), month, day);
            if (occurredOn.isEmpty()) {
                log.debug("Invalid date {}/{}: {}", anchor.group(1), anchor.group(2), line);
                continue;
            }
            BigDecimal amount = parseAmount(amountText);
            debit(occurredOn.get(), label, amount, line).ifPresent(transactions::add);
        }
        log.info("Anchor-date layout: {} transactions in section of {} lines", transactions.size(), end - start);
        return transactions;
    }

    private int sectionStart(List<String> lines) {
        for (int i = 0; i < lines.size(); i++) {
            if (lines.get(i).toUpperCase(Locale.ROOT).contains(SECTION_START)) {
                return i + 1;
            }
        }
        return -1;
    }

    private int sectionEnd(List<String> lines, int start) {
        for (int i = start; i < lines.size(); i++) {
            if (lines.get(i).toUpperCase(Locale.ROOT).contains(SECTION_END)) {
                return i;
            }
        }
        return lines.size();
    }

    /**
     * Reads the statement month and year from the section heading near the top of the document.
     *
     * @param lines          statement lines
     * @param processingYear fallback year
     * @return declared period; month is {@code null} when no heading could be read
     */
    StatementPeriod statementPeriod(List<String> lines, int processingYear) {
        int limit = Math.min(lines.size(), HEADING_SEARCH_LINES);
        for (int i = 0; i < limit; i++) {
            Matcher heading = HEADING.matcher(lines.get(i).toUpperCase(Locale.ROOT));
            if (heading.find()) {
                Integer month = FRENCH_MONTHS.get(heading.group(1));
                int year = Integer.parseInt(heading.group(2));
                return new StatementPeriod(month, year);
            }
        }
        return new StatementPeriod(null, processingYear);
    }

    /**
     * @param month declared statement month, {@code null} when unknown
     * @param year  declared statement year
     */
    record StatementPeriod(Integer month, int year) {

        int yearFor(int transactionMonth) {
            if (month != null && month < transactionMonth) {
                return year - 1;
            }
            return year;
        }
    }
}
