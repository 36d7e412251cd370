package com.example.statements.application.parser;

import com.example.statements.domain.model.LayoutKind;
import com.example.statements.domain.model.Transaction;

import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Card statements whose lines start with a concatenated {@code DDMMYY} date:
 * {@code 150325 MERCHANT ADDRESS 12,50}.
 */
@Component
public class CompactDateLayoutParser extends AbstractLayoutParser {

    private static final Pattern DATE = Pattern.compile("^(\\d{1,2})(\\d{2})(\\d{2})(?!\\d)");

    public CompactDateLayoutParser() {
        super(List.of("DATE", "NOM", "MONTANT", "Page", "TOTAL"));
    }

    @Override
    public LayoutKind layoutKind() {
        return LayoutKind.COMPACT_DATE;
    }

    @Override
    public List<Transaction> parse(List<String> lines, int processingYear) {
        List<Transaction> transactions = new ArrayList<>();
        for (String line : lines) {
            if (isBoilerplate(line)) {
                continue;
            }
            Matcher date = DATE.matcher(line);
            if (!date.find()) {
                continue;
            }
            AmountMatch amount = lastCommaAmount(line, date.end());
            if (amount == null) {
                log.debug("No amount after date: {}", line);
                continue;
            }
            int day = Integer.parseInt(date.group(1));
            int month = Integer.parseInt(date.group(2));
            int year = 2000 + Integer.parseInt(date.group(3));
            Optional<LocalDate> occurredOn = dateOf(year, month, day);
            if (occurredOn.isEmpty()) {
                log.debug("Invalid date {}: {}", date.group(), line);
                continue;
            }
            String label = line.substring(date.end(), amount.start());
            debit(occurredOn.get(), label, parseAmount(amount.text()), line).ifPresent(transactions::add);
        }
        log.info("Compact-date layout: {} transactions from {} lines", transactions.size(), lines.size());
        return transactions;
    }
}
