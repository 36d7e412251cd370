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
 * Card statements printed as {@code DD.MM MERCHANT CITY 12,50}. Lines carry no year.
 */
@Component
public class DotDateLayoutParser extends AbstractLayoutParser {

    private static final Pattern DATE = Pattern.compile("(?<![\\d.,])(\\d{1,2})\\.(\\d{2})(?![\\d.,])");

    public DotDateLayoutParser() {
        super(List.of("TOTAL", "Date", "Montant", "Commerce", "Page"));
    }

    @Override
    public LayoutKind layoutKind() {
        return LayoutKind.DOT_DATE;
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
            Optional<LocalDate> occurredOn = dateOf(processingYear, month, day);
            if (occurredOn.isEmpty()) {
                log.debug("Invalid date {}.{}: {}", date.group(1), date.group(2), line);
                continue;
            }
            String label = line.substring(date.end(), amount.start());
            debit(occurredOn.get(), label, parseAmount(amount.text()), line).ifPresent(transactions::add);
        }
        log.info("Dot-date layout: {} transactions from {} lines", transactions.size(), lines.size());
        return transactions;
    }
}
