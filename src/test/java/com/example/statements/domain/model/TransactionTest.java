package com.example.statements.domain.model;

import com.example.statements.domain.exception.InvalidTransactionException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TransactionTest {

    @Test
    void labelIsTrimmed() {
        Transaction transaction = new Transaction(LocalDate.of(2025, 3, 15), "  BOULANGERIE  ", new BigDecimal("-12.50"));

        assertThat(transaction.label()).isEqualTo("BOULANGERIE");
    }

    @Test
    void blankLabelIsRejected() {
        assertThrows(InvalidTransactionException.class,
                () -> new Transaction(LocalDate.of(2025, 3, 15), "   ", BigDecimal.ONE));
    }

    @Test
    void missingDateIsRejected() {
        assertThrows(InvalidTransactionException.class, () -> new Transaction(null, "LABEL", BigDecimal.ONE));
    }

    /**
     * Ensures a report holds exactly one of outcome or failure.
     */
    @Test
    void reportRequiresExactlyOneSide() {
        assertThrows(IllegalArgumentException.class, () -> new ExtractionReport(null, null));
        ExtractionReport failed = ExtractionReport.failed(ExtractionFailure.of(FailureKind.SCANNED, "scan"));

        assertThat(failed.successful()).isFalse();
        assertThat(failed.failure().reportable()).isFalse();
        assertThat(failed.failure().alertable()).isFalse();
    }
}
