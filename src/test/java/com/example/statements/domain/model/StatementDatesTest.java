package com.example.statements.domain.model;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the accepted date spellings.
 */
class StatementDatesTest {

    /**
     * Ensures the three accepted spellings normalize to the slashed form.
     */
    @Test
    void normalizeAcceptsThreeSpellings() {
        assertThat(StatementDates.normalize("30102025")).contains("30/10/2025");
        assertThat(StatementDates.normalize("30-10-2025")).contains("30/10/2025");
        assertThat(StatementDates.normalize("30/10/2025")).contains("30/10/2025");
        assertThat(StatementDates.normalize(" 30/10/2025 ")).contains("30/10/2025");
    }

    /**
     * Ensures impossible dates and unknown formats are rejected.
     */
    @Test
    void normalizeRejectsInvalidDates() {
        assertThat(StatementDates.normalize("31/13/2025")).isEmpty();
        assertThat(StatementDates.normalize("29/02/2025")).isEmpty();
        assertThat(StatementDates.normalize("2025-10-30")).isEmpty();
        assertThat(StatementDates.normalize("30/10/25")).isEmpty();
        assertThat(StatementDates.normalize(null)).isEmpty();
    }

    @Test
    void parseReturnsCalendarDate() {
        assertThat(StatementDates.parse("29/02/2024")).contains(LocalDate.of(2024, 2, 29));
    }
}
