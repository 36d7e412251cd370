package com.example.statements.domain.model;

import java.math.BigDecimal;
import java.util.List;

/**
 * Canonical tabular artifact: one row per transaction with the date already normalized.
 *
 * @param rows ordered rows, never empty
 */
public record StatementTable(List<Row> rows) {

    /**
     * Fixed presentation of the three columns, widths expressed in characters.
     */
    public static final List<Column> COLUMNS = List.of(
            new Column("Date", 12),
            new Column("Libellé", 50),
            new Column("Montant", 15)
    );

    public StatementTable {
        rows = rows == null ? List.of() : List.copyOf(rows);
    }

    public int size() {
        return rows.size();
    }

    /**
     * @param date   {@code DD/MM/YYYY}
     * @param label  operation wording
     * @param amount signed amount
     */
    public record Row(String date, String label, BigDecimal amount) {
    }

    public record Column(String title, int width) {
    }
}
