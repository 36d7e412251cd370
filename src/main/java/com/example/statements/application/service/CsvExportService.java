package com.example.statements.application.service;

import com.example.statements.application.exception.ExportValidationException;
import com.example.statements.domain.model.StatementTable;

import org.springframework.stereotype.Service;

import java.util.stream.Collectors;

/**
 * Application-layer service that turns a normalized statement table into downloadable CSV content.
 */
@Service
public class CsvExportService {

    public static final String CONTENT_TYPE = "text/csv";

	/**
	 * Runs validation and returns a CSV string containing every row of the table.
	 *
	 * @param table normalized statement table
	 * @return CSV content ready to stream to the browser
	 * @throws ExportValidationException when the table is missing or has no rows
	 */
    public String export(StatementTable table) {
        if (table == null || table.rows().isEmpty()) {
            throw new ExportValidationException("No transactions available for export.");
        }
        return buildCsv(table);
    }

	/**
	 * Builds the CSV output including the header row and sanitized values.
	 *
	 * @param table statement table
	 * @return CSV document as a string
	 */
    private String buildCsv(StatementTable table) {
        StringBuilder builder = new StringBuilder();
        builder.append(StatementTable.COLUMNS.stream()
                        .map(StatementTable.Column::title)
                        .collect(Collectors.joining(",")))
                .append('\n');
        for (StatementTable.Row row : table.rows()) {
            builder.append(escape(row.date())).append(',')
                    .append(escape(row.label())).append(',')
                    .append(row.amount().toPlainString())
                    .append('\n');
        }
        return builder.toString();
    }

	/**
	 * Escapes CSV values by quoting entries containing commas, quotes, or newlines.
	 *
	 * @param value raw column value
	 * @return sanitized CSV-safe token
	 */
    private String escape(String value) {
        if (value == null) {
            return "";
        }
        String sanitized = value.replace("\"", "\"\"");
        if (sanitized.contains(",") || sanitized.contains("\"") || sanitized.contains("\n")) {
            return "\"" + sanitized + "\"";
        }
        return sanitized;
    }
}
