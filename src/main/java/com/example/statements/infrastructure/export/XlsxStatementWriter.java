package com.example.statements.infrastructure.export;

import com.example.statements.domain.model.StatementTable;
import com.example.statements.infrastructure.exception.SpreadsheetWriteException;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.DataFormat;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;

/**
 * Renders a {@link StatementTable} as an Excel workbook with one sheet and fixed column widths.
 */
@Component
public class XlsxStatementWriter {

    public static final String SHEET_NAME = "Relevé";
    public static final String CONTENT_TYPE = "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet";

    /**
     * @param table normalized statement table
     * @return {@code .xlsx} bytes
     */
    public byte[] write(StatementTable table) {
        try (XSSFWorkbook workbook = new XSSFWorkbook();
             ByteArrayOutputStream output = new ByteArrayOutputStream()) {
            Sheet sheet = workbook.createSheet(SHEET_NAME);
            List<StatementTable.Column> columns = StatementTable.COLUMNS;

            Font headerFont = workbook.createFont();
            headerFont.setBold(true);
            CellStyle headerStyle = workbook.createCellStyle();
            headerStyle.setFont(headerFont);

            DataFormat format = workbook.createDataFormat();
            CellStyle amountStyle = workbook.createCellStyle();
            amountStyle.setDataFormat(format.getFormat("0.00"));

            Row header = sheet.createRow(0);
            for (int i = 0; i < columns.size(); i++) {
                Cell cell = header.createCell(i);
                cell.setCellValue(columns.get(i).title());
                cell.setCellStyle(headerStyle);
                // POI widths are in 1/256th of a character
                sheet.setColumnWidth(i, columns.get(i).width() * 256);
            }

            int rowIndex = 1;
            for (StatementTable.Row row : table.rows()) {
                Row sheetRow = sheet.createRow(rowIndex++);
                sheetRow.createCell(0).setCellValue(row.date());
                sheetRow.createCell(1).setCellValue(row.label());
                Cell amount = sheetRow.createCell(2);
                amount.setCellValue(row.amount().doubleValue());
                amount.setCellStyle(amountStyle);
            }

            workbook.write(output);
            return output.toByteArray();
        } catch (IOException ex) {
            throw new SpreadsheetWriteException("Unable to write the statement workbook.", ex);
        }
    }
}
