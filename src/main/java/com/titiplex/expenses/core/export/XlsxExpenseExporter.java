package com.titiplex.expenses.core.export;

import com.titiplex.expenses.core.model.Expense;
import org.apache.poi.ss.SpreadsheetVersion;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.HorizontalAlignment;
import org.apache.poi.ss.usermodel.IndexedColors;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.xssf.usermodel.XSSFSheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.IOException;
import java.io.OutputStream;
import java.math.BigDecimal;
import java.util.List;

/**
 * Single "Expenses" sheet: styled header, one row per expense, and a
 * "Total:" row two rows below the data.
 * Only instantiated when Apache POI is on the classpath, see {@link SpreadsheetExportConfig}.
 */
public class XlsxExpenseExporter implements ExpenseExporter {
    public static final String SHEET = "Expenses";
    public static final List<String> HEADERS = List.of("Date", "Category", "Amount", "Description");
    public static final String TOTAL_LABEL = "Total:";
    public static final int MAX_COLUMN_CHARS = 50;
    public static final int MAX_CELL_CHARS = SpreadsheetVersion.EXCEL2007.getMaxTextLength();

    private static final int AMOUNT_COL = 2;

    @Override
    public String format() {
        return "XLSX";
    }

    @Override
    public String extension() {
        return "xlsx";
    }

    @Override
    public void write(List<Expense> expenses, OutputStream out) throws IOException {
        try (XSSFWorkbook wb = new XSSFWorkbook()) {
            XSSFSheet sheet = wb.createSheet(SHEET);
            int[] widths = new int[HEADERS.size()];

            Font bold = wb.createFont();
            bold.setBold(true);

            CellStyle header = wb.createCellStyle();
            header.setFont(bold);
            header.setFillForegroundColor(IndexedColors.GREY_25_PERCENT.getIndex());
            header.setFillPattern(FillPatternType.SOLID_FOREGROUND);
            header.setAlignment(HorizontalAlignment.CENTER);

            short money = wb.createDataFormat().getFormat("#,##0.00");
            CellStyle amount = wb.createCellStyle();
            amount.setDataFormat(money);

            CellStyle totalStyle = wb.createCellStyle();
            totalStyle.setFont(bold);
            totalStyle.setDataFormat(money);

            Row head = sheet.createRow(0);
            for (int c = 0; c < HEADERS.size(); c++) {
                Cell cell = head.createCell(c);
                cell.setCellValue(HEADERS.get(c));
                cell.setCellStyle(header);
                track(widths, c, HEADERS.get(c));
            }

            int r = 1;
            BigDecimal total = BigDecimal.ZERO;
            for (Expense e : expenses) {
                Row row = sheet.createRow(r++);
                text(row, 0, e.date().toString(), widths);
                text(row, 1, e.category(), widths);
                Cell a = row.createCell(AMOUNT_COL);
                a.setCellValue(e.amount().doubleValue());
                a.setCellStyle(amount);
                track(widths, AMOUNT_COL, e.amount().toPlainString());
                text(row, 3, e.description(), widths);
                total = total.add(e.amount());
            }

            // r is one past the last data row; leave one blank row
            Row sum = sheet.createRow(r + 1);
            Cell label = sum.createCell(AMOUNT_COL - 1);
            label.setCellValue(TOTAL_LABEL);
            label.setCellStyle(totalStyle);
            track(widths, AMOUNT_COL - 1, TOTAL_LABEL);
            Cell value = sum.createCell(AMOUNT_COL);
            value.setCellValue(total.doubleValue());
            value.setCellStyle(totalStyle);
            track(widths, AMOUNT_COL, total.toPlainString());

            for (int c = 0; c < widths.length; c++) {
                sheet.setColumnWidth(c, columnWidth(widths[c]));
            }
            wb.write(out);
        }
    }

    /**
     * POI widths are in 1/256 of a character.
     */
    static int columnWidth(int chars) {
        return Math.min(Math.max(chars, 1), MAX_COLUMN_CHARS) * 256;
    }

    private static void text(Row row, int col, String value, int[] widths) throws IOException {
        if (value != null && value.length() > MAX_CELL_CHARS) {
            throw new IOException(HEADERS.get(col) + " of expense #" + row.getRowNum() + " has " + value.length()
                    + " characters, a spreadsheet cell holds at most " + MAX_CELL_CHARS);
        }
        row.createCell(col).setCellValue(value);
        track(widths, col, value);
    }

    private static void track(int[] widths, int col, String value) {
        if (value != null) widths[col] = Math.max(widths[col], value.length());
    }
}
