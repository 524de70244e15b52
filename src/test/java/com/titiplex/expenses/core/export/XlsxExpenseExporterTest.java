package com.titiplex.expenses.core.export;

import com.titiplex.expenses.core.model.Expense;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.HorizontalAlignment;
import org.apache.poi.xssf.usermodel.XSSFCell;
import org.apache.poi.xssf.usermodel.XSSFRow;
import org.apache.poi.xssf.usermodel.XSSFSheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;

import static com.titiplex.expenses.core.export.CsvExpenseExporterTest.expense;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class XlsxExpenseExporterTest {

    private final XlsxExpenseExporter exporter = new XlsxExpenseExporter();

    @Test
    void writesStyledHeaderRowsAndTotal() throws Exception {
        try (XSSFWorkbook wb = write(List.of(
                expense("2024-01-15", "Food", "25.50", "Lunch"),
                expense("2024-01-16", "Transport", "15.00", "Bus fare")))) {

            assertThat(wb.getNumberOfSheets()).isEqualTo(1);
            XSSFSheet sheet = wb.getSheet("Expenses");
            assertThat(sheet).isNotNull();

            XSSFRow head = sheet.getRow(0);
            for (int c = 0; c < 4; c++) {
                XSSFCell cell = head.getCell(c);
                assertThat(cell.getStringCellValue()).isEqualTo(XlsxExpenseExporter.HEADERS.get(c));
                CellStyle style = cell.getCellStyle();
                assertThat(wb.getFontAt(style.getFontIndex()).getBold()).isTrue();
                assertThat(style.getFillPattern()).isEqualTo(FillPatternType.SOLID_FOREGROUND);
                assertThat(style.getAlignment()).isEqualTo(HorizontalAlignment.CENTER);
            }

            XSSFRow first = sheet.getRow(1);
            assertThat(first.getCell(0).getStringCellValue()).isEqualTo("2024-01-15");
            assertThat(first.getCell(1).getStringCellValue()).isEqualTo("Food");
            assertThat(first.getCell(2).getNumericCellValue()).isCloseTo(25.50, within(1e-9));
            assertThat(first.getCell(3).getStringCellValue()).isEqualTo("Lunch");
            assertThat(sheet.getRow(2).getCell(3).getStringCellValue()).isEqualTo("Bus fare");

            // last data row is 2, total sits two rows below
            assertThat((Object) sheet.getRow(3)).isNull();
            XSSFRow total = sheet.getRow(4);
            assertThat(total.getCell(1).getStringCellValue()).isEqualTo("Total:");
            assertThat(total.getCell(2).getNumericCellValue()).isCloseTo(40.50, within(1e-9));
            assertThat(wb.getFontAt(total.getCell(2).getCellStyle().getFontIndex()).getBold()).isTrue();
            assertThat(sheet.getLastRowNum()).isEqualTo(4);
        }
    }

    @Test
    void columnWidthFollowsLongestCellUpToFifty() throws Exception {
        String longText = "x".repeat(80);
        try (XSSFWorkbook wb = write(List.of(
                expense("2024-01-15", "Groceries", "1234.56", longText)))) {
            XSSFSheet sheet = wb.getSheet("Expenses");

            assertThat(sheet.getColumnWidth(0)).isEqualTo(10 * 256);
            assertThat(sheet.getColumnWidth(1)).isEqualTo(9 * 256);
            assertThat(sheet.getColumnWidth(2)).isEqualTo(7 * 256);
            assertThat(sheet.getColumnWidth(3)).isEqualTo(50 * 256);
        }
    }

    @Test
    void textLongerThanACellHoldsIsAnIoFailure() throws Exception {
        String fits = "y".repeat(XlsxExpenseExporter.MAX_CELL_CHARS);
        try (XSSFWorkbook wb = write(List.of(expense("2024-01-15", "Food", "1", fits)))) {
            assertThat(wb.getSheet("Expenses").getRow(1).getCell(3).getStringCellValue()).hasSize(32767);
        }

        String tooLong = "x".repeat(XlsxExpenseExporter.MAX_CELL_CHARS + 1);
        assertThatThrownBy(() -> exporter.write(
                List.of(expense("2024-01-15", "Food", "1", tooLong)), new ByteArrayOutputStream()))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Description of expense #1");
    }

    @Test
    void columnWidthHelperCaps() {
        assertThat(XlsxExpenseExporter.columnWidth(3)).isEqualTo(3 * 256);
        assertThat(XlsxExpenseExporter.columnWidth(500)).isEqualTo(50 * 256);
    }

    private XSSFWorkbook write(List<Expense> expenses) throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        exporter.write(expenses, out);
        return new XSSFWorkbook(new ByteArrayInputStream(out.toByteArray()));
    }
}
