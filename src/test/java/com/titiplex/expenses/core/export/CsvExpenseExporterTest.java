package com.titiplex.expenses.core.export;

import com.opencsv.CSVReader;
import com.titiplex.expenses.core.model.Expense;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.StringReader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CsvExpenseExporterTest {

    private final CsvExpenseExporter exporter = new CsvExpenseExporter();

    @Test
    void writesHeaderThenRowsInOrder() throws Exception {
        String csv = write(List.of(
                expense("2024-01-15", "Food", "25.50", "Lunch"),
                expense("2024-01-16", "Transport", "15.00", "Bus fare")));

        assertThat(csv).isEqualTo("""
                date,category,amount,description
                2024-01-15,Food,25.50,Lunch
                2024-01-16,Transport,15.00,Bus fare
                """);
    }

    @Test
    void quotesOnlyFieldsThatNeedIt() throws Exception {
        String csv = write(List.of(expense("2024-01-20", "Food", "30", "a, \"b\", c")));

        assertThat(csv).endsWith("2024-01-20,Food,30,\"a, \"\"b\"\", c\"\n");
    }

    @Test
    void descriptionSurvivesCsvQuoting() throws Exception {
        String tricky = "a, \"b\", c";
        String multiline = "first line\nsecond line";

        String csv = write(List.of(
                expense("2024-01-20", "Food", "30", tricky),
                expense("2024-01-21", "Misc", "1", multiline)));

        try (CSVReader reader = new CSVReader(new StringReader(csv))) {
            List<String[]> rows = reader.readAll();
            assertThat(rows).hasSize(3);
            assertThat(rows.get(1)[3]).isEqualTo(tricky);
            assertThat(rows.get(2)[3]).isEqualTo(multiline);
        }
    }

    @Test
    void writesUtf8() throws Exception {
        String csv = write(List.of(expense("2024-01-20", "Café", "4.10", "Crème brûlée")));

        assertThat(csv).contains("Café,4.10,Crème brûlée");
    }

    private String write(List<Expense> expenses) throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        exporter.write(expenses, out);
        return out.toString(StandardCharsets.UTF_8);
    }

    static Expense expense(String date, String category, String amount, String description) {
        return new Expense(LocalDate.parse(date), category, new BigDecimal(amount), description);
    }
}
