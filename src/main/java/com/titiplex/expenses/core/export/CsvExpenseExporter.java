package com.titiplex.expenses.core.export;

import com.opencsv.CSVWriter;
import com.opencsv.ICSVWriter;
import com.titiplex.expenses.core.model.Expense;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Comma separated, UTF-8, header {@code date,category,amount,description}.
 * Fields are quoted only when they hold a comma, a quote or a line break.
 */
@Component
public class CsvExpenseExporter implements ExpenseExporter {

    @Override
    public String format() {
        return "CSV";
    }

    @Override
    public String extension() {
        return "csv";
    }

    @Override
    public void write(List<Expense> expenses, OutputStream out) throws IOException {
        CSVWriter csv = new CSVWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8),
                ICSVWriter.DEFAULT_SEPARATOR,
                ICSVWriter.DEFAULT_QUOTE_CHARACTER,
                ICSVWriter.DEFAULT_ESCAPE_CHARACTER,
                ICSVWriter.DEFAULT_LINE_END);
        csv.writeNext(Expense.FIELDS.toArray(String[]::new), false);
        for (Expense e : expenses) {
            csv.writeNext(new String[]{
                    e.date().toString(),
                    e.category(),
                    e.amount().toPlainString(),
                    e.description()
            }, false);
        }
        csv.flush();
        // CSVWriter records write errors instead of throwing them
        if (csv.checkError()) {
            throw new IOException("CSV write failed");
        }
    }
}
