package com.titiplex.expenses.core.export;

import com.titiplex.expenses.core.model.Expense;

import java.io.IOException;
import java.io.OutputStream;
import java.util.List;

/**
 * Encodes a snapshot of expenses into one downstream file format.
 * Implementations never modify the list they are given.
 */
public interface ExpenseExporter {
    String format();

    String extension();

    void write(List<Expense> expenses, OutputStream out) throws IOException;
}
