package com.titiplex.expenses.core.error;

public class ExportEmptyException extends ExpenseTrackerException {
    public ExportEmptyException(String format) {
        super("nothing to export to " + format + ": no expenses recorded");
    }
}
