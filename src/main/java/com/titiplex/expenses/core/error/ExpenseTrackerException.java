package com.titiplex.expenses.core.error;

/**
 * Root of every failure raised by the store, the validator and the exporters.
 */
public class ExpenseTrackerException extends RuntimeException {
    public ExpenseTrackerException(String message) {
        super(message);
    }

    public ExpenseTrackerException(String message, Throwable cause) {
        super(message, cause);
    }
}
