package com.titiplex.expenses.core.error;

/**
 * A stored record lacks a required field or a field has the wrong kind.
 */
public class MalformedRecordException extends ExpenseTrackerException {
    public MalformedRecordException(String message) {
        super(message);
    }

    public MalformedRecordException(String message, Throwable cause) {
        super(message, cause);
    }
}
