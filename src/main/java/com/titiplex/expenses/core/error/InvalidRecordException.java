package com.titiplex.expenses.core.error;

/**
 * A record in the backing file parsed but breaks a field rule.
 * Index is the 0-based position in the file.
 */
public class InvalidRecordException extends ExpenseTrackerException {
    private final int index;
    private final String reason;

    public InvalidRecordException(int index, String reason, Throwable cause) {
        super("record #" + index + " is invalid: " + reason, cause);
        this.index = index;
        this.reason = reason;
    }

    public int index() {
        return index;
    }

    public String reason() {
        return reason;
    }
}
