package com.titiplex.expenses.core.error;

/**
 * An optional feature (spreadsheet export) is not configured or its library is missing.
 */
public class CapabilityUnavailableException extends ExpenseTrackerException {
    public CapabilityUnavailableException(String capability) {
        super(capability + " is not available in this installation");
    }
}
