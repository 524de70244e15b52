package com.titiplex.expenses.core.error;

import java.nio.file.Path;

/**
 * The backing file exists but cannot be read as a list of records.
 */
public class CorruptStoreException extends ExpenseTrackerException {
    private final Path path;

    public CorruptStoreException(Path path, String message, Throwable cause) {
        super("store " + path + " is unreadable: " + message, cause);
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
