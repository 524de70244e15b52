package com.titiplex.expenses.core.error;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Writing the store or an export file failed.
 */
public class PersistException extends ExpenseTrackerException {
    private final Path path;

    public PersistException(Path path, IOException cause) {
        super("cannot write " + path + ": " + cause.getMessage(), cause);
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
