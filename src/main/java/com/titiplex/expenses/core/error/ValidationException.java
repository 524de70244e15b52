package com.titiplex.expenses.core.error;

import com.titiplex.expenses.core.validation.ValidationFailure;

import java.util.List;
import java.util.stream.Collectors;

/**
 * One or more fields were rejected. Carries every failure found, not only the first.
 */
public class ValidationException extends ExpenseTrackerException {
    private final List<ValidationFailure> failures;

    public ValidationException(List<ValidationFailure> failures) {
        super(failures.stream().map(ValidationFailure::message).collect(Collectors.joining("; ")));
        this.failures = List.copyOf(failures);
    }

    public ValidationException(ValidationFailure failure) {
        this(List.of(failure));
    }

    public List<ValidationFailure> failures() {
        return failures;
    }

    public boolean has(ValidationFailure.Kind kind) {
        return failures.stream().anyMatch(f -> f.kind() == kind);
    }
}
