package com.titiplex.expenses.core.validation;

import com.titiplex.expenses.core.error.ValidationException;
import com.titiplex.expenses.core.model.Expense;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Field rules for an expense. Every method is pure: it returns the normalized
 * value or throws a {@link ValidationException}.
 */
public final class ExpenseValidator {

    // uuuu, not yyyy: STRICT resolving needs a proleptic year
    public static final DateTimeFormatter DATE_FMT =
            DateTimeFormatter.ofPattern("uuuu-MM-dd").withResolverStyle(ResolverStyle.STRICT);

    /** Digits allowed on each side of the decimal point. */
    public static final int MAX_AMOUNT_DIGITS = 38;

    private ExpenseValidator() {
    }

    public static BigDecimal validateAmount(String raw) {
        if (raw == null || raw.isBlank()) {
            throw fail(ValidationFailure.Kind.INVALID_AMOUNT, Expense.AMOUNT, "amount is required");
        }
        BigDecimal amount;
        try {
            amount = new BigDecimal(raw.trim());
        } catch (NumberFormatException e) {
            throw fail(ValidationFailure.Kind.INVALID_AMOUNT, Expense.AMOUNT, "amount '" + raw + "' is not a number");
        }
        return validateAmount(amount);
    }

    public static BigDecimal validateAmount(BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw fail(ValidationFailure.Kind.INVALID_AMOUNT, Expense.AMOUNT, "amount must be greater than zero, got " + amount);
        }
        int fraction = Math.max(amount.scale(), 0);
        int integer = Math.max(amount.precision() - amount.scale(), 0);
        if (fraction > MAX_AMOUNT_DIGITS || integer > MAX_AMOUNT_DIGITS) {
            throw fail(ValidationFailure.Kind.INVALID_AMOUNT, Expense.AMOUNT,
                    "amount has too many digits, at most " + MAX_AMOUNT_DIGITS + " before and after the decimal point");
        }
        return amount;
    }

    public static LocalDate validateDate(String raw) {
        if (raw == null || raw.isBlank()) {
            throw fail(ValidationFailure.Kind.INVALID_DATE, Expense.DATE, "date is required (YYYY-MM-DD)");
        }
        try {
            return LocalDate.parse(raw.trim(), DATE_FMT);
        } catch (DateTimeParseException e) {
            throw fail(ValidationFailure.Kind.INVALID_DATE, Expense.DATE, "date '" + raw + "' is not a valid YYYY-MM-DD date");
        }
    }

    public static String validateCategory(String raw) {
        String v = raw == null ? "" : raw.trim();
        if (v.isEmpty()) throw fail(ValidationFailure.Kind.EMPTY_CATEGORY, Expense.CATEGORY, "category must not be empty");
        return v;
    }

    public static String validateDescription(String raw) {
        String v = raw == null ? "" : raw.trim();
        if (v.isEmpty()) {
            throw fail(ValidationFailure.Kind.EMPTY_DESCRIPTION, Expense.DESCRIPTION, "description must not be empty");
        }
        return v;
    }

    /**
     * Validates a whole record from raw input and reports all failures at once.
     * A blank date means {@code today}.
     */
    public static Expense validate(String date, String category, String amount, String description, LocalDate today) {
        List<ValidationFailure> failures = new ArrayList<>();
        LocalDate d = (date == null || date.isBlank()) ? today : collect(failures, () -> validateDate(date));
        String c = collect(failures, () -> validateCategory(category));
        BigDecimal a = collect(failures, () -> validateAmount(amount));
        String s = collect(failures, () -> validateDescription(description));
        if (!failures.isEmpty()) throw new ValidationException(failures);
        return new Expense(d, c, a, s);
    }

    /**
     * Re-checks a typed record, e.g. one read back from the store file.
     */
    public static Expense check(Expense e) {
        List<ValidationFailure> failures = new ArrayList<>();
        if (e.date() == null) {
            failures.add(new ValidationFailure(ValidationFailure.Kind.INVALID_DATE, Expense.DATE, "date is required (YYYY-MM-DD)"));
        }
        String c = collect(failures, () -> validateCategory(e.category()));
        BigDecimal a = collect(failures, () -> validateAmount(e.amount()));
        String s = collect(failures, () -> validateDescription(e.description()));
        if (!failures.isEmpty()) throw new ValidationException(failures);
        return new Expense(e.date(), c, a, s);
    }

    private static <T> T collect(List<ValidationFailure> failures, Supplier<T> check) {
        try {
            return check.get();
        } catch (ValidationException ex) {
            failures.addAll(ex.failures());
            return null;
        }
    }

    private static ValidationException fail(ValidationFailure.Kind kind, String field, String message) {
        return new ValidationException(new ValidationFailure(kind, field, message));
    }
}
