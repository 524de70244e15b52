package com.titiplex.expenses.core.model;

import com.titiplex.expenses.core.error.MalformedRecordException;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record Expense(
        LocalDate date,
        String category,
        BigDecimal amount,
        String description
) {
    public static final String DATE = "date";
    public static final String CATEGORY = "category";
    public static final String AMOUNT = "amount";
    public static final String DESCRIPTION = "description";

    /**
     * Column order shared by the JSON store and both exporters.
     */
    public static final List<String> FIELDS = List.of(DATE, CATEGORY, AMOUNT, DESCRIPTION);

    /**
     * Plain field mapping in {@link #FIELDS} order, date as YYYY-MM-DD.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put(DATE, date.toString());
        m.put(CATEGORY, category);
        m.put(AMOUNT, amount);
        m.put(DESCRIPTION, description);
        return m;
    }

    /**
     * Rebuilds a record from a parsed mapping. Only field presence and kind are
     * checked here; value rules belong to the validator.
     */
    public static Expense fromMap(Map<?, ?> m) {
        String date = requireString(m, DATE);
        String category = requireString(m, CATEGORY);
        String description = requireString(m, DESCRIPTION);

        Object amount = m.get(AMOUNT);
        if (amount == null) throw new MalformedRecordException("missing field '" + AMOUNT + "'");
        if (!(amount instanceof Number n)) {
            throw new MalformedRecordException("field '" + AMOUNT + "' must be a number, got " + kindOf(amount));
        }

        LocalDate parsed;
        try {
            parsed = LocalDate.parse(date);
        } catch (DateTimeParseException e) {
            throw new MalformedRecordException("field '" + DATE + "' is not a YYYY-MM-DD date: " + date, e);
        }
        return new Expense(parsed, category, toDecimal(n), description);
    }

    private static String requireString(Map<?, ?> m, String field) {
        Object v = m.get(field);
        if (v == null) throw new MalformedRecordException("missing field '" + field + "'");
        if (!(v instanceof String s)) {
            throw new MalformedRecordException("field '" + field + "' must be a string, got " + kindOf(v));
        }
        return s;
    }

    private static BigDecimal toDecimal(Number n) {
        if (n instanceof BigDecimal bd) return bd;
        try {
            // toString keeps 25.5 as 25.5 instead of the binary expansion
            return new BigDecimal(n.toString());
        } catch (NumberFormatException e) {
            throw new MalformedRecordException("field '" + AMOUNT + "' is not finite: " + n, e);
        }
    }

    private static String kindOf(Object v) {
        if (v instanceof Map) return "object";
        if (v instanceof List) return "array";
        if (v instanceof Boolean) return "boolean";
        if (v instanceof Number) return "number";
        return v.getClass().getSimpleName().toLowerCase();
    }
}
