package com.titiplex.expenses.core.model;

import com.titiplex.expenses.core.error.MalformedRecordException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExpenseTest {

    @Test
    void toMapKeepsColumnOrder() {
        Expense e = new Expense(LocalDate.of(2024, 1, 15), "Food", new BigDecimal("25.50"), "Lunch");

        Map<String, Object> m = e.toMap();

        assertThat(m).containsExactly(
                Map.entry("date", "2024-01-15"),
                Map.entry("category", "Food"),
                Map.entry("amount", new BigDecimal("25.50")),
                Map.entry("description", "Lunch"));
    }

    @Test
    void fromMapAcceptsIntegerAndDoubleAmounts() {
        Expense whole = Expense.fromMap(record("2024-01-16", "Transport", 15, "Bus fare"));
        Expense fraction = Expense.fromMap(record("2024-01-15", "Food", 25.5, "Lunch"));

        assertThat(whole.amount()).isEqualByComparingTo("15");
        assertThat(fraction.amount()).isEqualTo(new BigDecimal("25.5"));
        assertThat(fraction.date()).isEqualTo(LocalDate.of(2024, 1, 15));
    }

    @Test
    void fromMapRejectsMissingCategory() {
        Map<String, Object> m = record("2024-01-15", "Food", 25.5, "Lunch");
        m.remove("category");

        assertThatThrownBy(() -> Expense.fromMap(m))
                .isInstanceOf(MalformedRecordException.class)
                .hasMessageContaining("category");
    }

    @Test
    void fromMapRejectsNonNumericAmount() {
        assertThatThrownBy(() -> Expense.fromMap(record("2024-01-15", "Food", "25.50", "Lunch")))
                .isInstanceOf(MalformedRecordException.class)
                .hasMessageContaining("must be a number");
    }

    @Test
    void fromMapRejectsNonStringDescription() {
        assertThatThrownBy(() -> Expense.fromMap(record("2024-01-15", "Food", 1, 42)))
                .isInstanceOf(MalformedRecordException.class)
                .hasMessageContaining("description");
    }

    @Test
    void fromMapRejectsUnparsableDate() {
        assertThatThrownBy(() -> Expense.fromMap(record("15/01/2024", "Food", 1, "Lunch")))
                .isInstanceOf(MalformedRecordException.class)
                .hasMessageContaining("date");
    }

    private static Map<String, Object> record(Object date, Object category, Object amount, Object description) {
        Map<String, Object> m = new HashMap<>();
        m.put("date", date);
        m.put("category", category);
        m.put("amount", amount);
        m.put("description", description);
        return m;
    }
}
