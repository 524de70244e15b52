package com.titiplex.expenses.core.store;

import com.titiplex.expenses.core.model.Expense;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered collection of expenses backed by durable storage. Positions are
 * 0-based indexes into the current order and shift after every delete.
 */
public interface ExpenseRepository {
    // Lifecycle
    LoadResult load();

    void save();

    Optional<String> lastBackupWarning();

    // Mutations, each validated then persisted before returning
    Expense add(String date, String category, String amount, String description);

    Expense edit(int position, String date, String category, String amount, String description);

    Expense delete(int position);

    // Queries
    List<Expense> findAll();

    Expense get(int position);

    int size();

    List<Expense> filterByCategory(String category);

    Map<String, BigDecimal> summaryByCategory();

    BigDecimal total();

    List<String> categories();
}
