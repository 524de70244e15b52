package com.titiplex.expenses.core.tracker;

import com.titiplex.expenses.core.export.ExportService;
import com.titiplex.expenses.core.model.Expense;
import com.titiplex.expenses.core.store.ExpenseRepository;
import com.titiplex.expenses.core.store.LoadResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Entry point for front ends. Front ends pass fully resolved field values;
 * "keep the old value if blank" style editing is theirs to implement.
 */
@Service
public class ExpenseTracker {
    private static final Logger log = LoggerFactory.getLogger(ExpenseTracker.class);

    private final ExpenseRepository repo;
    private final ExportService exports;

    public ExpenseTracker(ExpenseRepository repo, ExportService exports) {
        this.repo = repo;
        this.exports = exports;
    }

    public LoadResult load() {
        return repo.load();
    }

    public Expense add(String date, String category, String amount, String description) {
        Expense e = repo.add(date, category, amount, description);
        log.info("Added expense {} {} in {}", e.date(), e.amount().toPlainString(), e.category());
        return e;
    }

    public Expense edit(int position, String date, String category, String amount, String description) {
        Expense e = repo.edit(position, date, category, amount, description);
        log.info("Edited expense at position {}", position);
        return e;
    }

    public Expense delete(int position) {
        Expense e = repo.delete(position);
        log.info("Deleted expense at position {} ({} {})", position, e.date(), e.category());
        return e;
    }

    public List<Expense> list() {
        return repo.findAll();
    }

    public List<Expense> filterByCategory(String category) {
        return repo.filterByCategory(category);
    }

    public Map<String, BigDecimal> summaryByCategory() {
        return repo.summaryByCategory();
    }

    public BigDecimal total() {
        return repo.total();
    }

    public List<String> categories() {
        return repo.categories();
    }

    /**
     * @param destination null for a timestamped file in the export directory
     */
    public Path exportDelimited(Path destination) {
        return exports.exportDelimited(repo.findAll(), destination);
    }

    public Path exportSpreadsheet(Path destination) {
        return exports.exportSpreadsheet(repo.findAll(), destination);
    }

    public boolean spreadsheetAvailable() {
        return exports.spreadsheetAvailable();
    }
}
