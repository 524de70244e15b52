package com.titiplex.expenses.ui;

import com.titiplex.expenses.core.error.CapabilityUnavailableException;
import com.titiplex.expenses.core.error.CorruptStoreException;
import com.titiplex.expenses.core.error.ExportEmptyException;
import com.titiplex.expenses.core.error.IndexOutOfRangeException;
import com.titiplex.expenses.core.error.InvalidRecordException;
import com.titiplex.expenses.core.error.MalformedRecordException;
import com.titiplex.expenses.core.error.PersistException;
import com.titiplex.expenses.core.error.ValidationException;
import com.titiplex.expenses.core.model.Expense;
import com.titiplex.expenses.core.store.LoadResult;
import com.titiplex.expenses.core.tracker.ExpenseTracker;
import com.titiplex.expenses.core.validation.ValidationFailure;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.math.BigDecimal;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Non-interactive command front end. Rows are shown with 1-based labels that
 * only mean "n-th in the current listing".
 */
@Component
public class CommandLineShell {
    public static final int OK = 0;
    public static final int USER_ERROR = 1;
    public static final int STORE_ERROR = 2;

    private final ExpenseTracker tracker;

    public CommandLineShell(ExpenseTracker tracker) {
        this.tracker = tracker;
    }

    public int run(String[] args, PrintStream out) {
        if (args.length == 0 || args[0].equals("help")) {
            usage(out);
            return args.length == 0 ? USER_ERROR : OK;
        }

        try {
            LoadResult loaded = tracker.load();
            if (loaded.emptyFile()) out.println("Warning: " + loaded.path() + " is empty, starting fresh.");
        } catch (CorruptStoreException | MalformedRecordException | InvalidRecordException e) {
            out.println("Cannot open expense store: " + e.getMessage());
            return STORE_ERROR;
        }

        try {
            return dispatch(args, out);
        } catch (ValidationException e) {
            for (ValidationFailure f : e.failures()) out.println("Invalid " + f.field() + ": " + f.message());
            return USER_ERROR;
        } catch (IndexOutOfRangeException e) {
            out.println("No expense #" + (e.position() + 1) + " (" + e.size() + " recorded).");
            return USER_ERROR;
        } catch (ExportEmptyException | CapabilityUnavailableException | PersistException e) {
            out.println(e.getMessage());
            return USER_ERROR;
        } catch (InvalidPathException e) {
            out.println("Invalid file name: " + e.getMessage());
            return USER_ERROR;
        }
    }

    private int dispatch(String[] args, PrintStream out) {
        switch (args[0]) {
            case "add" -> {
                if (args.length < 4) return badUsage(out, "add <amount> <category> <description> [date]");
                Expense e = tracker.add(args.length > 4 ? args[4] : null, args[2], args[1], args[3]);
                out.printf(Locale.ROOT, "Added expense: %s in %s on %s%n", money(e.amount()), e.category(), e.date());
            }
            case "list" -> {
                List<Expense> rows = args.length > 1 ? tracker.filterByCategory(args[1]) : tracker.list();
                if (rows.isEmpty()) {
                    out.println("No expenses recorded.");
                } else {
                    for (int i = 0; i < rows.size(); i++) out.println(row(i + 1, rows.get(i)));
                    BigDecimal sum = rows.stream().map(Expense::amount).reduce(BigDecimal.ZERO, BigDecimal::add);
                    out.println("Total: " + money(sum));
                }
            }
            case "edit" -> {
                if (args.length < 6) return badUsage(out, "edit <n> <date> <category> <amount> <description>");
                Integer n = label(args[1], out);
                if (n == null) return USER_ERROR;
                Expense e = tracker.edit(n - 1, args[2], args[3], args[4], args[5]);
                out.println("Updated " + row(n, e));
            }
            case "delete" -> {
                if (args.length < 2) return badUsage(out, "delete <n>");
                Integer n = label(args[1], out);
                if (n == null) return USER_ERROR;
                Expense e = tracker.delete(n - 1);
                out.println("Deleted " + row(n, e));
            }
            case "summary" -> {
                Map<String, BigDecimal> summary = tracker.summaryByCategory();
                if (summary.isEmpty()) out.println("No expenses recorded.");
                summary.forEach((cat, sum) -> out.println(cat + ": " + money(sum)));
            }
            case "categories" -> tracker.categories().forEach(out::println);
            case "total" -> out.println("Total: " + money(tracker.total()));
            case "export-csv" -> out.println("Exported to " + tracker.exportDelimited(destination(args)));
            case "export-xlsx" -> out.println("Exported to " + tracker.exportSpreadsheet(destination(args)));
            default -> {
                out.println("Unknown command '" + args[0] + "'. Use 'help' for usage information.");
                return USER_ERROR;
            }
        }
        return OK;
    }

    private static Path destination(String[] args) {
        return args.length > 1 ? Path.of(args[1]) : null;
    }

    private static Integer label(String raw, PrintStream out) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            out.println("'" + raw + "' is not an expense number.");
            return null;
        }
    }

    static String row(int label, Expense e) {
        return label + ". " + e.date() + " | " + e.category() + " | " + money(e.amount()) + " | " + e.description();
    }

    static String money(BigDecimal amount) {
        return String.format(Locale.ROOT, "$%.2f", amount);
    }

    private static int badUsage(PrintStream out, String usage) {
        out.println("Usage: " + usage);
        return USER_ERROR;
    }

    private static void usage(PrintStream out) {
        out.println("Usage:");
        out.println("  add <amount> <category> <description> [YYYY-MM-DD]");
        out.println("  list [category]");
        out.println("  edit <n> <YYYY-MM-DD> <category> <amount> <description>");
        out.println("  delete <n>");
        out.println("  summary | categories | total");
        out.println("  export-csv [file]");
        out.println("  export-xlsx [file]");
        out.println("  help");
    }
}
