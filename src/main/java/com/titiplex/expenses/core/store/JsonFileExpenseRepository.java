package com.titiplex.expenses.core.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.titiplex.expenses.core.config.TrackerSettings;
import com.titiplex.expenses.core.error.CorruptStoreException;
import com.titiplex.expenses.core.error.IndexOutOfRangeException;
import com.titiplex.expenses.core.error.InvalidRecordException;
import com.titiplex.expenses.core.error.MalformedRecordException;
import com.titiplex.expenses.core.error.PersistException;
import com.titiplex.expenses.core.error.ValidationException;
import com.titiplex.expenses.core.model.Expense;
import com.titiplex.expenses.core.validation.ExpenseValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Keeps the expenses in memory and mirrors them to a pretty-printed JSON array.
 * <p>
 * Every mutation works on a copy of the collection; the copy replaces the live
 * collection only once it is on disk, so a failed save leaves memory as it was.
 * Saves go through a temp file and a rename, after copying the previous file
 * to {@code <file>.backup}.
 */
@Repository
public class JsonFileExpenseRepository implements ExpenseRepository {
    private static final Logger log = LoggerFactory.getLogger(JsonFileExpenseRepository.class);

    private final ObjectMapper mapper = new ObjectMapper()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
    private final Path path;
    private final Path backupPath;
    private final Clock clock;

    private List<Expense> expenses = List.of();
    private boolean loaded;
    private String lastBackupWarning;

    @Autowired
    public JsonFileExpenseRepository(TrackerSettings settings, Clock clock) {
        this(settings.storePath(), clock);
    }

    public JsonFileExpenseRepository(Path path, Clock clock) {
        this.path = path.toAbsolutePath();
        this.backupPath = this.path.resolveSibling(this.path.getFileName() + ".backup");
        this.clock = clock;
    }

    public Path path() {
        return path;
    }

    public Path backupPath() {
        return backupPath;
    }

    // ---------- Lifecycle ----------

    @Override
    public LoadResult load() {
        if (!Files.exists(path)) {
            log.info("No store at {}, starting empty", path);
            commit(new ArrayList<>());
            return new LoadResult(path, 0, false, false);
        }

        String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new CorruptStoreException(path, e.getMessage(), e);
        }
        if (content.isBlank()) {
            log.warn("Store {} is empty, starting with no expenses", path);
            commit(new ArrayList<>());
            return new LoadResult(path, 0, true, true);
        }

        Object root;
        try {
            // untyped parsing keeps decimals exact, including trailing zeros
            root = mapper.readValue(content, Object.class);
        } catch (JsonProcessingException e) {
            throw new CorruptStoreException(path, e.getOriginalMessage(), e);
        }
        if (!(root instanceof List<?> records)) {
            throw new CorruptStoreException(path, "expected a JSON array of records", null);
        }

        List<Expense> parsed = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            parsed.add(parseRecord(i, records.get(i)));
        }
        commit(parsed);
        log.info("Loaded {} expenses from {}", parsed.size(), path);
        return new LoadResult(path, parsed.size(), true, false);
    }

    private Expense parseRecord(int index, Object node) {
        if (!(node instanceof Map<?, ?> fields)) {
            throw new MalformedRecordException("record #" + index + " is not an object");
        }
        Expense raw;
        try {
            raw = Expense.fromMap(fields);
        } catch (MalformedRecordException e) {
            throw new MalformedRecordException("record #" + index + ": " + e.getMessage(), e);
        }
        try {
            return ExpenseValidator.check(raw);
        } catch (ValidationException e) {
            throw new InvalidRecordException(index, e.getMessage(), e);
        }
    }

    @Override
    public void save() {
        ensureLoaded();
        persist(expenses);
    }

    @Override
    public Optional<String> lastBackupWarning() {
        return Optional.ofNullable(lastBackupWarning);
    }

    private void persist(List<Expense> candidate) {
        try {
            Files.createDirectories(path.getParent());
            List<Map<String, Object>> rows = candidate.stream().map(Expense::toMap).toList();
            byte[] json = mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(rows);

            Path tmp = Files.createTempFile(path.getParent(), path.getFileName().toString(), ".tmp");
            try {
                Files.write(tmp, json);
                backup();
                replace(tmp);
            } finally {
                Files.deleteIfExists(tmp);
            }
            log.debug("Saved {} expenses to {}", candidate.size(), path);
        } catch (IOException e) {
            throw new PersistException(path, e);
        }
    }

    private void backup() {
        if (!Files.exists(path)) {
            lastBackupWarning = null;
            return;
        }
        try {
            Files.copy(path, backupPath, StandardCopyOption.REPLACE_EXISTING);
            lastBackupWarning = null;
        } catch (IOException e) {
            // the save itself still goes ahead
            lastBackupWarning = "could not back up " + path + " to " + backupPath + ": " + e.getMessage();
            log.warn("Backup of {} failed, saving anyway", path, e);
        }
    }

    private void replace(Path tmp) throws IOException {
        try {
            Files.move(tmp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void ensureLoaded() {
        if (!loaded) load();
    }

    private void commit(List<Expense> next) {
        this.expenses = Collections.unmodifiableList(next);
        this.loaded = true;
    }

    // ---------- Mutations ----------

    @Override
    public Expense add(String date, String category, String amount, String description) {
        ensureLoaded();
        Expense e = ExpenseValidator.validate(date, category, amount, description, LocalDate.now(clock));
        List<Expense> next = new ArrayList<>(expenses);
        next.add(e);
        persist(next);
        commit(next);
        return e;
    }

    @Override
    public Expense edit(int position, String date, String category, String amount, String description) {
        ensureLoaded();
        checkPosition(position);
        Expense e = ExpenseValidator.validate(date, category, amount, description, LocalDate.now(clock));
        List<Expense> next = new ArrayList<>(expenses);
        next.set(position, e);
        persist(next);
        commit(next);
        return e;
    }

    @Override
    public Expense delete(int position) {
        ensureLoaded();
        checkPosition(position);
        List<Expense> next = new ArrayList<>(expenses);
        Expense removed = next.remove(position);
        persist(next);
        commit(next);
        return removed;
    }

    private void checkPosition(int position) {
        if (position < 0 || position >= expenses.size()) {
            throw new IndexOutOfRangeException(position, expenses.size());
        }
    }

    // ---------- Queries ----------

    @Override
    public List<Expense> findAll() {
        ensureLoaded();
        return expenses;
    }

    @Override
    public Expense get(int position) {
        ensureLoaded();
        checkPosition(position);
        return expenses.get(position);
    }

    @Override
    public int size() {
        ensureLoaded();
        return expenses.size();
    }

    @Override
    public List<Expense> filterByCategory(String category) {
        ensureLoaded();
        String key = key(category);
        List<Expense> out = new ArrayList<>();
        for (Expense e : expenses) {
            if (key(e.category()).equals(key)) out.add(e);
        }
        return out;
    }

    @Override
    public Map<String, BigDecimal> summaryByCategory() {
        ensureLoaded();
        // key -> label as first seen
        Map<String, String> labels = new LinkedHashMap<>();
        Map<String, BigDecimal> sums = new LinkedHashMap<>();
        for (Expense e : expenses) {
            String k = key(e.category());
            labels.putIfAbsent(k, e.category());
            sums.merge(k, e.amount(), BigDecimal::add);
        }
        Map<String, BigDecimal> out = new LinkedHashMap<>();
        sums.forEach((k, sum) -> out.put(labels.get(k), sum));
        return out;
    }

    @Override
    public BigDecimal total() {
        ensureLoaded();
        BigDecimal sum = BigDecimal.ZERO;
        for (Expense e : expenses) sum = sum.add(e.amount());
        return sum;
    }

    @Override
    public List<String> categories() {
        ensureLoaded();
        Map<String, String> byKey = new TreeMap<>();
        for (Expense e : expenses) byKey.putIfAbsent(key(e.category()), e.category());
        return List.copyOf(byKey.values());
    }

    private static String key(String category) {
        return category == null ? "" : category.trim().toLowerCase(Locale.ROOT);
    }
}
