package com.titiplex.expenses.core.export;

import com.titiplex.expenses.core.config.TrackerSettings;
import com.titiplex.expenses.core.error.CapabilityUnavailableException;
import com.titiplex.expenses.core.error.ExportEmptyException;
import com.titiplex.expenses.core.error.PersistException;
import com.titiplex.expenses.core.model.Expense;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Writes expense snapshots to files. Nothing is created when there is nothing
 * to export; a missing destination becomes a timestamped name in the export dir.
 */
@Service
public class ExportService {
    private static final Logger log = LoggerFactory.getLogger(ExportService.class);
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    static final String PREFIX = "expenses_export_";

    private final Path exportDir;
    private final Clock clock;
    private final ExpenseExporter delimited;
    private final ExpenseExporter spreadsheet;

    @Autowired
    public ExportService(TrackerSettings settings, Clock clock,
                         CsvExpenseExporter csv, ObjectProvider<XlsxExpenseExporter> xlsx) {
        this(settings.exportDir(), clock, csv, xlsx.getIfAvailable());
    }

    /**
     * @param spreadsheet null when spreadsheet export is not available
     */
    public ExportService(Path exportDir, Clock clock, ExpenseExporter delimited, ExpenseExporter spreadsheet) {
        this.exportDir = exportDir;
        this.clock = clock;
        this.delimited = delimited;
        this.spreadsheet = spreadsheet;
    }

    public boolean spreadsheetAvailable() {
        return spreadsheet != null;
    }

    public Path exportDelimited(List<Expense> snapshot, Path destination) {
        return export(delimited, snapshot, destination);
    }

    public Path exportSpreadsheet(List<Expense> snapshot, Path destination) {
        if (spreadsheet == null) throw new CapabilityUnavailableException("Spreadsheet export");
        return export(spreadsheet, snapshot, destination);
    }

    private Path export(ExpenseExporter exporter, List<Expense> snapshot, Path destination) {
        if (snapshot.isEmpty()) throw new ExportEmptyException(exporter.format());

        Path target = destination != null ? destination : defaultDestination(exporter.extension());
        boolean existed = Files.exists(target);
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            try (OutputStream out = Files.newOutputStream(target)) {
                exporter.write(List.copyOf(snapshot), out);
            }
        } catch (IOException e) {
            if (!existed) discard(target, e);
            throw new PersistException(target, e);
        } catch (RuntimeException e) {
            if (!existed) discard(target, e);
            throw e;
        }
        log.info("Exported {} expenses to {} ({})", snapshot.size(), target, exporter.format());
        return target;
    }

    /**
     * {@code expenses_export_yyyyMMdd_HHmmss.<ext>}, suffixed with {@code _N} if taken.
     */
    Path defaultDestination(String extension) {
        String base = PREFIX + STAMP.format(LocalDateTime.now(clock));
        Path candidate = exportDir.resolve(base + "." + extension);
        for (int n = 1; Files.exists(candidate); n++) {
            candidate = exportDir.resolve(base + "_" + n + "." + extension);
        }
        return candidate;
    }

    private static void discard(Path partial, Exception cause) {
        try {
            Files.deleteIfExists(partial);
        } catch (IOException e) {
            cause.addSuppressed(e);
        }
    }
}
