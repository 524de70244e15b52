package com.titiplex.expenses.core.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Resolved locations of the store file and export directory.
 */
@Component
public class TrackerSettings {
    private final Path dataDir;
    private final Path storePath;
    private final Path exportDir;

    public TrackerSettings(@Value("${app.data.dir}") String dataDir,
                           @Value("${app.store.file:expenses.json}") String storeFile,
                           @Value("${app.export.dir:}") String exportDir) {
        this.dataDir = Paths.get(dataDir);
        // an absolute store file wins over the data dir
        this.storePath = this.dataDir.resolve(storeFile);
        this.exportDir = exportDir.isBlank() ? this.dataDir.resolve("reports") : Paths.get(exportDir);
    }

    public Path dataDir() {
        return dataDir;
    }

    public Path storePath() {
        return storePath;
    }

    public Path exportDir() {
        return exportDir;
    }
}
