package com.titiplex.expenses.core.store;

import java.nio.file.Path;

/**
 * @param emptyFile the file existed but held nothing but whitespace
 */
public record LoadResult(Path path, int records, boolean fileExisted, boolean emptyFile) {
}
