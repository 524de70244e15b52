package com.titiplex.expenses.core.export;

import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the spreadsheet exporter only when Apache POI can be loaded and the
 * feature is not switched off with {@code app.export.spreadsheet.enabled=false}.
 */
@Configuration
@ConditionalOnClass(name = "org.apache.poi.xssf.usermodel.XSSFWorkbook")
@ConditionalOnProperty(name = "app.export.spreadsheet.enabled", havingValue = "true", matchIfMissing = true)
public class SpreadsheetExportConfig {

    @Bean
    public XlsxExpenseExporter xlsxExpenseExporter() {
        return new XlsxExpenseExporter();
    }
}
