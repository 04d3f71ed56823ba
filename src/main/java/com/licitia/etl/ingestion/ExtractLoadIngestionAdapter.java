package com.licitia.etl.ingestion;

import com.licitia.etl.exception.ConfigurationException;
import com.licitia.etl.exception.IngestionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Extract with the configured commands, then load the CSV extract into
 * {@code <schema>.<dataset>_<subset>}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExtractLoadIngestionAdapter implements IngestionAdapter {

    private final DatasetCatalog catalog;
    private final ExtractCommandRunner commandRunner;
    private final ExtractLocator locator;
    private final L0TableLoader loader;

    @Override
    public IngestionResult run(String dataset, String subset, IngestionOptions options) {
        DatasetDefinition definition = catalog.require(dataset, subset);
        IngestionOptions opts = options != null ? options : IngestionOptions.defaults();
        if (definition.requiresYears() && !opts.hasYears()) {
            throw new ConfigurationException("Dataset " + dataset + " requires a year range (--years=YYYY-YYYY)");
        }

        if (!opts.processOnly()) {
            commandRunner.run(dataset, subset, opts);
        }
        if (opts.downloadOnly()) {
            log.info("Download-only run for {}/{}, skipping load", dataset, subset);
            return IngestionResult.empty();
        }

        Path extract = locator.locate(definition, subset, opts);
        if (!Files.isRegularFile(extract)) {
            throw new IngestionException("Extract not found: " + extract);
        }
        log.info("Loading {} into L0 table {}", extract, tableName(dataset, subset));
        return loader.load(tableName(dataset, subset), definition.naturalIdColumn(), extract);
    }

    public static String tableName(String dataset, String subset) {
        return dataset + "_" + subset;
    }
}
