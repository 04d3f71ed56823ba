package com.licitia.etl.ingestion;

import com.licitia.etl.config.LicitiaProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Where extract commands leave their output: {@code <tmp-dir>/<dataset>/<subset>.csv},
 * with a {@code _<from>_<to>} suffix for year-ranged datasets.
 */
@Component
@RequiredArgsConstructor
public class ExtractLocator {

    private final LicitiaProperties properties;

    public Path locate(DatasetDefinition definition, String subset, IngestionOptions options) {
        String fileName = definition.requiresYears() && options.hasYears()
                ? subset + "_" + options.yearFrom() + "_" + options.yearTo() + ".csv"
                : subset + ".csv";
        return properties.getIngestion().tmpPath().resolve(definition.name()).resolve(fileName);
    }
}
