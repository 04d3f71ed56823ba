package com.licitia.etl.ingestion;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.licitia.etl.config.LicitiaProperties;
import com.licitia.etl.exception.IngestionException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Streams a headed CSV extract row by row; each row is a column-name to value map in
 * header order.
 */
@Component
public class CsvExtractReader {

    private final CsvMapper mapper = new CsvMapper();
    private final CsvSchema schema;

    @Autowired
    public CsvExtractReader(LicitiaProperties properties) {
        this(properties.getIngestion().getCsvDelimiter());
    }

    CsvExtractReader(char delimiter) {
        this.schema = CsvSchema.emptySchema().withHeader().withColumnSeparator(delimiter);
    }

    /**
     * @return number of rows read
     */
    public long forEachRow(Path extract, Consumer<Map<String, String>> consumer) {
        long count = 0;
        try (MappingIterator<Map<String, String>> rows = mapper.readerForMapOf(String.class)
                .with(schema)
                .readValues(extract.toFile())) {
            while (rows.hasNextValue()) {
                consumer.accept(rows.nextValue());
                count++;
            }
        } catch (IOException e) {
            throw new IngestionException("Could not read extract " + extract + ": " + e.getMessage(), e);
        }
        return count;
    }
}
