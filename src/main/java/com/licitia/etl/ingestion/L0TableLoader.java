package com.licitia.etl.ingestion;

import com.licitia.etl.config.LicitiaProperties;
import com.licitia.etl.exception.IngestionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Loads an extract into an L0 table keyed on the source's natural id.
 * <p>
 * Each table has a surrogate {@code l0_id}, a unique {@code natural_id}, one text column
 * per extract column and {@code ingested_at}. Rows are inserted with
 * {@code ON CONFLICT DO NOTHING}: a natural id already present is omitted, which makes
 * loading the same extract twice a no-op.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class L0TableLoader {

    static final String NATURAL_ID = "natural_id";
    private static final Set<String> RESERVED = Set.of("l0_id", NATURAL_ID, "ingested_at");
    private static final Pattern IDENTIFIER = Pattern.compile("[a-z_][a-z0-9_]*");

    private final JdbcTemplate jdbcTemplate;
    private final CsvExtractReader reader;
    private final LicitiaProperties properties;

    public IngestionResult load(String tableName, String naturalIdColumn, Path extract) {
        String schema = requireIdentifier(properties.getIngestion().getSchema());
        String table = requireIdentifier(tableName);

        ExtractScan scan = scan(extract, naturalIdColumn);
        if (scan.rows() == 0) {
            log.info("Extract {} has no rows, nothing to load", extract);
            return IngestionResult.empty();
        }

        boolean syntheticIds = scan.rowsWithNaturalId() == 0;
        if (syntheticIds) {
            log.info("Column '{}' has no values, using synthetic natural ids ({}_0, {}_1, ...)",
                    scan.naturalIdSource(), table, table);
        } else if (scan.rowsWithNaturalId() < scan.rows()) {
            log.info("Rows with natural id: {} of {} (rows without one are dropped)",
                    scan.rowsWithNaturalId(), scan.rows());
        }

        Map<String, String> columns = columnMapping(scan.header(), scan.naturalIdSource());
        ensureTable(schema, table, columns.values());

        String insertSql = insertSql(schema, table, columns.values());
        int batchSize = properties.getIngestion().effectiveBatchSize();

        LoadCounter counter = new LoadCounter();
        List<Object[]> batch = new ArrayList<>(Math.min(batchSize, 1024));
        long[] index = {0};

        reader.forEachRow(extract, row -> {
            long rowIndex = index[0]++;
            String naturalId = syntheticIds
                    ? table + "_" + rowIndex
                    : blankToNull(row.get(scan.naturalIdSource()));
            if (naturalId == null) {
                return;
            }
            Object[] args = new Object[columns.size() + 1];
            args[0] = naturalId;
            int i = 1;
            for (String source : columns.keySet()) {
                args[i++] = blankToNull(row.get(source));
            }
            batch.add(args);
            if (batch.size() >= batchSize) {
                flush(insertSql, batch, counter);
            }
        });
        flush(insertSql, batch, counter);

        IngestionResult result = new IngestionResult(counter.inserted, counter.candidates - counter.inserted);
        log.info("Load into {}.{} done: {} rows inserted, {} omitted (already present)",
                schema, table, result.rowsInserted(), result.rowsOmitted());
        return result;
    }

    private ExtractScan scan(Path extract, String naturalIdColumn) {
        Set<String> header = new LinkedHashSet<>();
        Map<String, Long> nonBlank = new LinkedHashMap<>();
        long rows = reader.forEachRow(extract, row -> {
            header.addAll(row.keySet());
            row.forEach((k, v) -> {
                if (blankToNull(v) != null) nonBlank.merge(k, 1L, Long::sum);
            });
        });
        if (rows == 0) {
            return new ExtractScan(List.of(), null, 0, 0);
        }
        String source = header.contains(naturalIdColumn) ? naturalIdColumn : header.iterator().next();
        if (!source.equals(naturalIdColumn)) {
            log.info("Extract has no '{}' column, using first column '{}' as natural id", naturalIdColumn, source);
        }
        return new ExtractScan(List.copyOf(header), source, rows, nonBlank.getOrDefault(source, 0L));
    }

    /**
     * Extract header name to table column name, in header order, without the natural id source.
     */
    static Map<String, String> columnMapping(List<String> header, String naturalIdSource) {
        Map<String, String> mapping = new LinkedHashMap<>();
        Set<String> used = new LinkedHashSet<>(RESERVED);
        for (String name : header) {
            if (name.equals(naturalIdSource)) continue;
            String base = toColumnName(name);
            if (RESERVED.contains(base)) {
                base = "src_" + base;
            }
            String column = base;
            int suffix = 2;
            while (!used.add(column)) {
                column = base + "_" + suffix++;
            }
            mapping.put(name, column);
        }
        return mapping;
    }

    static String toColumnName(String headerName) {
        String normalized = headerName.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_]+", "_");
        normalized = normalized.replaceAll("^_+|_+$", "");
        if (normalized.isEmpty()) {
            normalized = "col";
        }
        if (Character.isDigit(normalized.charAt(0))) {
            normalized = "_" + normalized;
        }
        return normalized;
    }

    private void ensureTable(String schema, String table, Iterable<String> columns) {
        String fullTable = quote(schema) + "." + quote(table);
        List<String> defs = new ArrayList<>();
        defs.add(quote("l0_id") + " BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY");
        defs.add(quote(NATURAL_ID) + " VARCHAR NOT NULL UNIQUE");
        for (String column : columns) {
            defs.add(quote(column) + " VARCHAR");
        }
        defs.add(quote("ingested_at") + " TIMESTAMP WITH TIME ZONE DEFAULT CURRENT_TIMESTAMP");

        try {
            jdbcTemplate.execute("CREATE SCHEMA IF NOT EXISTS " + quote(schema));
            jdbcTemplate.execute("CREATE TABLE IF NOT EXISTS " + fullTable + " (\n  " + String.join(",\n  ", defs) + "\n)");
            // extracts gain columns over time
            for (String column : columns) {
                jdbcTemplate.execute("ALTER TABLE " + fullTable + " ADD COLUMN IF NOT EXISTS " + quote(column) + " VARCHAR");
            }
        } catch (DataAccessException e) {
            throw new IngestionException("Could not prepare table " + schema + "." + table + ": " + e.getMostSpecificCause().getMessage(), e);
        }
    }

    private static String insertSql(String schema, String table, Collection<String> columns) {
        List<String> all = new ArrayList<>();
        all.add(NATURAL_ID);
        all.addAll(columns);
        String quoted = all.stream().map(L0TableLoader::quote).collect(Collectors.joining(", "));
        String placeholders = all.stream().map(c -> "?").collect(Collectors.joining(", "));
        return "INSERT INTO " + quote(schema) + "." + quote(table) + " (" + quoted + ") VALUES (" + placeholders
                + ") ON CONFLICT DO NOTHING";
    }

    private void flush(String insertSql, List<Object[]> batch, LoadCounter counter) {
        if (batch.isEmpty()) return;
        try {
            int[] counts = jdbcTemplate.batchUpdate(insertSql, batch);
            for (int c : counts) {
                if (c > 0) counter.inserted++;
            }
            counter.candidates += batch.size();
        } catch (DataAccessException e) {
            throw new IngestionException("Batch insert failed: " + e.getMostSpecificCause().getMessage(), e);
        }
        batch.clear();
    }

    private static String requireIdentifier(String name) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new IngestionException("Invalid SQL identifier: " + name);
        }
        return name;
    }

    private static String quote(String identifier) {
        return "\"" + identifier + "\"";
    }

    private static String blankToNull(String value) {
        if (value == null) return null;
        String trimmed = value.trim();
        return trimmed.isEmpty() || trimmed.equalsIgnoreCase("nan") ? null : trimmed;
    }

    private record ExtractScan(List<String> header, String naturalIdSource, long rows, long rowsWithNaturalId) {
    }

    private static final class LoadCounter {
        long inserted;
        long candidates;
    }
}
