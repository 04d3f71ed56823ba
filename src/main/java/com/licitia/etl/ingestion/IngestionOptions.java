package com.licitia.etl.ingestion;

import com.licitia.etl.exception.ConfigurationException;

/**
 * @param downloadOnly run the extract commands but do not load
 * @param processOnly  load an extract that already exists, skipping the extract commands
 */
public record IngestionOptions(Integer yearFrom, Integer yearTo, boolean downloadOnly, boolean processOnly) {

    public IngestionOptions {
        if (downloadOnly && processOnly) {
            throw new ConfigurationException("download-only and process-only are mutually exclusive");
        }
        if ((yearFrom == null) != (yearTo == null)) {
            throw new ConfigurationException("year range needs both ends");
        }
        if (yearFrom != null && yearFrom > yearTo) {
            throw new ConfigurationException("year range is reversed: " + yearFrom + "-" + yearTo);
        }
    }

    public static IngestionOptions defaults() {
        return new IngestionOptions(null, null, false, false);
    }

    public static IngestionOptions forYear(int year) {
        return new IngestionOptions(year, year, false, false);
    }

    /**
     * Parses {@code YYYY-YYYY} or a single {@code YYYY}.
     */
    public static IngestionOptions parse(String years, boolean downloadOnly, boolean processOnly) {
        if (years == null || years.isBlank()) {
            return new IngestionOptions(null, null, downloadOnly, processOnly);
        }
        String[] parts = years.trim().split("-");
        try {
            if (parts.length == 1) {
                int y = Integer.parseInt(parts[0].trim());
                return new IngestionOptions(y, y, downloadOnly, processOnly);
            }
            if (parts.length == 2) {
                return new IngestionOptions(Integer.parseInt(parts[0].trim()), Integer.parseInt(parts[1].trim()),
                        downloadOnly, processOnly);
            }
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid year range: " + years);
        }
        throw new ConfigurationException("Invalid year range: " + years);
    }

    public boolean hasYears() {
        return yearFrom != null;
    }
}
