package com.licitia.etl.ingestion;

/**
 * @param rowsOmitted candidate rows whose natural id was already loaded
 */
public record IngestionResult(long rowsInserted, long rowsOmitted) {

    public static IngestionResult empty() {
        return new IngestionResult(0, 0);
    }
}
