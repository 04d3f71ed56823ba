package com.licitia.etl.ingestion;

import com.licitia.etl.exception.IngestionException;

/**
 * Produces or locates the extract for one (dataset, subset) and loads it.
 * Loading is keyed on the source's natural id, so running it again with the same input
 * inserts nothing and reports every row as omitted.
 */
public interface IngestionAdapter {

    /**
     * @throws IngestionException when extraction or loading fails
     */
    IngestionResult run(String dataset, String subset, IngestionOptions options);
}
