package com.licitia.etl.service;

import com.licitia.etl.domain.entity.Task;
import com.licitia.etl.ingestion.DatasetCatalog;
import com.licitia.etl.ingestion.IngestionOptions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Operator-triggered runs. They go through the same ledger as scheduled ones, so a manual
 * run and the daemon never ingest the same task at once.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ManualIngestionService {

    private final TaskRegistryService taskRegistry;
    private final TaskDispatcher taskDispatcher;
    private final DatasetCatalog catalog;

    /**
     * Runs (dataset, subset), registering it with its default frequency first if needed.
     *
     * @throws com.licitia.etl.exception.RunAlreadyInProgressException if a run is in progress
     */
    public DispatchResult ingest(String dataset, String subset, IngestionOptions options) {
        catalog.require(dataset, subset);
        Task task = taskRegistry.find(dataset, subset)
                .orElseGet(() -> taskRegistry.register(dataset, subset, null).task());
        log.info("Manual ingestion of {} options={}", task.key(), options);
        return taskDispatcher.dispatchOrThrow(task, options);
    }

    public DispatchResult runTask(Long taskId, IngestionOptions options) {
        Task task = taskRegistry.get(taskId);
        log.info("Manual run of task {} options={}", task.key(), options);
        return taskDispatcher.dispatchOrThrow(task, options);
    }
}
