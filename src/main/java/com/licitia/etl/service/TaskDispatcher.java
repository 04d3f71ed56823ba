package com.licitia.etl.service;

import com.licitia.etl.domain.entity.Task;
import com.licitia.etl.domain.entity.TaskRun;
import com.licitia.etl.domain.enums.RunStatus;
import com.licitia.etl.exception.RunAlreadyInProgressException;
import com.licitia.etl.ingestion.IngestionAdapter;
import com.licitia.etl.ingestion.IngestionOptions;
import com.licitia.etl.ingestion.IngestionResult;
import com.licitia.etl.lifecycle.ProcessControl;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

/**
 * Runs one task through the ledger: open a run, call the adapter, close the run.
 * Used by the daemon and by manual ingestion alike.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaskDispatcher {

    private final RunLedgerService runLedger;
    private final IngestionAdapter ingestionAdapter;
    private final ProcessControl processControl;

    /**
     * Dispatches {@code task}, or skips it when another process already holds a running run.
     */
    public DispatchResult dispatch(Task task, IngestionOptions options) {
        try {
            return dispatchOrThrow(task, options);
        } catch (RunAlreadyInProgressException e) {
            log.info("Task {} already has a running run, skipping", task.key());
            return DispatchResult.skipped(task.getId());
        }
    }

    /**
     * Like {@link #dispatch} but surfaces contention to the caller.
     *
     * @throws RunAlreadyInProgressException if the task already has a running run
     */
    public DispatchResult dispatchOrThrow(Task task, IngestionOptions options) {
        try (MDC.MDCCloseable ignored = MDC.putCloseable("task", task.key())) {
            TaskRun run = runLedger.startRun(task.getId(), processControl.currentPid());
            log.info("Run {} started", run.getId());

            IngestionResult result;
            try {
                result = ingestionAdapter.run(task.getDataset(), task.getSubset(), options);
            } catch (RuntimeException e) {
                String message = describe(e);
                log.error("Run {} failed: {}", run.getId(), message, e);
                runLedger.finishRun(run.getId(), RunStatus.FAILED, null, null, message);
                return DispatchResult.failed(task.getId(), run.getId(), message);
            }

            runLedger.finishRun(run.getId(), RunStatus.OK, result.rowsInserted(), result.rowsOmitted(), null);
            log.info("Run {} done. inserted={} omitted={}", run.getId(), result.rowsInserted(), result.rowsOmitted());
            return DispatchResult.succeeded(task.getId(), run.getId(), result);
        }
    }

    private static String describe(Throwable e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
