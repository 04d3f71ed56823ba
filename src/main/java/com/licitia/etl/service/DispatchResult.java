package com.licitia.etl.service;

import com.licitia.etl.ingestion.IngestionResult;

/**
 * Outcome of one dispatch. {@code runId} is null when the task was skipped.
 */
public record DispatchResult(
        Long taskId,
        Long runId,
        Outcome outcome,
        IngestionResult result,
        String errorMessage
) {

    public enum Outcome {
        SUCCEEDED,
        FAILED,
        SKIPPED
    }

    static DispatchResult succeeded(Long taskId, Long runId, IngestionResult result) {
        return new DispatchResult(taskId, runId, Outcome.SUCCEEDED, result, null);
    }

    static DispatchResult failed(Long taskId, Long runId, String errorMessage) {
        return new DispatchResult(taskId, runId, Outcome.FAILED, null, errorMessage);
    }

    static DispatchResult skipped(Long taskId) {
        return new DispatchResult(taskId, null, Outcome.SKIPPED, null, null);
    }

    public boolean succeeded() {
        return outcome == Outcome.SUCCEEDED;
    }
}
