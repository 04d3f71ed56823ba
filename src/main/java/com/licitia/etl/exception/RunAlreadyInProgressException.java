package com.licitia.etl.exception;

import lombok.Getter;

@Getter
public class RunAlreadyInProgressException extends RuntimeException {

    private final Long taskId;

    public RunAlreadyInProgressException(Long taskId) {
        super("A run is already in progress for task " + taskId);
        this.taskId = taskId;
    }
}
