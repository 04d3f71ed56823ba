package com.licitia.etl.domain.enums;

import com.licitia.etl.domain.entity.TaskRun;

/**
 * Display state of a task, derived from its most recent run and never stored.
 */
public enum TaskState {
    SCHEDULED,
    RUNNING,
    FAILED;

    public static TaskState from(TaskRun latestRun) {
        if (latestRun == null) {
            return SCHEDULED;
        }
        return switch (latestRun.getStatus()) {
            case RUNNING -> RUNNING;
            case FAILED -> FAILED;
            case OK -> SCHEDULED;
        };
    }
}
