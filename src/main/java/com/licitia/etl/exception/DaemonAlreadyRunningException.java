package com.licitia.etl.exception;

import lombok.Getter;

@Getter
public class DaemonAlreadyRunningException extends RuntimeException {

    private final long pid;

    public DaemonAlreadyRunningException(long pid) {
        super("Scheduler already running with PID " + pid);
        this.pid = pid;
    }
}
