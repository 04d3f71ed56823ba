package com.licitia.etl.lifecycle;

public enum StopOutcome {
    /** Process signalled, exited, PID file removed. */
    STOPPED,
    /** No PID file. */
    NOT_RUNNING,
    /** PID file pointed at a dead process and was removed. */
    STALE_PID_REMOVED,
    /** Signal not delivered; PID file kept for inspection. */
    SIGNAL_FAILED,
    /** Signal delivered but the process outlived the grace period; it removes its own PID file on exit. */
    STILL_STOPPING;

    public boolean isError() {
        return this == SIGNAL_FAILED || this == STILL_STOPPING;
    }
}
