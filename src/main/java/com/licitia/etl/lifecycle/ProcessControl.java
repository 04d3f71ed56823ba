package com.licitia.etl.lifecycle;

import java.time.Duration;

/**
 * OS process operations used by the daemon lock, the stop command and orphan recovery.
 */
public interface ProcessControl {

    long currentPid();

    boolean isAlive(long pid);

    /**
     * Sends a termination request (SIGTERM on Unix).
     *
     * @return false when the request could not be delivered
     */
    boolean terminate(long pid);

    /**
     * @return true if the process is gone within {@code timeout}
     */
    boolean awaitExit(long pid, Duration timeout);
}
