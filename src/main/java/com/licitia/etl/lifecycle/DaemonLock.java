package com.licitia.etl.lifecycle;

import com.licitia.etl.exception.DaemonAlreadyRunningException;

import java.util.OptionalLong;

/**
 * Single-instance lock for the scheduler daemon on this host.
 */
public interface DaemonLock {

    /**
     * Records {@code pid} as the holder. Re-acquiring with the current holder's PID is a no-op.
     *
     * @throws DaemonAlreadyRunningException if another live process holds the lock
     */
    void acquire(long pid);

    /**
     * Releases the lock if {@code pid} is the recorded holder.
     */
    void release(long pid);

    /**
     * PID of the live holder, empty when nobody holds the lock or the record is stale.
     */
    OptionalLong holder();

    default boolean isHeld() {
        return holder().isPresent();
    }

    /**
     * Removes whatever is recorded, live or not.
     *
     * @return true if a record existed
     */
    boolean clear();
}
