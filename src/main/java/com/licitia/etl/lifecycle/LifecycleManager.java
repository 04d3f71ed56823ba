package com.licitia.etl.lifecycle;

import com.licitia.etl.config.LicitiaProperties;
import com.licitia.etl.exception.DaemonAlreadyRunningException;
import com.licitia.etl.scheduler.DaemonRunner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.OptionalLong;

@Slf4j
@Component
@RequiredArgsConstructor
public class LifecycleManager {

    private final DaemonLock daemonLock;
    private final ProcessControl processControl;
    private final DaemonLauncher daemonLauncher;
    private final DaemonRunner daemonRunner;
    private final LicitiaProperties properties;

    /**
     * Runs the scheduler loop in this process until a stop is requested.
     *
     * @throws DaemonAlreadyRunningException if another live daemon holds the lock
     */
    public void runForeground(Duration tick) {
        long pid = processControl.currentPid();
        daemonLock.acquire(pid);
        log.info("Scheduler running in foreground, PID={}", pid);
        daemonRunner.runLoop(tick, () -> daemonLock.release(pid));
    }

    /**
     * @return PID of the detached daemon
     * @throws DaemonAlreadyRunningException if another live daemon holds the lock
     */
    public long startBackground(Duration tick, List<String> passthroughArgs) {
        OptionalLong holder = daemonLock.holder();
        if (holder.isPresent()) {
            throw new DaemonAlreadyRunningException(holder.getAsLong());
        }
        long childPid = daemonLauncher.launch(tick, properties.getScheduler().logPath(), passthroughArgs);
        daemonLock.acquire(childPid);
        return childPid;
    }

    public StopOutcome stop() {
        OptionalLong holder = daemonLock.holder();
        if (holder.isEmpty()) {
            if (daemonLock.clear()) {
                log.info("Removed stale scheduler PID file");
                return StopOutcome.STALE_PID_REMOVED;
            }
            return StopOutcome.NOT_RUNNING;
        }

        long pid = holder.getAsLong();
        if (!processControl.terminate(pid)) {
            log.warn("Could not signal scheduler PID={}, PID file left in place", pid);
            return StopOutcome.SIGNAL_FAILED;
        }

        Duration grace = properties.getScheduler().getStopGracePeriod();
        if (!processControl.awaitExit(pid, grace)) {
            log.warn("Scheduler PID={} still alive {}s after SIGTERM", pid, grace.toSeconds());
            return StopOutcome.STILL_STOPPING;
        }
        daemonLock.clear();
        log.info("Scheduler PID={} stopped", pid);
        return StopOutcome.STOPPED;
    }

    public OptionalLong daemonPid() {
        return daemonLock.holder();
    }
}
