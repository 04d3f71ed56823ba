package com.licitia.etl.lifecycle;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Slf4j
@Component
public class ProcessHandleControl implements ProcessControl {

    @Override
    public long currentPid() {
        return ProcessHandle.current().pid();
    }

    @Override
    public boolean isAlive(long pid) {
        return ProcessHandle.of(pid).map(ProcessHandle::isAlive).orElse(false);
    }

    @Override
    public boolean terminate(long pid) {
        Optional<ProcessHandle> handle = ProcessHandle.of(pid);
        if (handle.isEmpty()) {
            return false;
        }
        try {
            return handle.get().destroy();
        } catch (IllegalStateException | SecurityException e) {
            log.warn("Cannot signal PID {}: {}", pid, e.getMessage());
            return false;
        }
    }

    @Override
    public boolean awaitExit(long pid, Duration timeout) {
        Optional<ProcessHandle> handle = ProcessHandle.of(pid);
        if (handle.isEmpty() || !handle.get().isAlive()) {
            return true;
        }
        try {
            handle.get().onExit().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return !isAlive(pid);
        } catch (ExecutionException e) {
            log.warn("Waiting for PID {} failed: {}", pid, e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
            return !isAlive(pid);
        }
    }
}
