package com.licitia.etl.service;

import com.licitia.etl.config.LicitiaProperties;
import com.licitia.etl.domain.entity.TaskRun;
import com.licitia.etl.domain.enums.RunStatus;
import com.licitia.etl.exception.RunAlreadyInProgressException;
import com.licitia.etl.exception.TaskNotFoundException;
import com.licitia.etl.lifecycle.ProcessControl;
import com.licitia.etl.repository.TaskRepository;
import com.licitia.etl.repository.TaskRunRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Durable record of task executions and the only mutual-exclusion primitive between
 * runs: whether a task is running is answered from {@code scheduler.runs}, never from memory.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RunLedgerService {

    static final int MAX_ERROR_LENGTH = 4000;

    private final TaskRepository taskRepository;
    private final TaskRunRepository runRepository;
    private final ProcessControl processControl;
    private final LicitiaProperties properties;
    private final Clock clock;

    /**
     * Opens a run after locking the task row, so two callers in different processes cannot
     * both see "nothing running" and insert.
     *
     * @throws RunAlreadyInProgressException if the task has an unfinished run
     * @throws TaskNotFoundException         if the task does not exist
     */
    @Transactional
    public TaskRun startRun(Long taskId, Long processId) {
        taskRepository.findByIdForUpdate(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
        if (runRepository.existsByTaskIdAndStatus(taskId, RunStatus.RUNNING)) {
            throw new RunAlreadyInProgressException(taskId);
        }
        TaskRun run = runRepository.saveAndFlush(TaskRun.start(taskId, processId, clock.instant()));
        log.debug("Run {} opened for task {} (pid={})", run.getId(), taskId, processId);
        return run;
    }

    /**
     * Moves a running run to {@code ok} or {@code failed}. A run can be finished once.
     *
     * @throws IllegalArgumentException if {@code status} is not terminal
     * @throws IllegalStateException    if the run is unknown or no longer running
     */
    @Transactional
    public void finishRun(Long runId, RunStatus status, Long rowsInserted, Long rowsOmitted, String errorMessage) {
        if (status == null || !status.isTerminal()) {
            throw new IllegalArgumentException("A run finishes as ok or failed, not " + status);
        }
        int updated = runRepository.finish(runId, RunStatus.RUNNING, status, clock.instant(),
                rowsInserted, rowsOmitted, truncate(errorMessage));
        if (updated != 1) {
            throw new IllegalStateException("Run " + runId + " is not running (unknown or already finished)");
        }
    }

    /**
     * Fails running runs whose owning process is gone, that belong to the calling process,
     * or that have been running longer than the configured maximum. Callers must have no
     * dispatch in flight, since runs owned by the current process are treated as abandoned.
     *
     * @return number of runs marked failed
     */
    @Transactional
    public int recoverOrphanedRuns(Instant referenceNow) {
        Duration maxDuration = properties.getScheduler().getMaxRunDuration();
        Instant cutoff = referenceNow.minus(maxDuration);
        int recovered = 0;
        for (TaskRun run : runRepository.findAllByStatusOrderByStartedAtAsc(RunStatus.RUNNING)) {
            String reason = orphanReason(run, cutoff, maxDuration);
            if (reason == null) continue;
            recovered += runRepository.finish(run.getId(), RunStatus.RUNNING, RunStatus.FAILED, referenceNow,
                    null, null, reason);
            log.warn("Run {} of task {} marked failed: {}", run.getId(), run.getTaskId(), reason);
        }
        return recovered;
    }

    private String orphanReason(TaskRun run, Instant cutoff, Duration maxDuration) {
        boolean overdue = run.getStartedAt() != null && run.getStartedAt().isBefore(cutoff);
        Long pid = run.getProcessId();
        if (pid != null) {
            if (pid == processControl.currentPid()) {
                return "Run left open by this scheduler process (pid " + pid + "), finish was not recorded";
            }
            if (!processControl.isAlive(pid)) {
                return "Process " + pid + " not found (restarted or killed?)";
            }
            return overdue ? "Timeout: running for more than " + maxDuration.toHours() + "h" : null;
        }
        return overdue ? "Timeout: no PID recorded, running for more than " + maxDuration.toHours() + "h" : null;
    }

    @Transactional(readOnly = true)
    public Optional<TaskRun> latestRun(Long taskId) {
        return runRepository.findFirstByTaskIdOrderByStartedAtDescIdDesc(taskId);
    }

    @Transactional(readOnly = true)
    public Optional<TaskRun> latestSuccessfulRun(Long taskId) {
        return runRepository.findFirstByTaskIdAndStatusOrderByFinishedAtDescIdDesc(taskId, RunStatus.OK);
    }

    @Transactional(readOnly = true)
    public Page<TaskRun> history(Long taskId, int page, int size) {
        return runRepository.findAllByTaskIdOrderByStartedAtDescIdDesc(taskId, PageRequest.of(page, size));
    }

    private static String truncate(String text) {
        if (text == null) return null;
        return text.length() <= MAX_ERROR_LENGTH ? text : text.substring(0, MAX_ERROR_LENGTH);
    }
}
