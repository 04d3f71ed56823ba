package com.licitia.etl.scheduler;

import com.licitia.etl.domain.entity.Task;
import com.licitia.etl.domain.entity.TaskRun;
import com.licitia.etl.service.RunLedgerService;
import com.licitia.etl.service.TaskRegistryService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

@Component
@RequiredArgsConstructor
public class DueTaskFinder {

    private final TaskRegistryService taskRegistry;
    private final RunLedgerService runLedger;
    private final ScheduleCalculator scheduleCalculator;

    /**
     * Enabled tasks whose latest run is not running and whose next due instant,
     * measured from the last successful run, is at or before {@code referenceNow}.
     */
    public List<DueTask> findDueTasks(Instant referenceNow) {
        List<DueTask> due = new ArrayList<>();
        for (Task task : taskRegistry.listEnabled()) {
            boolean running = runLedger.latestRun(task.getId()).map(TaskRun::isRunning).orElse(false);
            if (running) continue;

            Instant lastOk = runLedger.latestSuccessfulRun(task.getId())
                    .map(TaskRun::getFinishedAt)
                    .orElse(null);
            ZonedDateTime nextDue = scheduleCalculator.nextDueAt(task.getFrequency(), lastOk, referenceNow);
            if (!nextDue.toInstant().isAfter(referenceNow)) {
                due.add(new DueTask(task, nextDue));
            }
        }
        return due;
    }

    public record DueTask(Task task, ZonedDateTime nextDueAt) {
    }
}
