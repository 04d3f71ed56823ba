package com.licitia.etl.service;

import com.licitia.etl.domain.dto.TaskStatusView;
import com.licitia.etl.domain.entity.Task;
import com.licitia.etl.domain.entity.TaskRun;
import com.licitia.etl.domain.enums.TaskState;
import com.licitia.etl.scheduler.ScheduleCalculator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.List;

@Service
@RequiredArgsConstructor
public class StatusReporterService {

    private final TaskRegistryService taskRegistry;
    private final RunLedgerService runLedger;
    private final ScheduleCalculator scheduleCalculator;
    private final Clock clock;

    @Transactional(readOnly = true)
    public List<TaskStatusView> report() {
        Instant now = clock.instant();
        return taskRegistry.listEnabled().stream()
                .map(task -> describe(task, now))
                .toList();
    }

    /**
     * While a task is due, {@code nextExecution} shows the anchor after {@code referenceNow},
     * which is where the schedule lands once the pending run succeeds.
     */
    public TaskStatusView describe(Task task, Instant referenceNow) {
        TaskRun latest = runLedger.latestRun(task.getId()).orElse(null);
        Instant lastOk = runLedger.latestSuccessfulRun(task.getId()).map(TaskRun::getFinishedAt).orElse(null);

        TaskState state = TaskState.from(latest);
        ZonedDateTime nextDue = scheduleCalculator.nextDueAt(task.getFrequency(), lastOk, referenceNow);
        boolean reached = !nextDue.toInstant().isAfter(referenceNow);
        boolean due = reached && state != TaskState.RUNNING;
        ZonedDateTime nextExecution = reached
                ? scheduleCalculator.nextAnchorAfter(task.getFrequency(), referenceNow)
                : nextDue;

        TaskStatusView.TaskStatusViewBuilder view = TaskStatusView.builder()
                .taskId(task.getId())
                .dataset(task.getDataset())
                .subset(task.getSubset())
                .frequency(task.getFrequency().getLabel())
                .state(state)
                .due(due)
                .nextExecution(nextExecution.toOffsetDateTime())
                .lastSuccessAt(lastOk);
        if (latest != null) {
            view.lastRunId(latest.getId())
                    .lastRunStatus(latest.getStatus().getDbValue())
                    .lastRunStartedAt(latest.getStartedAt())
                    .lastRunFinishedAt(latest.getFinishedAt())
                    .lastRowsInserted(latest.getRowsInserted())
                    .lastRowsOmitted(latest.getRowsOmitted())
                    .lastError(latest.getErrorMessage());
        }
        return view.build();
    }
}
