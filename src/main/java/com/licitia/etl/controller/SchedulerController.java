package com.licitia.etl.controller;

import com.licitia.etl.domain.dto.TaskStatusView;
import com.licitia.etl.domain.entity.Task;
import com.licitia.etl.domain.entity.TaskRun;
import com.licitia.etl.domain.enums.Frequency;
import com.licitia.etl.ingestion.IngestionOptions;
import com.licitia.etl.service.DispatchResult;
import com.licitia.etl.service.ManualIngestionService;
import com.licitia.etl.service.RunLedgerService;
import com.licitia.etl.service.StatusReporterService;
import com.licitia.etl.service.TaskRegistryService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;

@Slf4j
@RestController
@RequestMapping("/admin/scheduler")
@RequiredArgsConstructor
public class SchedulerController {

    private final TaskRegistryService taskRegistry;
    private final StatusReporterService statusReporter;
    private final RunLedgerService runLedger;
    private final ManualIngestionService manualIngestion;

    @GetMapping("/tasks")
    public ResponseEntity<List<TaskStatusView>> listTasks() {
        return ResponseEntity.ok(statusReporter.report());
    }

    @PostMapping("/tasks")
    public ResponseEntity<TaskResponse> registerTask(@RequestBody @Valid TaskRegisterRequest request) {
        Frequency frequency = request.frequency() != null && !request.frequency().isBlank()
                ? Frequency.parse(request.frequency())
                : null;
        TaskRegistryService.Registration registration =
                taskRegistry.register(request.dataset(), request.subset(), frequency);
        return ResponseEntity.ok(TaskResponse.from(registration.task(), registration.outcome().name()));
    }

    @PostMapping("/tasks/{id}/enable")
    public ResponseEntity<TaskResponse> enableTask(@PathVariable("id") Long taskId) {
        return ResponseEntity.ok(TaskResponse.from(taskRegistry.enable(taskId), null));
    }

    @PostMapping("/tasks/{id}/disable")
    public ResponseEntity<TaskResponse> disableTask(@PathVariable("id") Long taskId) {
        return ResponseEntity.ok(TaskResponse.from(taskRegistry.disable(taskId), null));
    }

    @PostMapping("/tasks/{id}/run")
    public ResponseEntity<RunTriggerResponse> runTask(
            @PathVariable("id") Long taskId,
            @RequestParam(required = false) String years
    ) {
        log.info("Manual run trigger for taskId={}", taskId);
        DispatchResult result = manualIngestion.runTask(taskId, IngestionOptions.parse(years, false, false));
        return ResponseEntity.ok(RunTriggerResponse.from(result));
    }

    @GetMapping("/tasks/{id}/runs")
    public ResponseEntity<RunPageResponse> listRuns(
            @PathVariable("id") Long taskId,
            @RequestParam(name = "page", required = false, defaultValue = "0") int page,
            @RequestParam(name = "size", required = false, defaultValue = "20") int size
    ) {
        if (page < 0) {
            throw new IllegalArgumentException("page must be >= 0");
        }
        if (size < 1 || size > 200) {
            throw new IllegalArgumentException("size must be between 1 and 200");
        }
        taskRegistry.get(taskId);
        Page<TaskRun> result = runLedger.history(taskId, page, size);
        return ResponseEntity.ok(RunPageResponse.from(result, page, size));
    }

    public record TaskRegisterRequest(
            @NotBlank String dataset,
            @NotBlank String subset,
            String frequency
    ) {}

    public record TaskResponse(
            Long id,
            String dataset,
            String subset,
            String frequency,
            boolean enabled,
            String registration,
            Instant createdAt,
            Instant updatedAt
    ) {
        static TaskResponse from(Task t, String registration) {
            return new TaskResponse(
                    t.getId(),
                    t.getDataset(),
                    t.getSubset(),
                    t.getFrequency().getLabel(),
                    t.isEnabled(),
                    registration,
                    t.getCreatedAt(),
                    t.getUpdatedAt()
            );
        }
    }

    public record RunTriggerResponse(
            Long taskId,
            Long runId,
            String outcome,
            Long rowsInserted,
            Long rowsOmitted,
            String errorMessage
    ) {
        static RunTriggerResponse from(DispatchResult r) {
            return new RunTriggerResponse(
                    r.taskId(),
                    r.runId(),
                    r.outcome().name(),
                    r.result() != null ? r.result().rowsInserted() : null,
                    r.result() != null ? r.result().rowsOmitted() : null,
                    r.errorMessage()
            );
        }
    }

    public record RunPageResponse(
            int page,
            int size,
            long totalElements,
            int totalPages,
            List<RunResponse> items
    ) {
        static RunPageResponse from(Page<TaskRun> pageResult, int page, int size) {
            var items = pageResult.getContent().stream().map(RunResponse::from).toList();
            return new RunPageResponse(page, size, pageResult.getTotalElements(), pageResult.getTotalPages(), items);
        }
    }

    public record RunResponse(
            Long id,
            Long taskId,
            Instant startedAt,
            Instant finishedAt,
            String status,
            Long rowsInserted,
            Long rowsOmitted,
            String errorMessage,
            Long processId
    ) {
        static RunResponse from(TaskRun run) {
            return new RunResponse(
                    run.getId(),
                    run.getTaskId(),
                    run.getStartedAt(),
                    run.getFinishedAt(),
                    run.getStatus() != null ? run.getStatus().getDbValue() : null,
                    run.getRowsInserted(),
                    run.getRowsOmitted(),
                    run.getErrorMessage(),
                    run.getProcessId()
            );
        }
    }
}
