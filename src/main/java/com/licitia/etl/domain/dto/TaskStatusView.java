package com.licitia.etl.domain.dto;

import com.licitia.etl.domain.enums.TaskState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskStatusView {
    private Long taskId;
    private String dataset;
    private String subset;
    private String frequency;

    private TaskState state;
    private boolean due;
    private OffsetDateTime nextExecution;

    private Long lastRunId;
    private String lastRunStatus;
    private Instant lastRunStartedAt;
    private Instant lastRunFinishedAt;
    private Long lastRowsInserted;
    private Long lastRowsOmitted;
    private String lastError;

    private Instant lastSuccessAt;
}
