package com.licitia.etl.domain.entity;

import com.licitia.etl.domain.enums.RunStatus;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * One execution attempt of a {@link Task}. Rows are inserted as {@code running} and
 * closed exactly once; they are never deleted.
 */
@Entity
@Table(name = "runs", schema = "scheduler")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TaskRun {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "run_id")
    private Long id;

    @Column(name = "task_id", nullable = false)
    private Long taskId;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @Convert(converter = RunStatusConverter.class)
    @Column(nullable = false, length = 16)
    private RunStatus status;

    @Column(name = "rows_inserted")
    private Long rowsInserted;

    @Column(name = "rows_omitted")
    private Long rowsOmitted;

    @Column(name = "error_message", length = 4000)
    private String errorMessage;

    @Column(name = "process_id")
    private Long processId;

    public static TaskRun start(Long taskId, Long processId, Instant startedAt) {
        return TaskRun.builder()
                .taskId(taskId)
                .processId(processId)
                .startedAt(startedAt)
                .status(RunStatus.RUNNING)
                .build();
    }

    public boolean isRunning() {
        return status == RunStatus.RUNNING;
    }
}
