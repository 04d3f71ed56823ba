package com.licitia.etl.repository;

import com.licitia.etl.domain.entity.TaskRun;
import com.licitia.etl.domain.enums.RunStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface TaskRunRepository extends JpaRepository<TaskRun, Long> {

    boolean existsByTaskIdAndStatus(Long taskId, RunStatus status);

    Optional<TaskRun> findFirstByTaskIdOrderByStartedAtDescIdDesc(Long taskId);

    Optional<TaskRun> findFirstByTaskIdAndStatusOrderByFinishedAtDescIdDesc(Long taskId, RunStatus status);

    List<TaskRun> findAllByStatusOrderByStartedAtAsc(RunStatus status);

    Page<TaskRun> findAllByTaskIdOrderByStartedAtDescIdDesc(Long taskId, Pageable pageable);

    /**
     * Closes a run only while it is still {@code expected}; returns the number of rows changed.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
           update TaskRun r
           set r.status = :status,
               r.finishedAt = :finishedAt,
               r.rowsInserted = :rowsInserted,
               r.rowsOmitted = :rowsOmitted,
               r.errorMessage = :errorMessage
           where r.id = :runId
             and r.status = :expected
           """)
    int finish(@Param("runId") Long runId,
               @Param("expected") RunStatus expected,
               @Param("status") RunStatus status,
               @Param("finishedAt") Instant finishedAt,
               @Param("rowsInserted") Long rowsInserted,
               @Param("rowsOmitted") Long rowsOmitted,
               @Param("errorMessage") String errorMessage);
}
