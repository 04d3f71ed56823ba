package com.licitia.etl.repository;

import com.licitia.etl.domain.entity.Task;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface TaskRepository extends JpaRepository<Task, Long> {

    Optional<Task> findByDatasetAndSubset(String dataset, String subset);

    List<Task> findAllByEnabledTrueOrderByDatasetAscSubsetAsc();

    List<Task> findAllByOrderByDatasetAscSubsetAsc();

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
           select t
           from Task t
           where t.id = :id
           """)
    Optional<Task> findByIdForUpdate(@Param("id") Long id);
}
