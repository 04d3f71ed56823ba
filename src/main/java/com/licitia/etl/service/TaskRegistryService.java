package com.licitia.etl.service;

import com.licitia.etl.domain.entity.Task;
import com.licitia.etl.domain.enums.Frequency;
import com.licitia.etl.exception.TaskNotFoundException;
import com.licitia.etl.exception.UnknownDatasetException;
import com.licitia.etl.ingestion.DatasetCatalog;
import com.licitia.etl.ingestion.DatasetDefinition;
import com.licitia.etl.repository.TaskRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class TaskRegistryService {

    private final TaskRepository taskRepository;
    private final DatasetCatalog catalog;

    /**
     * Upserts a task keyed on (dataset, subset). A null frequency means the catalog default.
     *
     * @throws UnknownDatasetException before any write if the pair is not in the catalog
     */
    @Transactional
    public Registration register(String dataset, String subset, Frequency frequency) {
        DatasetDefinition definition = catalog.require(dataset, subset);
        Frequency effective = frequency != null ? frequency : definition.frequencyFor(subset);

        Optional<Task> existing = taskRepository.findByDatasetAndSubset(dataset, subset);
        if (existing.isPresent()) {
            Task task = existing.get();
            if (task.getFrequency() == effective) {
                return new Registration(task, RegistrationOutcome.UNCHANGED);
            }
            log.info("Task {} frequency {} -> {}", task.key(), task.getFrequency(), effective);
            task.setFrequency(effective);
            return new Registration(taskRepository.save(task), RegistrationOutcome.UPDATED);
        }

        Task created = taskRepository.save(Task.builder()
                .dataset(dataset)
                .subset(subset)
                .frequency(effective)
                .enabled(true)
                .build());
        log.info("Task {} registered with frequency {}", created.key(), effective.getLabel());
        return new Registration(created, RegistrationOutcome.INSERTED);
    }

    /**
     * Registers every catalog pair with its default frequency, optionally only for {@code datasets}.
     */
    @Transactional
    public RegistrationSummary registerDefaults(Collection<String> datasets) {
        Set<String> only = datasets == null || datasets.isEmpty() ? null : Set.copyOf(datasets);
        if (only != null) {
            for (String d : only) {
                if (catalog.find(d).isEmpty()) {
                    throw new UnknownDatasetException(d, null);
                }
            }
        }

        int inserted = 0;
        int updated = 0;
        int unchanged = 0;
        List<String> keys = new ArrayList<>();
        for (DatasetCatalog.DatasetSubset pair : catalog.pairs()) {
            if (only != null && !only.contains(pair.dataset())) continue;
            Registration r = register(pair.dataset(), pair.subset(), pair.defaultFrequency());
            switch (r.outcome()) {
                case INSERTED -> inserted++;
                case UPDATED -> updated++;
                case UNCHANGED -> unchanged++;
            }
            keys.add(r.task().key());
        }
        return new RegistrationSummary(inserted, updated, unchanged, keys);
    }

    @Transactional(readOnly = true)
    public List<Task> listEnabled() {
        return taskRepository.findAllByEnabledTrueOrderByDatasetAscSubsetAsc();
    }

    @Transactional(readOnly = true)
    public List<Task> listAll() {
        return taskRepository.findAllByOrderByDatasetAscSubsetAsc();
    }

    @Transactional(readOnly = true)
    public Optional<Task> find(String dataset, String subset) {
        return taskRepository.findByDatasetAndSubset(dataset, subset);
    }

    @Transactional(readOnly = true)
    public Task get(Long taskId) {
        return taskRepository.findById(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
    }

    /**
     * Removes the task from due-consideration; its runs stay.
     */
    @Transactional
    public Task disable(Long taskId) {
        return setEnabled(taskId, false);
    }

    @Transactional
    public Task enable(Long taskId) {
        return setEnabled(taskId, true);
    }

    private Task setEnabled(Long taskId, boolean enabled) {
        Task task = taskRepository.findById(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
        if (task.isEnabled() == enabled) {
            return task;
        }
        task.setEnabled(enabled);
        log.info("Task {} {}", task.key(), enabled ? "enabled" : "disabled");
        return taskRepository.save(task);
    }

    public enum RegistrationOutcome {
        INSERTED,
        UPDATED,
        UNCHANGED
    }

    public record Registration(Task task, RegistrationOutcome outcome) {
    }

    public record RegistrationSummary(int inserted, int updated, int unchanged, List<String> tasks) {
    }
}
