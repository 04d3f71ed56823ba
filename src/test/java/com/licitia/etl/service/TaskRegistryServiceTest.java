package com.licitia.etl.service;

import com.licitia.etl.domain.entity.Task;
import com.licitia.etl.domain.enums.Frequency;
import com.licitia.etl.exception.TaskNotFoundException;
import com.licitia.etl.exception.UnknownDatasetException;
import com.licitia.etl.ingestion.DatasetCatalog;
import com.licitia.etl.repository.TaskRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import({TaskRegistryService.class, DatasetCatalog.class})
class TaskRegistryServiceTest {

    @Autowired TaskRegistryService registry;
    @Autowired TaskRepository taskRepository;
    @Autowired JdbcTemplate jdbcTemplate;

    @Test
    void register_insertThenUpdateThenNoOp() {
        var inserted = registry.register("valencia", "contratacion", Frequency.MONTHLY);
        var updated = registry.register("valencia", "contratacion", Frequency.QUARTERLY);
        var unchanged = registry.register("valencia", "contratacion", Frequency.QUARTERLY);

        assertEquals(TaskRegistryService.RegistrationOutcome.INSERTED, inserted.outcome());
        assertEquals(TaskRegistryService.RegistrationOutcome.UPDATED, updated.outcome());
        assertEquals(TaskRegistryService.RegistrationOutcome.UNCHANGED, unchanged.outcome());
        assertEquals(inserted.task().getId(), unchanged.task().getId());
        assertEquals(1, taskRepository.count());
        assertEquals(Frequency.QUARTERLY,
                taskRepository.findById(inserted.task().getId()).orElseThrow().getFrequency());
    }

    @Test
    void register_withoutFrequency_usesCatalogDefault() {
        Task task = registry.register("madrid", "comunidad", null).task();

        assertEquals(Frequency.QUARTERLY, task.getFrequency());
        assertTrue(task.isEnabled());
    }

    @Test
    void register_unknownPair_writesNothing() {
        assertThrows(UnknownDatasetException.class, () -> registry.register("galicia", "contratos", null));
        assertThrows(UnknownDatasetException.class, () -> registry.register("madrid", "getafe", Frequency.ANNUAL));
        assertEquals(0, taskRepository.count());
    }

    @Test
    void registerDefaults_isIdempotent() {
        var first = registry.registerDefaults(List.of("madrid", "andalucia"));
        var second = registry.registerDefaults(List.of("madrid", "andalucia"));

        assertEquals(4, first.inserted());
        assertEquals(0, second.inserted());
        assertEquals(4, second.unchanged());
        assertThat(first.tasks()).contains("madrid/comunidad", "andalucia/menores");
    }

    @Test
    void registerDefaults_unknownDataset_rejected() {
        assertThrows(UnknownDatasetException.class, () -> registry.registerDefaults(List.of("galicia")));
    }

    @Test
    void disable_excludesFromEnabledButKeepsTask() {
        Task a = registry.register("andalucia", "licitaciones", null).task();
        Task b = registry.register("andalucia", "menores", null).task();

        registry.disable(a.getId());

        assertThat(registry.listEnabled()).extracting(Task::getId).containsExactly(b.getId());
        assertThat(registry.listAll()).extracting(Task::getId).containsExactly(a.getId(), b.getId());

        registry.enable(a.getId());
        assertThat(registry.listEnabled()).hasSize(2);
    }

    @Test
    void listEnabled_unknownStoredLabel_readsAsQuarterly() {
        String insert = "INSERT INTO scheduler.tasks (conjunto, subconjunto, schedule_expr, enabled, created_at, updated_at) "
                + "VALUES (?, ?, ?, TRUE, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)";
        jdbcTemplate.update(insert, "valencia", "paro", "Mensual");
        jdbcTemplate.update(insert, "valencia", "empleo", "Semanal");

        List<Task> tasks = registry.listEnabled();

        assertThat(tasks).extracting(Task::getSubset).containsExactly("empleo", "paro");
        assertThat(tasks).extracting(Task::getFrequency).containsExactly(Frequency.QUARTERLY, Frequency.MONTHLY);
    }

    @Test
    void disable_unknownTask_throws() {
        assertThrows(TaskNotFoundException.class, () -> registry.disable(424242L));
    }
}
