package com.licitia.etl.cli;

import com.licitia.etl.config.LicitiaProperties;
import com.licitia.etl.domain.dto.TaskStatusView;
import com.licitia.etl.domain.entity.Task;
import com.licitia.etl.domain.enums.Frequency;
import com.licitia.etl.domain.enums.TaskState;
import com.licitia.etl.exception.DaemonAlreadyRunningException;
import com.licitia.etl.exception.RunAlreadyInProgressException;
import com.licitia.etl.exception.UnknownDatasetException;
import com.licitia.etl.ingestion.IngestionOptions;
import com.licitia.etl.ingestion.IngestionResult;
import com.licitia.etl.lifecycle.LifecycleManager;
import com.licitia.etl.lifecycle.StopOutcome;
import com.licitia.etl.repository.SchemaMigrator;
import com.licitia.etl.service.DispatchResult;
import com.licitia.etl.service.ManualIngestionService;
import com.licitia.etl.service.StatusReporterService;
import com.licitia.etl.service.TaskRegistryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.dao.DataAccessResourceFailureException;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.OptionalLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EtlCommandRunnerTest {

    @Mock TaskRegistryService taskRegistry;
    @Mock StatusReporterService statusReporter;
    @Mock ManualIngestionService manualIngestion;
    @Mock LifecycleManager lifecycleManager;
    @Mock SchemaMigrator schemaMigrator;

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private EtlCommandRunner runner;

    @BeforeEach
    void setUp() {
        runner = new EtlCommandRunner(taskRegistry, statusReporter, manualIngestion, lifecycleManager,
                schemaMigrator, new LicitiaProperties(), new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    private int run(String... args) {
        runner.run(new DefaultApplicationArguments(args));
        return runner.getExitCode();
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void noCommand_doesNothing() {
        assertEquals(0, run("--server.port=9090"));
        verifyNoInteractions(taskRegistry, lifecycleManager, schemaMigrator);
    }

    @Test
    void initDb_appliesMigrations() {
        assertEquals(0, run("init-db"));
        verify(schemaMigrator).migrate();
    }

    @Test
    void register_singleTaskWithFrequency() {
        Task task = Task.builder().id(4L).dataset("madrid").subset("ayuntamiento").frequency(Frequency.MONTHLY).build();
        when(taskRegistry.register("madrid", "ayuntamiento", Frequency.MONTHLY))
                .thenReturn(new TaskRegistryService.Registration(task, TaskRegistryService.RegistrationOutcome.UPDATED));

        assertEquals(0, run("scheduler", "register", "--dataset=madrid", "--subset=ayuntamiento", "--frequency=Mensual"));
        assertThat(output()).contains("updated madrid/ayuntamiento");
    }

    @Test
    void register_defaultsForDataset() {
        when(taskRegistry.registerDefaults(List.of("andalucia")))
                .thenReturn(new TaskRegistryService.RegistrationSummary(2, 0, 0, List.of("andalucia/licitaciones", "andalucia/menores")));

        assertEquals(0, run("scheduler", "register", "--dataset=andalucia"));
        assertThat(output()).contains("2 inserted");
    }

    @Test
    void register_unknownDataset_exitsNonZero() {
        when(taskRegistry.registerDefaults(List.of("galicia"))).thenThrow(new UnknownDatasetException("galicia", null));

        assertEquals(1, run("scheduler", "register", "--dataset=galicia"));
        assertThat(output()).contains("Error:");
    }

    @Test
    void register_invalidFrequency_exitsNonZero() {
        assertEquals(1, run("scheduler", "register", "--dataset=madrid", "--subset=comunidad", "--frequency=weekly"));
        verifyNoInteractions(taskRegistry);
    }

    @Test
    void disable_requiresTaskId() {
        assertEquals(1, run("scheduler", "disable"));

        Task task = Task.builder().id(3L).dataset("ted").subset("ted_es_can").frequency(Frequency.QUARTERLY).build();
        when(taskRegistry.disable(3L)).thenReturn(task);
        assertEquals(0, run("scheduler", "disable", "--task-id=3"));
        assertThat(output()).contains("disabled");
    }

    @Test
    void run_foreground_startsLoopWithoutTouchingDatabase() {
        assertEquals(0, run("scheduler", "run", "--tick-seconds=15"));

        verify(lifecycleManager).runForeground(Duration.ofSeconds(15));
        verifyNoInteractions(schemaMigrator);
        assertThat(output()).doesNotContain("Database unavailable");
    }

    @Test
    void run_background_forwardsOptions() {
        when(lifecycleManager.startBackground(eq(Duration.ofSeconds(60)), any())).thenReturn(777L);

        assertEquals(0, run("scheduler", "run", "--background", "--spring.profiles.active=prod"));

        verify(lifecycleManager).startBackground(Duration.ofSeconds(60), List.of("--spring.profiles.active=prod"));
        assertThat(output()).contains("PID 777");
    }

    @Test
    void run_alreadyRunning_exitsBusy() {
        doThrow(new DaemonAlreadyRunningException(55L)).when(lifecycleManager).runForeground(any());

        assertEquals(2, run("scheduler", "run"));
        assertThat(output()).contains("PID 55");
    }

    @Test
    void run_nonPositiveTick_rejected() {
        assertEquals(1, run("scheduler", "run", "--tick-seconds=0"));
        verifyNoInteractions(lifecycleManager);
    }

    @Test
    void stop_stalePid_reportsNothingToStop() {
        when(lifecycleManager.stop()).thenReturn(StopOutcome.STALE_PID_REMOVED);

        assertEquals(0, run("scheduler", "stop"));
        assertThat(output()).contains("not running");
    }

    @Test
    void stop_signalFailed_exitsNonZero() {
        when(lifecycleManager.stop()).thenReturn(StopOutcome.SIGNAL_FAILED);

        assertEquals(1, run("scheduler", "stop"));
    }

    @Test
    void status_printsDaemonAndTasks() {
        when(lifecycleManager.daemonPid()).thenReturn(OptionalLong.of(31L));
        when(statusReporter.report()).thenReturn(List.of(TaskStatusView.builder()
                .taskId(1L).dataset("valencia").subset("contratacion").frequency("Mensual")
                .state(TaskState.FAILED).due(true)
                .nextExecution(OffsetDateTime.parse("2026-03-01T02:00:00+01:00"))
                .lastRunStatus("failed").lastError("Extract not found")
                .lastRunStartedAt(Instant.parse("2026-02-01T01:00:00Z"))
                .lastRunFinishedAt(Instant.parse("2026-02-01T01:05:00Z"))
                .build()));

        assertEquals(0, run("scheduler", "status"));
        assertThat(output())
                .contains("Scheduler running (PID 31)")
                .contains("valencia/contratacion Mensual state=failed due=true")
                .contains("started=2026-02-01T01:00:00Z finished=2026-02-01T01:05:00Z inserted=- omitted=-")
                .contains("error: Extract not found");
    }

    @Test
    void status_printsLastRunRowCounts() {
        when(lifecycleManager.daemonPid()).thenReturn(OptionalLong.empty());
        when(statusReporter.report()).thenReturn(List.of(TaskStatusView.builder()
                .taskId(2L).dataset("madrid").subset("comunidad").frequency("Trimestral")
                .state(TaskState.SCHEDULED).due(false)
                .nextExecution(OffsetDateTime.parse("2026-04-01T02:00:00+02:00"))
                .lastRunStatus("ok")
                .lastRunStartedAt(Instant.parse("2026-01-01T01:00:00Z"))
                .lastRunFinishedAt(Instant.parse("2026-01-01T01:20:00Z"))
                .lastRowsInserted(1200L).lastRowsOmitted(35L)
                .build()));

        assertEquals(0, run("scheduler", "status"));
        assertThat(output())
                .contains("Scheduler not running")
                .contains("last=ok started=2026-01-01T01:00:00Z finished=2026-01-01T01:20:00Z inserted=1200 omitted=35");
    }

    @Test
    void status_databaseDown_exitsNonZero() {
        when(lifecycleManager.daemonPid()).thenReturn(OptionalLong.empty());
        when(statusReporter.report()).thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertEquals(1, run("scheduler", "status"));
        assertThat(output()).contains("Database unavailable");
    }

    @Test
    void ingest_success() {
        when(manualIngestion.ingest("nacional", "licitaciones", IngestionOptions.parse("2024-2025", false, false)))
                .thenReturn(new DispatchResult(1L, 9L, DispatchResult.Outcome.SUCCEEDED, new IngestionResult(100, 5), null));

        assertEquals(0, run("ingest", "nacional", "licitaciones", "--years=2024-2025"));
        assertThat(output()).contains("Run 9 ok: 100 inserted, 5 omitted");
    }

    @Test
    void ingest_failedRun_exitsOne() {
        when(manualIngestion.ingest(eq("madrid"), eq("comunidad"), any()))
                .thenReturn(new DispatchResult(1L, 9L, DispatchResult.Outcome.FAILED, null, "Extract not found"));

        assertEquals(1, run("ingest", "madrid", "comunidad", "--process-only"));
    }

    @Test
    void ingest_alreadyRunning_exitsTwo() {
        when(manualIngestion.ingest(eq("madrid"), eq("comunidad"), any()))
                .thenThrow(new RunAlreadyInProgressException(1L));

        assertEquals(2, run("ingest", "madrid", "comunidad"));
        assertThat(output()).contains("already running");
    }

    @Test
    void ingest_conflictingFlags_exitsOne() {
        assertEquals(1, run("ingest", "madrid", "comunidad", "--download-only", "--process-only"));
        verifyNoInteractions(manualIngestion);
    }
}
