package com.licitia.etl.scheduler;

import com.licitia.etl.config.LicitiaProperties;
import com.licitia.etl.domain.entity.Task;
import com.licitia.etl.domain.enums.Frequency;
import com.licitia.etl.ingestion.DatasetCatalog;
import com.licitia.etl.ingestion.IngestionOptions;
import com.licitia.etl.ingestion.IngestionResult;
import com.licitia.etl.repository.SchemaMigrator;
import com.licitia.etl.service.DispatchResult;
import com.licitia.etl.service.RunLedgerService;
import com.licitia.etl.service.TaskDispatcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DaemonRunnerTest {

    @Mock DueTaskFinder dueTaskFinder;
    @Mock TaskDispatcher taskDispatcher;
    @Mock RunLedgerService runLedger;
    @Mock SchemaMigrator schemaMigrator;

    private static final Instant NOW = Instant.parse("2026-02-17T10:00:00Z");

    private DaemonRunner runner;

    @BeforeEach
    void setUp() {
        runner = new DaemonRunner(dueTaskFinder, taskDispatcher, runLedger, new DatasetCatalog(),
                new ScheduleCalculator(ZoneId.of("Europe/Madrid"), LocalTime.of(2, 0)),
                Clock.fixed(NOW, ZoneOffset.UTC), new LicitiaProperties(), schemaMigrator);
    }

    private static DueTaskFinder.DueTask due(long id, String dataset, String subset) {
        Task task = Task.builder().id(id).dataset(dataset).subset(subset).frequency(Frequency.MONTHLY).build();
        return new DueTaskFinder.DueTask(task, ZonedDateTime.ofInstant(NOW, ZoneOffset.UTC));
    }

    @Test
    void tick_oneFailureDoesNotStopOthers() {
        var a = due(1, "valencia", "contratacion");
        var b = due(2, "valencia", "subvenciones");
        var c = due(3, "valencia", "convenios");
        when(runLedger.recoverOrphanedRuns(NOW)).thenReturn(0);
        when(dueTaskFinder.findDueTasks(NOW)).thenReturn(List.of(a, b, c));
        when(taskDispatcher.dispatch(eq(a.task()), any())).thenReturn(
                new DispatchResult(1L, 10L, DispatchResult.Outcome.FAILED, null, "boom"));
        when(taskDispatcher.dispatch(eq(b.task()), any())).thenThrow(new IllegalStateException("ledger write lost"));
        when(taskDispatcher.dispatch(eq(c.task()), any())).thenReturn(
                new DispatchResult(3L, 12L, DispatchResult.Outcome.SUCCEEDED, new IngestionResult(1, 0), null));

        TickReport report = runner.tick();

        assertEquals(new TickReport(3, 1, 2, 0, 0), report);
        verify(taskDispatcher, times(3)).dispatch(any(), any());
    }

    @Test
    void tick_countsSkipsAndRecoveredRuns() {
        var a = due(1, "madrid", "comunidad");
        when(runLedger.recoverOrphanedRuns(NOW)).thenReturn(2);
        when(dueTaskFinder.findDueTasks(NOW)).thenReturn(List.of(a));
        when(taskDispatcher.dispatch(eq(a.task()), any()))
                .thenReturn(new DispatchResult(1L, null, DispatchResult.Outcome.SKIPPED, null, null));

        assertEquals(new TickReport(1, 0, 0, 1, 2), runner.tick());
    }

    @Test
    void tick_nothingDue_isIdle() {
        when(runLedger.recoverOrphanedRuns(NOW)).thenReturn(0);
        when(dueTaskFinder.findDueTasks(NOW)).thenReturn(List.of());

        assertEquals(TickReport.idle(0), runner.tick());
        verifyNoInteractions(taskDispatcher);
    }

    @Test
    void tick_yearRangedDataset_getsCurrentYear() {
        var ted = due(1, "ted", "ted_es_can");
        var madrid = due(2, "madrid", "ayuntamiento");
        when(runLedger.recoverOrphanedRuns(NOW)).thenReturn(0);
        when(dueTaskFinder.findDueTasks(NOW)).thenReturn(List.of(ted, madrid));
        when(taskDispatcher.dispatch(any(), any()))
                .thenReturn(new DispatchResult(1L, 1L, DispatchResult.Outcome.SUCCEEDED, IngestionResult.empty(), null));

        runner.tick();

        verify(taskDispatcher).dispatch(ted.task(), IngestionOptions.forYear(2026));
        verify(taskDispatcher).dispatch(madrid.task(), IngestionOptions.defaults());
    }

    @Test
    void tick_stopRequested_leavesRemainingTasks() {
        var a = due(1, "valencia", "contratacion");
        var b = due(2, "valencia", "subvenciones");
        when(runLedger.recoverOrphanedRuns(NOW)).thenReturn(0);
        when(dueTaskFinder.findDueTasks(NOW)).thenReturn(List.of(a, b));
        when(taskDispatcher.dispatch(eq(a.task()), any())).thenAnswer(inv -> {
            runner.requestStop();
            return new DispatchResult(1L, 1L, DispatchResult.Outcome.SUCCEEDED, IngestionResult.empty(), null);
        });

        TickReport report = runner.tick();

        assertEquals(1, report.succeeded());
        verify(taskDispatcher, never()).dispatch(eq(b.task()), any());
    }

    @Test
    void runLoop_survivesDatabaseOutage_andStopsOnRequest() throws Exception {
        AtomicInteger ticks = new AtomicInteger();
        CountDownLatch secondTick = new CountDownLatch(2);
        when(runLedger.recoverOrphanedRuns(NOW)).thenAnswer(inv -> {
            secondTick.countDown();
            if (ticks.incrementAndGet() == 1) {
                throw new DataAccessResourceFailureException("connection refused");
            }
            return 0;
        });
        lenient().when(dueTaskFinder.findDueTasks(NOW)).thenReturn(List.of());

        AtomicBoolean released = new AtomicBoolean();
        Thread loop = new Thread(() -> runner.runLoop(Duration.ofMillis(20), () -> released.set(true)));
        loop.start();

        assertTrue(secondTick.await(5, TimeUnit.SECONDS));
        runner.requestStop();
        loop.join(5_000);

        assertFalse(loop.isAlive());
        assertTrue(released.get());
        assertThat(ticks.get()).isGreaterThanOrEqualTo(2);
    }

    @Test
    void runLoop_retriesMigrationUntilDatabaseIsUp() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        doAnswer(inv -> {
            if (attempts.incrementAndGet() == 1) {
                throw new CannotGetJdbcConnectionException("Connection refused");
            }
            return null;
        }).when(schemaMigrator).migrate();
        CountDownLatch ticked = new CountDownLatch(2);
        when(runLedger.recoverOrphanedRuns(NOW)).thenAnswer(inv -> {
            ticked.countDown();
            return 0;
        });
        when(dueTaskFinder.findDueTasks(NOW)).thenReturn(List.of());

        Thread loop = new Thread(() -> runner.runLoop(Duration.ofMillis(20), () -> { }));
        loop.start();

        assertTrue(ticked.await(5, TimeUnit.SECONDS));
        runner.requestStop();
        loop.join(5_000);

        assertFalse(loop.isAlive());
        verify(schemaMigrator, times(2)).migrate();
    }
}
