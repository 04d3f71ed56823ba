package com.licitia.etl.scheduler;

import com.licitia.etl.config.LicitiaProperties;
import com.licitia.etl.ingestion.DatasetCatalog;
import com.licitia.etl.ingestion.DatasetDefinition;
import com.licitia.etl.ingestion.IngestionOptions;
import com.licitia.etl.repository.SchemaMigrator;
import com.licitia.etl.service.DispatchResult;
import com.licitia.etl.service.RunLedgerService;
import com.licitia.etl.service.TaskDispatcher;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Fixed-tick scheduling loop. The scheduler schema is migrated before the first tick, and
 * retried on every tick until the database accepts it. Each tick reconciles orphaned runs,
 * then dispatches every due task in turn. A stop request ends the wait between ticks immediately; a dispatch in
 * progress is allowed to finish.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DaemonRunner {

    private final DueTaskFinder dueTaskFinder;
    private final TaskDispatcher taskDispatcher;
    private final RunLedgerService runLedger;
    private final DatasetCatalog catalog;
    private final ScheduleCalculator scheduleCalculator;
    private final Clock clock;
    private final LicitiaProperties properties;
    private final SchemaMigrator schemaMigrator;

    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private volatile CountDownLatch loopExited;
    private boolean schemaReady;

    public TickReport tick() {
        Instant now = clock.instant();
        int recovered = runLedger.recoverOrphanedRuns(now);

        List<DueTaskFinder.DueTask> dueTasks = dueTaskFinder.findDueTasks(now);
        if (dueTasks.isEmpty()) {
            log.debug("No tasks due");
            return TickReport.idle(recovered);
        }
        log.info("{} task(s) due", dueTasks.size());

        int succeeded = 0;
        int failed = 0;
        int skipped = 0;
        for (DueTaskFinder.DueTask due : dueTasks) {
            if (isStopRequested()) {
                log.info("Stop requested, leaving {} task(s) for the next start",
                        dueTasks.size() - succeeded - failed - skipped);
                break;
            }
            DispatchResult result;
            try {
                result = taskDispatcher.dispatch(due.task(), optionsFor(due.task().getDataset(), now));
            } catch (RuntimeException e) {
                // the run could not be opened or closed; orphan recovery picks it up
                log.error("Dispatch of task {} failed", due.task().key(), e);
                failed++;
                continue;
            }
            switch (result.outcome()) {
                case SUCCEEDED -> succeeded++;
                case FAILED -> failed++;
                case SKIPPED -> skipped++;
            }
        }
        return new TickReport(dueTasks.size(), succeeded, failed, skipped, recovered);
    }

    /**
     * Blocks running ticks every {@code tickInterval} until {@link #requestStop()}.
     * {@code onExit} runs before the loop reports itself finished.
     */
    public void runLoop(Duration tickInterval, Runnable onExit) {
        loopExited = new CountDownLatch(1);
        log.info("Scheduler loop started, tick={}s zone={}", tickInterval.toSeconds(), scheduleCalculator.getZone());
        try {
            while (!isStopRequested()) {
                try {
                    if (!schemaReady) {
                        schemaMigrator.migrate();
                        schemaReady = true;
                    }
                    TickReport report = tick();
                    if (report.due() > 0 || report.recovered() > 0) {
                        log.info("Tick done: {}", report);
                    }
                } catch (DataAccessException e) {
                    log.error("Database unavailable, retrying next tick: {}", e.getMessage());
                } catch (RuntimeException e) {
                    log.error("Tick failed", e);
                }
                if (stopSignal.await(tickInterval.toMillis(), TimeUnit.MILLISECONDS)) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Scheduler loop interrupted");
        } finally {
            try {
                onExit.run();
            } finally {
                log.info("Scheduler loop stopped");
                loopExited.countDown();
            }
        }
    }

    public void requestStop() {
        stopSignal.countDown();
    }

    public boolean isStopRequested() {
        return stopSignal.getCount() == 0;
    }

    @PreDestroy
    void shutdown() {
        requestStop();
        CountDownLatch exited = loopExited;
        if (exited == null) {
            return;
        }
        Duration grace = properties.getScheduler().getStopGracePeriod();
        try {
            if (!exited.await(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Scheduler loop still busy after {}s", grace.toSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    IngestionOptions optionsFor(String dataset, Instant now) {
        boolean requiresYears = catalog.find(dataset).map(DatasetDefinition::requiresYears).orElse(false);
        if (!requiresYears) {
            return IngestionOptions.defaults();
        }
        return IngestionOptions.forYear(now.atZone(scheduleCalculator.getZone()).getYear());
    }
}
