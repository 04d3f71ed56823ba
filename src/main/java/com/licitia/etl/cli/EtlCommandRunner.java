package com.licitia.etl.cli;

import com.licitia.etl.config.LicitiaProperties;
import com.licitia.etl.domain.dto.TaskStatusView;
import com.licitia.etl.domain.entity.Task;
import com.licitia.etl.domain.enums.Frequency;
import com.licitia.etl.exception.ConfigurationException;
import com.licitia.etl.exception.DaemonAlreadyRunningException;
import com.licitia.etl.exception.RunAlreadyInProgressException;
import com.licitia.etl.exception.TaskNotFoundException;
import com.licitia.etl.ingestion.IngestionOptions;
import com.licitia.etl.lifecycle.LifecycleManager;
import com.licitia.etl.lifecycle.StopOutcome;
import com.licitia.etl.repository.SchemaMigrator;
import com.licitia.etl.service.DispatchResult;
import com.licitia.etl.service.ManualIngestionService;
import com.licitia.etl.service.StatusReporterService;
import com.licitia.etl.service.TaskRegistryService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.OptionalLong;

/**
 * Command-line surface: {@code init-db}, {@code scheduler <register|enable|disable|run|stop|status>}
 * and {@code ingest <dataset> <subset>}. Without a command the application serves HTTP and
 * this runner does nothing.
 */
@Slf4j
@Component
public class EtlCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_BUSY = 2;

    private final TaskRegistryService taskRegistry;
    private final StatusReporterService statusReporter;
    private final ManualIngestionService manualIngestion;
    private final LifecycleManager lifecycleManager;
    private final SchemaMigrator schemaMigrator;
    private final LicitiaProperties properties;
    private final PrintStream out;

    private int exitCode = EXIT_OK;

    @Autowired
    public EtlCommandRunner(TaskRegistryService taskRegistry,
                            StatusReporterService statusReporter,
                            ManualIngestionService manualIngestion,
                            LifecycleManager lifecycleManager,
                            SchemaMigrator schemaMigrator,
                            LicitiaProperties properties) {
        this(taskRegistry, statusReporter, manualIngestion, lifecycleManager, schemaMigrator, properties, System.out);
    }

    EtlCommandRunner(TaskRegistryService taskRegistry,
                     StatusReporterService statusReporter,
                     ManualIngestionService manualIngestion,
                     LifecycleManager lifecycleManager,
                     SchemaMigrator schemaMigrator,
                     LicitiaProperties properties,
                     PrintStream out) {
        this.taskRegistry = taskRegistry;
        this.statusReporter = statusReporter;
        this.manualIngestion = manualIngestion;
        this.lifecycleManager = lifecycleManager;
        this.schemaMigrator = schemaMigrator;
        this.properties = properties;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> words = args.getNonOptionArgs();
        if (words.isEmpty()) {
            return;
        }
        exitCode = execute(words, args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    int execute(List<String> words, ApplicationArguments args) {
        try {
            return switch (words.get(0)) {
                case "init-db" -> initDb();
                case "scheduler" -> scheduler(words, args);
                case "ingest" -> ingest(words, args);
                default -> usage("Unknown command: " + words.get(0));
            };
        } catch (RunAlreadyInProgressException e) {
            out.println("Task " + e.getTaskId() + " is already running");
            return EXIT_BUSY;
        } catch (DaemonAlreadyRunningException e) {
            out.println("Scheduler already running (PID " + e.getPid() + ")");
            return EXIT_BUSY;
        } catch (ConfigurationException | TaskNotFoundException e) {
            out.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (DataAccessException e) {
            log.error("Database error", e);
            out.println("Database unavailable: " + e.getMostSpecificCause().getMessage());
            return EXIT_FAILURE;
        } catch (RuntimeException e) {
            log.error("Command failed", e);
            out.println("Error: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private int initDb() {
        schemaMigrator.migrate();
        out.println("Scheduler schema ready");
        return EXIT_OK;
    }

    private int scheduler(List<String> words, ApplicationArguments args) {
        if (words.size() < 2) {
            return usage("Missing scheduler subcommand");
        }
        return switch (words.get(1)) {
            case "register" -> register(args);
            case "enable" -> setEnabled(args, true);
            case "disable" -> setEnabled(args, false);
            case "run" -> runDaemon(args);
            case "stop" -> stop();
            case "status" -> status();
            default -> usage("Unknown scheduler subcommand: " + words.get(1));
        };
    }

    private int register(ApplicationArguments args) {
        String dataset = option(args, "dataset");
        String subset = option(args, "subset");
        String frequency = option(args, "frequency");

        if (subset != null || frequency != null) {
            if (dataset == null || subset == null) {
                throw new ConfigurationException("--subset and --frequency need both --dataset and --subset");
            }
            Frequency parsed = frequency != null ? Frequency.parse(frequency) : null;
            TaskRegistryService.Registration registration = taskRegistry.register(dataset, subset, parsed);
            Task task = registration.task();
            out.printf("%s %s (task %d, %s)%n", registration.outcome().name().toLowerCase(), task.key(),
                    task.getId(), task.getFrequency().getLabel());
            return EXIT_OK;
        }

        TaskRegistryService.RegistrationSummary summary =
                taskRegistry.registerDefaults(dataset != null ? List.of(dataset) : List.of());
        out.printf("Registered %d task(s): %d inserted, %d updated, %d unchanged%n",
                summary.tasks().size(), summary.inserted(), summary.updated(), summary.unchanged());
        return EXIT_OK;
    }

    private int setEnabled(ApplicationArguments args, boolean enabled) {
        String raw = option(args, "task-id");
        if (raw == null) {
            throw new ConfigurationException("--task-id is required");
        }
        Long taskId = parseLong(raw, "--task-id");
        Task task = enabled ? taskRegistry.enable(taskId) : taskRegistry.disable(taskId);
        out.printf("Task %d (%s) %s%n", task.getId(), task.key(), enabled ? "enabled" : "disabled");
        return EXIT_OK;
    }

    private int runDaemon(ApplicationArguments args) {
        String rawTick = option(args, "tick-seconds");
        long seconds = rawTick != null ? parseLong(rawTick, "--tick-seconds") : properties.getScheduler().getTickSeconds();
        if (seconds < 1) {
            throw new ConfigurationException("--tick-seconds must be positive");
        }
        Duration tick = Duration.ofSeconds(seconds);

        if (args.containsOption("background")) {
            long pid = lifecycleManager.startBackground(tick, passthroughArgs(args));
            out.printf("Scheduler started in background (PID %d), log: %s%n",
                    pid, properties.getScheduler().logPath());
            return EXIT_OK;
        }
        lifecycleManager.runForeground(tick);
        return EXIT_OK;
    }

    private int stop() {
        StopOutcome outcome = lifecycleManager.stop();
        out.println(switch (outcome) {
            case STOPPED -> "Scheduler stopped";
            case NOT_RUNNING, STALE_PID_REMOVED -> "Scheduler not running, nothing to stop";
            case SIGNAL_FAILED -> "Could not signal the scheduler process";
            case STILL_STOPPING -> "Scheduler signalled but still shutting down";
        });
        return outcome.isError() ? EXIT_FAILURE : EXIT_OK;
    }

    private int status() {
        OptionalLong pid = lifecycleManager.daemonPid();
        out.println(pid.isPresent() ? "Scheduler running (PID " + pid.getAsLong() + ")" : "Scheduler not running");

        List<TaskStatusView> views = statusReporter.report();
        if (views.isEmpty()) {
            out.println("No enabled tasks");
            return EXIT_OK;
        }
        for (TaskStatusView v : views) {
            out.printf("%d %s/%s %s state=%s due=%s next=%s last=%s started=%s finished=%s inserted=%s omitted=%s%n",
                    v.getTaskId(), v.getDataset(), v.getSubset(), v.getFrequency(),
                    v.getState().name().toLowerCase(), v.isDue(), v.getNextExecution(),
                    orDash(v.getLastRunStatus()), orDash(v.getLastRunStartedAt()), orDash(v.getLastRunFinishedAt()),
                    orDash(v.getLastRowsInserted()), orDash(v.getLastRowsOmitted()));
            if (v.getLastError() != null) {
                out.println("    error: " + v.getLastError());
            }
        }
        return EXIT_OK;
    }

    private int ingest(List<String> words, ApplicationArguments args) {
        if (words.size() < 3) {
            return usage("Usage: ingest <dataset> <subset> [--years=YYYY-YYYY] [--download-only] [--process-only]");
        }
        IngestionOptions options = IngestionOptions.parse(option(args, "years"),
                args.containsOption("download-only"), args.containsOption("process-only"));
        DispatchResult result = manualIngestion.ingest(words.get(1), words.get(2), options);
        if (result.succeeded()) {
            out.printf("Run %d ok: %d inserted, %d omitted%n",
                    result.runId(), result.result().rowsInserted(), result.result().rowsOmitted());
            return EXIT_OK;
        }
        out.printf("Run %d failed: %s%n", result.runId(), result.errorMessage());
        return EXIT_FAILURE;
    }

    private int usage(String message) {
        out.println(message);
        out.println("Commands: init-db | scheduler register|enable|disable|run|stop|status | ingest <dataset> <subset>");
        return EXIT_FAILURE;
    }

    /**
     * Options forwarded to the detached daemon, minus the ones this command consumes.
     */
    static List<String> passthroughArgs(ApplicationArguments args) {
        return Arrays.stream(args.getSourceArgs())
                .filter(a -> a.startsWith("--"))
                .filter(a -> !a.equals("--background"))
                .filter(a -> !a.startsWith("--tick-seconds"))
                .toList();
    }

    private static String option(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        String value = values.get(values.size() - 1);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static long parseLong(String raw, String name) {
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(name + " must be a number, got '" + raw + "'");
        }
    }

    private static String orDash(Object value) {
        return value != null ? value.toString() : "-";
    }
}
