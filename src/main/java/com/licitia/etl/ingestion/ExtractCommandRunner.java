package com.licitia.etl.ingestion;

import com.licitia.etl.config.LicitiaProperties;
import com.licitia.etl.exception.IngestionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Runs the external extract commands configured for a dataset, in order.
 * Their output is forwarded to the log; a non-zero exit fails the ingestion.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExtractCommandRunner {

    private final LicitiaProperties properties;

    /**
     * @return the number of commands executed
     */
    public int run(String dataset, String subset, IngestionOptions options) {
        List<String> commandLines = properties.getIngestion().getExtractCommands().getOrDefault(dataset, List.of());
        if (commandLines.isEmpty()) {
            log.info("No extract commands configured for dataset={}, expecting an existing extract", dataset);
            return 0;
        }
        for (String line : commandLines) {
            execute(expand(line, dataset, subset, options));
        }
        return commandLines.size();
    }

    static List<String> expand(String commandLine, String dataset, String subset, IngestionOptions options) {
        List<String> tokens = new ArrayList<>();
        for (String token : commandLine.trim().split("\\s+")) {
            if (token.isEmpty()) continue;
            String t = token
                    .replace("{dataset}", dataset)
                    .replace("{subset}", subset);
            if (options.hasYears()) {
                t = t.replace("{yearFrom}", String.valueOf(options.yearFrom()))
                        .replace("{yearTo}", String.valueOf(options.yearTo()));
            } else if (t.contains("{yearFrom}") || t.contains("{yearTo}")) {
                throw new IngestionException("Extract command needs a year range: " + commandLine);
            }
            tokens.add(t);
        }
        if (tokens.isEmpty()) {
            throw new IngestionException("Empty extract command configured for dataset " + dataset);
        }
        return tokens;
    }

    private void execute(List<String> command) {
        String printable = String.join(" ", command);
        log.info("Running extract command: {}", printable);

        ProcessBuilder builder = new ProcessBuilder(command).redirectErrorStream(true);
        String workingDir = properties.getIngestion().getWorkingDir();
        if (workingDir != null && !workingDir.isBlank()) {
            builder.directory(new File(workingDir));
        }

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new IngestionException("Could not start extract command '" + printable + "': " + e.getMessage(), e);
        }

        try (BufferedReader out = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = out.readLine()) != null) {
                log.info("[extract] {}", line);
            }
            int exitCode = process.waitFor();
            if (exitCode != 0) {
                throw new IngestionException("Extract command '" + printable + "' exited with code " + exitCode);
            }
        } catch (IOException e) {
            process.destroy();
            throw new IngestionException("Lost output of extract command '" + printable + "'", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroy();
            throw new IngestionException("Interrupted while waiting for '" + printable + "'", e);
        }
    }
}
