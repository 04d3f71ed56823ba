package com.licitia.etl.lifecycle;

import com.licitia.etl.LicitiaEtlApplication;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.management.ManagementFactory;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Starts the scheduler in a separate JVM that outlives this one, with stdout and stderr
 * appended to the scheduler log.
 */
@Slf4j
@Component
public class DaemonLauncher {

    /**
     * @param passthroughArgs application options forwarded to the child (e.g. {@code --spring.config.location=...})
     * @return PID of the child process
     */
    public long launch(Duration tick, Path logFile, List<String> passthroughArgs) {
        List<String> command = daemonCommand(javaExecutable(), jvmOptions(),
                System.getProperty("java.class.path"), tick, passthroughArgs);
        try {
            Path parent = logFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Process process = new ProcessBuilder(command)
                    .redirectErrorStream(true)
                    .redirectOutput(ProcessBuilder.Redirect.appendTo(logFile.toFile()))
                    .start();
            log.info("Scheduler started in background, PID={} log={}", process.pid(), logFile);
            return process.pid();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not start scheduler process", e);
        }
    }

    static List<String> daemonCommand(String java, List<String> jvmOptions, String classPath,
                                      Duration tick, List<String> passthroughArgs) {
        List<String> command = new ArrayList<>();
        command.add(java);
        command.addAll(jvmOptions);
        if (isExecutableJar(classPath)) {
            command.add("-jar");
            command.add(classPath);
        } else {
            command.add("-cp");
            command.add(classPath);
            command.add(LicitiaEtlApplication.class.getName());
        }
        command.add("scheduler");
        command.add("run");
        command.add("--tick-seconds=" + tick.toSeconds());
        command.addAll(passthroughArgs);
        return command;
    }

    private static boolean isExecutableJar(String classPath) {
        return classPath != null
                && !classPath.contains(File.pathSeparator)
                && classPath.endsWith(".jar");
    }

    private static String javaExecutable() {
        return ProcessHandle.current().info().command()
                .orElse(Path.of(System.getProperty("java.home"), "bin", "java").toString());
    }

    // system properties and memory settings only; agents and debug ports stay with the parent
    private static List<String> jvmOptions() {
        return ManagementFactory.getRuntimeMXBean().getInputArguments().stream()
                .filter(arg -> arg.startsWith("-D") || arg.startsWith("-Xm"))
                .toList();
    }
}
