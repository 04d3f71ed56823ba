package com.licitia.etl.lifecycle;

import com.licitia.etl.config.LicitiaProperties;
import com.licitia.etl.exception.DaemonAlreadyRunningException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.OptionalLong;

/**
 * {@link DaemonLock} over a single-line PID file. The file counts as held only while the
 * recorded process is alive; a record pointing at a dead process is stale and gets replaced.
 */
@Slf4j
@Component
public class PidFileDaemonLock implements DaemonLock {

    private final Path pidFile;
    private final ProcessControl processControl;

    @Autowired
    public PidFileDaemonLock(LicitiaProperties properties, ProcessControl processControl) {
        this(properties.getScheduler().pidPath(), processControl);
    }

    public PidFileDaemonLock(Path pidFile, ProcessControl processControl) {
        this.pidFile = pidFile;
        this.processControl = processControl;
    }

    @Override
    public synchronized void acquire(long pid) {
        createParentDirectories();
        for (int attempt = 0; attempt < 3; attempt++) {
            try {
                Files.writeString(pidFile, Long.toString(pid), StandardCharsets.UTF_8, StandardOpenOption.CREATE_NEW);
                log.debug("PID file {} written with {}", pidFile, pid);
                return;
            } catch (FileAlreadyExistsException e) {
                OptionalLong recorded = recordedPid();
                if (recorded.isPresent() && recorded.getAsLong() == pid) {
                    return;
                }
                if (recorded.isPresent() && processControl.isAlive(recorded.getAsLong())) {
                    throw new DaemonAlreadyRunningException(recorded.getAsLong());
                }
                log.info("Replacing stale PID file {}", pidFile);
                deletePidFile();
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot write PID file " + pidFile, e);
            }
        }
        throw new IllegalStateException("Could not acquire PID file " + pidFile + " after repeated attempts");
    }

    @Override
    public synchronized void release(long pid) {
        OptionalLong recorded = recordedPid();
        if (recorded.isPresent() && recorded.getAsLong() == pid) {
            deletePidFile();
        }
    }

    @Override
    public OptionalLong holder() {
        OptionalLong recorded = recordedPid();
        if (recorded.isPresent() && processControl.isAlive(recorded.getAsLong())) {
            return recorded;
        }
        return OptionalLong.empty();
    }

    @Override
    public synchronized boolean clear() {
        return deletePidFile();
    }

    /**
     * PID written in the file, alive or not. Unparsable content reads as empty.
     */
    public OptionalLong recordedPid() {
        String content;
        try {
            content = Files.readString(pidFile, StandardCharsets.UTF_8).trim();
        } catch (NoSuchFileException e) {
            return OptionalLong.empty();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read PID file " + pidFile, e);
        }
        try {
            long pid = Long.parseLong(content);
            return pid > 0 ? OptionalLong.of(pid) : OptionalLong.empty();
        } catch (NumberFormatException e) {
            log.warn("PID file {} has unexpected content '{}'", pidFile, content);
            return OptionalLong.empty();
        }
    }

    private boolean deletePidFile() {
        try {
            return Files.deleteIfExists(pidFile);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot remove PID file " + pidFile, e);
        }
    }

    private void createParentDirectories() {
        Path parent = pidFile.toAbsolutePath().getParent();
        if (parent == null) return;
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create directory " + parent, e);
        }
    }
}
