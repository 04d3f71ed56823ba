package com.licitia.etl.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "licitia")
@Data
public class LicitiaProperties {

    private Scheduler scheduler = new Scheduler();
    private Ingestion ingestion = new Ingestion();

    @Data
    public static class Scheduler {
        private String zone = "Europe/Madrid";
        private int anchorHour = 2;
        private int tickSeconds = 60;
        private String pidFile = Path.of(System.getProperty("java.io.tmpdir"), "licitia-etl-scheduler.pid").toString();
        /** Defaults to scheduler.log next to the PID file. */
        private String logFile;
        private Duration maxRunDuration = Duration.ofHours(6);
        private Duration stopGracePeriod = Duration.ofSeconds(10);

        public ZoneId zoneId() {
            return ZoneId.of(zone);
        }

        public Path pidPath() {
            return Path.of(pidFile);
        }

        public Path logPath() {
            if (logFile != null && !logFile.isBlank()) {
                return Path.of(logFile);
            }
            Path parent = pidPath().toAbsolutePath().getParent();
            return parent.resolve("scheduler.log");
        }
    }

    @Data
    public static class Ingestion {
        private String schema = "raw";
        private String tmpDir = Path.of(System.getProperty("java.io.tmpdir"), "licitia").toString();
        private int batchSize = 10_000;
        private char csvDelimiter = ',';
        /** Working directory for extract commands; the JVM working directory when unset. */
        private String workingDir;
        /**
         * Extract command lines per dataset, run in order. Tokens may use
         * {dataset}, {subset}, {yearFrom} and {yearTo}.
         */
        private Map<String, List<String>> extractCommands = new LinkedHashMap<>();

        public Path tmpPath() {
            return Path.of(tmpDir);
        }

        public int effectiveBatchSize() {
            return Math.max(1, batchSize);
        }
    }
}
