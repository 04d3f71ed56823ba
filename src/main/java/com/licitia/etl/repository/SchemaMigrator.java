package com.licitia.etl.repository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.util.List;

/**
 * Applies the scheduler migrations in order. Every script is safe to re-run.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SchemaMigrator {

    static final List<String> MIGRATIONS = List.of(
            "schema/001_scheduler.sql",
            "schema/002_scheduler_runs_pid.sql"
    );

    private final DataSource dataSource;

    public void migrate() {
        ResourceDatabasePopulator populator = new ResourceDatabasePopulator();
        populator.setSqlScriptEncoding("UTF-8");
        for (String location : MIGRATIONS) {
            populator.addScript(new ClassPathResource(location));
        }
        populator.execute(dataSource);
        log.info("Scheduler schema up to date ({} migrations)", MIGRATIONS.size());
    }
}
