package com.licitia.etl;

import com.licitia.etl.cli.EtlCommandRunner;
import com.licitia.etl.scheduler.DaemonRunner;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class LicitiaEtlApplicationTest {

    @Autowired EtlCommandRunner commandRunner;
    @Autowired DaemonRunner daemonRunner;

    @Test
    void contextLoads_withoutCommandRunnerDoingAnything() {
        assertEquals(0, commandRunner.getExitCode());
        assertFalse(daemonRunner.isStopRequested());
    }

    @Test
    void isCommand_firstPositionalArgumentSelectsCliMode() {
        assertTrue(LicitiaEtlApplication.isCommand(new String[]{"scheduler", "status"}));
        assertTrue(LicitiaEtlApplication.isCommand(new String[]{"--spring.profiles.active=prod", "ingest", "ted", "ted_es_can"}));
        assertTrue(LicitiaEtlApplication.isCommand(new String[]{"init-db"}));
        assertFalse(LicitiaEtlApplication.isCommand(new String[]{}));
        assertFalse(LicitiaEtlApplication.isCommand(new String[]{"--server.port=9090"}));
        assertFalse(LicitiaEtlApplication.isCommand(new String[]{"serve"}));
    }
}
