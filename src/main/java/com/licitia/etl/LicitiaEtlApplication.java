package com.licitia.etl;

import org.springframework.boot.Banner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.util.Arrays;
import java.util.Set;

@SpringBootApplication
public class LicitiaEtlApplication {

    static final Set<String> COMMANDS = Set.of("scheduler", "ingest", "init-db");

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(LicitiaEtlApplication.class);
        if (isCommand(args)) {
            app.setWebApplicationType(WebApplicationType.NONE);
            app.setBannerMode(Banner.Mode.OFF);
            System.exit(SpringApplication.exit(app.run(args)));
        }
        app.run(args);
    }

    static boolean isCommand(String[] args) {
        return Arrays.stream(args)
                .filter(a -> !a.startsWith("--"))
                .findFirst()
                .map(COMMANDS::contains)
                .orElse(false);
    }
}
