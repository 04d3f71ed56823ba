package com.licitia.etl.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class SchedulerClockConfig {

    @Bean
    public Clock schedulerClock() {
        return Clock.systemUTC();
    }
}
