package com.webanalytics.funnel;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Funnel conversion analytics service.
 *
 * Ingests visitor events from Kafka into a SQLite event store and answers
 * funnel analytics requests over HTTP.
 */
@Slf4j
@SpringBootApplication
public class FunnelAnalyticsApplication {

    public static void main(String[] args) {
        log.info("Starting Funnel Analytics Application...");
        SpringApplication.run(FunnelAnalyticsApplication.class, args);
        log.info("Funnel Analytics Application started successfully");
    }
}
