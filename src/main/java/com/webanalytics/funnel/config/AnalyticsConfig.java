package com.webanalytics.funnel.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared beans for the analytics engine.
 *
 * Key design decisions:
 * - One bounded pool for per-step fallback queries, shared by all requests
 * - Pool threads are daemons
 */
@Slf4j
@Configuration
public class AnalyticsConfig {

    @Value("${funnel.query.parallelism:4}")
    private int parallelism;

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        // numeric timestamps are epoch millis, not seconds
        mapper.disable(DeserializationFeature.READ_DATE_TIMESTAMPS_AS_NANOSECONDS);
        return mapper;
    }

    @Bean(name = "stepQueryExecutor", destroyMethod = "shutdownNow")
    public ExecutorService stepQueryExecutor() {
        log.info("Step query pool sized at {} threads", parallelism);
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "step-query-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(parallelism, threadFactory);
    }
}
