package com.webanalytics.funnel.testutil;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.webanalytics.funnel.config.AnalyticsConfig;
import com.webanalytics.funnel.engine.FunnelAnalyticsEngine;
import com.webanalytics.funnel.engine.FunnelSummaryComposer;
import com.webanalytics.funnel.engine.ReferrerSegmenter;
import com.webanalytics.funnel.engine.SessionProgressionReconstructor;
import com.webanalytics.funnel.engine.StepAggregator;
import com.webanalytics.funnel.metrics.Metrics;
import com.webanalytics.funnel.metrics.NoOpMetrics;
import com.webanalytics.funnel.model.FunnelDefinition;
import com.webanalytics.funnel.model.FunnelStep;
import com.webanalytics.funnel.model.StepOccurrence;
import com.webanalytics.funnel.model.StepType;
import com.webanalytics.funnel.model.VisitorEvent;
import com.webanalytics.funnel.query.FilterCompiler;
import com.webanalytics.funnel.query.FunnelQueryOrchestrator;
import com.webanalytics.funnel.query.StepQueryBuilder;
import com.webanalytics.funnel.referrer.KnownSourceReferrerNormalizer;
import com.webanalytics.funnel.store.EventStore;
import com.webanalytics.funnel.store.FunnelDefinitionStore;
import com.webanalytics.funnel.store.SqliteConnectionFactory;
import com.webanalytics.funnel.store.SqliteEventStore;
import com.webanalytics.funnel.store.WebsiteStore;

import java.nio.file.Path;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

public final class TestFactory {
    private TestFactory(){}

    public static final String WEBSITE = "site_1";
    public static final Instant BASE = Instant.parse("2024-03-01T10:00:00Z");

    public static ObjectMapper objectMapper() {
        return new AnalyticsConfig().objectMapper();
    }

    public static ExecutorService executor() {
        return Executors.newFixedThreadPool(4);
    }

    public static ReferrerSegmenter referrerSegmenter() {
        return new ReferrerSegmenter(
                new SessionProgressionReconstructor(),
                new StepAggregator(),
                new KnownSourceReferrerNormalizer()
        );
    }

    public static FunnelQueryOrchestrator orchestrator(EventStore store, ExecutorService executor, Metrics metrics) {
        return new FunnelQueryOrchestrator(store, new StepQueryBuilder(), executor, metrics);
    }

    public static FunnelAnalyticsEngine createEngine(
            EventStore eventStore,
            FunnelDefinitionStore definitions,
            WebsiteStore websites,
            ExecutorService executor
    ) {
        return createEngine(eventStore, definitions, websites, executor, new NoOpMetrics());
    }

    public static FunnelAnalyticsEngine createEngine(
            EventStore eventStore,
            FunnelDefinitionStore definitions,
            WebsiteStore websites,
            ExecutorService executor,
            Metrics metrics
    ) {
        return new FunnelAnalyticsEngine(
                definitions,
                websites,
                new FilterCompiler(),
                new StepQueryBuilder(),
                orchestrator(eventStore, executor, metrics),
                new SessionProgressionReconstructor(),
                new StepAggregator(),
                new FunnelSummaryComposer(),
                referrerSegmenter(),
                metrics
        );
    }

    public static SqliteEventStore sqliteEventStore(Path dir) throws SQLException {
        SqliteConnectionFactory connections = new SqliteConnectionFactory(
                dir.resolve("analytics.db").toString(), 5000);
        SqliteEventStore store = new SqliteEventStore(connections, objectMapper(), 30);
        store.initialize();
        return store;
    }

    /* -------- Rows -------- */

    public static StepOccurrence row(int step, String session, long secondsAfterBase) {
        return StepOccurrence.of(step, session, BASE.plusSeconds(secondsAfterBase));
    }

    public static StepOccurrence row(int step, String session, long secondsAfterBase, String referrer) {
        return new StepOccurrence(step, session, BASE.plusSeconds(secondsAfterBase), referrer);
    }

    /**
     * Rows for a session that completes steps 1..reached, one minute apart.
     */
    public static List<StepOccurrence> sessionReaching(String session, int reached) {
        return sessionReaching(session, reached, null);
    }

    public static List<StepOccurrence> sessionReaching(String session, int reached, String referrer) {
        List<StepOccurrence> rows = new ArrayList<>();
        for (int step = 1; step <= reached; step++) {
            rows.add(row(step, session, step * 60L, referrer));
        }
        return rows;
    }

    /* -------- Definitions -------- */

    public static FunnelStep pageStep(String path, String name) {
        return FunnelStep.builder().type(StepType.PAGE_VIEW).target(path).name(name).build();
    }

    public static FunnelStep eventStep(String eventName, String name) {
        return FunnelStep.builder().type(StepType.EVENT).target(eventName).name(name).build();
    }

    public static List<FunnelStep> steps(int count) {
        List<FunnelStep> steps = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            steps.add(eventStep("event_" + i, "Step " + i));
        }
        return steps;
    }

    public static FunnelDefinition definition(List<FunnelStep> steps) {
        return FunnelDefinition.builder()
                .websiteId(WEBSITE)
                .name("Test funnel")
                .steps(steps)
                .build();
    }

    /** The pricing, signup, purchase funnel. */
    public static List<FunnelStep> pricingFunnel() {
        return List.of(
                pageStep("/pricing", "Pricing"),
                eventStep("signup_clicked", "Signup"),
                eventStep("purchase_completed", "Purchase")
        );
    }

    /* -------- Events -------- */

    public static VisitorEvent pageView(String session, String path, Instant t, String referrer) {
        return VisitorEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .websiteId(WEBSITE)
                .sessionId(session)
                .eventName(VisitorEvent.PAGE_VIEW_EVENT)
                .path(path)
                .referrer(referrer)
                .eventTime(t)
                .build();
    }

    public static VisitorEvent event(String session, String eventName, Instant t) {
        return VisitorEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .websiteId(WEBSITE)
                .sessionId(session)
                .eventName(eventName)
                .eventTime(t)
                .build();
    }
}
