package com.webanalytics.funnel.scenarios;

import com.webanalytics.funnel.consumer.VisitorEventConsumer;
import com.webanalytics.funnel.engine.FunnelAnalyticsEngine;
import com.webanalytics.funnel.metrics.NoOpMetrics;
import com.webanalytics.funnel.model.DateRange;
import com.webanalytics.funnel.model.FunnelAnalytics;
import com.webanalytics.funnel.model.ReferrerAnalytics;
import com.webanalytics.funnel.store.InMemoryFunnelDefinitionStore;
import com.webanalytics.funnel.store.InMemoryWebsiteStore;
import com.webanalytics.funnel.store.SqliteEventStore;
import com.webanalytics.funnel.testutil.TestFactory;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.kafka.support.Acknowledgment;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;

import static com.webanalytics.funnel.testutil.TestFactory.WEBSITE;
import static com.webanalytics.funnel.testutil.TestFactory.definition;
import static com.webanalytics.funnel.testutil.TestFactory.pricingFunnel;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

/**
 * Redelivered events and repeated requests over the same data give identical results.
 */
public class TestIdempotentRerun {

    private static final DateRange RANGE = new DateRange(LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 2));

    @TempDir
    Path dir;

    private SqliteEventStore store;
    private ExecutorService executor;
    private FunnelAnalyticsEngine engine;
    private VisitorEventConsumer consumer;

    @BeforeEach
    void setUp() throws Exception {
        store = TestFactory.sqliteEventStore(dir);
        executor = TestFactory.executor();
        InMemoryFunnelDefinitionStore definitions = new InMemoryFunnelDefinitionStore();
        definitions.put("pricing", definition(pricingFunnel()));
        engine = TestFactory.createEngine(store, definitions, new InMemoryWebsiteStore(), executor);
        consumer = new VisitorEventConsumer(store, TestFactory.objectMapper(), new NoOpMetrics());
    }

    @AfterEach
    void tearDown() {
        store.close();
        executor.shutdownNow();
    }

    private static List<String> events() {
        List<String> events = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            events.add(json("pv_" + i, "s" + i, "screen_view", "/pricing", "2024-03-01T09:00:0" + i,
                    i % 2 == 0 ? "https://duckduckgo.com/" : ""));
            if (i < 6) {
                // same second as the page view for half of them
                String time = i % 2 == 0 ? "2024-03-01T09:00:0" + i : "2024-03-01T09:05:00";
                events.add(json("su_" + i, "s" + i, "signup_clicked", "/pricing", time, ""));
            }
            if (i < 3) {
                events.add(json("pc_" + i, "s" + i, "purchase_completed", "/checkout", "2024-03-01T09:10:00", ""));
            }
        }
        return events;
    }

    private static String json(String id, String session, String name, String path, String time, String referrer) {
        return """
                {"event_id":"%s","website_id":"%s","session_id":"%s","event_name":"%s",
                 "path":"%s","event_time":"%s","referrer":"%s"}
                """.formatted(id, WEBSITE, session, name, path, time, referrer);
    }

    private void deliver(List<String> values) {
        Acknowledgment ack = mock(Acknowledgment.class);
        long offset = 0;
        for (String value : values) {
            consumer.consume(new ConsumerRecord<>("analytics_events", 0, offset++, null, value), ack);
        }
    }

    @Test
    public void testRedeliveryDoesNotChangeResults() {
        deliver(events());
        FunnelAnalytics first = engine.analyze(WEBSITE, "pricing", RANGE);

        // consumer restarts from an older offset
        deliver(events());
        FunnelAnalytics second = engine.analyze(WEBSITE, "pricing", RANGE);

        assertThat(first.getTotalEntered()).isEqualTo(10);
        assertThat(first.getSteps().get(1).getSessionsReached()).isEqualTo(6);
        assertThat(first.getTotalCompleted()).isEqualTo(3);
        assertThat(second).isEqualTo(first);
        assertThat(store.getWriteCount()).isEqualTo(19);
    }

    @Test
    public void testRepeatedRequestsAreStable() {
        deliver(events());

        ReferrerAnalytics first = engine.analyzeByReferrer(WEBSITE, "pricing", RANGE);
        for (int i = 0; i < 5; i++) {
            assertThat(engine.analyzeByReferrer(WEBSITE, "pricing", RANGE)).isEqualTo(first);
            assertThat(engine.analyze(WEBSITE, "pricing", RANGE)).isEqualTo(engine.analyze(WEBSITE, "pricing", RANGE));
        }
        assertThat(first.slices()).hasSize(2);
    }
}
