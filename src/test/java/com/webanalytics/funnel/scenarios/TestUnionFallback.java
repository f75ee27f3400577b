package com.webanalytics.funnel.scenarios;

import com.webanalytics.funnel.engine.FunnelAnalyticsEngine;
import com.webanalytics.funnel.metrics.MetricsRegistry;
import com.webanalytics.funnel.model.DateRange;
import com.webanalytics.funnel.model.FunnelAnalytics;
import com.webanalytics.funnel.model.ReferrerAnalytics;
import com.webanalytics.funnel.model.StepOccurrence;
import com.webanalytics.funnel.model.VisitorEvent;
import com.webanalytics.funnel.query.SqlFragment;
import com.webanalytics.funnel.store.EventStore;
import com.webanalytics.funnel.store.InMemoryFunnelDefinitionStore;
import com.webanalytics.funnel.store.InMemoryWebsiteStore;
import com.webanalytics.funnel.store.SqliteEventStore;
import com.webanalytics.funnel.store.StorageException;
import com.webanalytics.funnel.store.StubEventStore;
import com.webanalytics.funnel.testutil.TestFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.ExecutorService;

import static com.webanalytics.funnel.testutil.TestFactory.BASE;
import static com.webanalytics.funnel.testutil.TestFactory.WEBSITE;
import static com.webanalytics.funnel.testutil.TestFactory.definition;
import static com.webanalytics.funnel.testutil.TestFactory.event;
import static com.webanalytics.funnel.testutil.TestFactory.pageView;
import static com.webanalytics.funnel.testutil.TestFactory.pricingFunnel;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * When the combined query is rejected, per-step queries must give the same answer.
 */
public class TestUnionFallback {

    private static final DateRange RANGE = new DateRange(LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 1));

    @TempDir
    Path dir;

    private SqliteEventStore store;
    private ExecutorService executor;
    private final InMemoryFunnelDefinitionStore definitions = new InMemoryFunnelDefinitionStore();
    private final InMemoryWebsiteStore websites = new InMemoryWebsiteStore();

    /**
     * Delegates to SQLite but refuses compound statements.
     */
    private static final class NoUnionEventStore implements EventStore {
        private final EventStore delegate;

        private NoUnionEventStore(EventStore delegate) {
            this.delegate = delegate;
        }

        @Override
        public boolean append(VisitorEvent event) {
            return delegate.append(event);
        }

        @Override
        public List<StepOccurrence> queryOccurrences(SqlFragment query) {
            if (StubEventStore.isUnion(query)) {
                throw new StorageException("too many terms in compound SELECT", null);
            }
            return delegate.queryOccurrences(query);
        }

        @Override
        public long queryCount(SqlFragment query) {
            return delegate.queryCount(query);
        }
    }

    @BeforeEach
    void setUp() throws Exception {
        store = TestFactory.sqliteEventStore(dir);
        executor = TestFactory.executor();
        definitions.put("pricing", definition(pricingFunnel()));

        for (int i = 0; i < 30; i++) {
            String session = "s" + i;
            store.append(pageView(session, "/pricing", BASE.plusSeconds(i), i % 2 == 0 ? "https://bing.com/" : null));
            if (i % 3 == 0) {
                store.append(event(session, "signup_clicked", BASE.plusSeconds(100 + i)));
            }
            if (i % 6 == 0) {
                store.append(event(session, "purchase_completed", BASE.plusSeconds(200 + i)));
            }
        }
    }

    @AfterEach
    void tearDown() {
        store.close();
        executor.shutdownNow();
    }

    @Test
    public void testFallbackMatchesCombinedQuery() {
        FunnelAnalyticsEngine combined = TestFactory.createEngine(store, definitions, websites, executor);
        MetricsRegistry metrics = new MetricsRegistry();
        FunnelAnalyticsEngine fallback = TestFactory.createEngine(
                new NoUnionEventStore(store), definitions, websites, executor, metrics);

        FunnelAnalytics expected = combined.analyze(WEBSITE, "pricing", RANGE);
        FunnelAnalytics actual = fallback.analyze(WEBSITE, "pricing", RANGE);

        assertThat(expected.getTotalEntered()).isEqualTo(30);
        assertThat(expected.getTotalCompleted()).isEqualTo(5);
        assertThat(actual).isEqualTo(expected);
        assertThat(metrics.snapshot().unionFallbacks()).isEqualTo(1);
        assertThat(metrics.snapshot().storeQueries()).isEqualTo(3);
    }

    @Test
    public void testReferrerFallbackMatchesCombinedQuery() {
        FunnelAnalyticsEngine combined = TestFactory.createEngine(store, definitions, websites, executor);
        FunnelAnalyticsEngine fallback = TestFactory.createEngine(
                new NoUnionEventStore(store), definitions, websites, executor);

        ReferrerAnalytics expected = combined.analyzeByReferrer(WEBSITE, "pricing", RANGE);
        ReferrerAnalytics actual = fallback.analyzeByReferrer(WEBSITE, "pricing", RANGE);

        assertThat(expected.slices()).hasSize(2);
        assertThat(actual).isEqualTo(expected);
    }
}
