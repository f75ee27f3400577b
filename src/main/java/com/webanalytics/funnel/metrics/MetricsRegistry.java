package com.webanalytics.funnel.metrics;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

@Component
public class MetricsRegistry implements Metrics {

    private final AtomicLong analyticsRequests = new AtomicLong();
    private final AtomicLong analyticsCompleted = new AtomicLong();
    private final AtomicLong analyticsFailed = new AtomicLong();
    private final AtomicLong lastAnalyticsDurationMillis = new AtomicLong();

    private final AtomicLong storeQueries = new AtomicLong();
    private final AtomicLong unionFallbacks = new AtomicLong();
    private final AtomicLong occurrenceRowsFetched = new AtomicLong();

    private final AtomicLong eventsIngested = new AtomicLong();
    private final AtomicLong eventsRejected = new AtomicLong();

    private final AtomicReference<Instant> lastUpdatedAt =
            new AtomicReference<>(Instant.now());


    @Override
    public void onAnalyticsRequested() {
        analyticsRequests.incrementAndGet();
        touch();
    }

    @Override
    public void onAnalyticsCompleted(long durationMillis) {
        analyticsCompleted.incrementAndGet();
        lastAnalyticsDurationMillis.set(durationMillis);
        touch();
    }

    @Override
    public void onAnalyticsFailed() {
        analyticsFailed.incrementAndGet();
        touch();
    }

    @Override
    public void onStoreQueryExecuted() {
        storeQueries.incrementAndGet();
        touch();
    }

    @Override
    public void onUnionFallback() {
        unionFallbacks.incrementAndGet();
        touch();
    }

    @Override
    public void onOccurrenceRowsFetched(long rows) {
        if (rows <= 0) {
            return;
        }
        occurrenceRowsFetched.addAndGet(rows);
        touch();
    }

    @Override
    public void onEventIngested() {
        eventsIngested.incrementAndGet();
        touch();
    }

    @Override
    public void onEventRejected() {
        eventsRejected.incrementAndGet();
        touch();
    }

    /* ---------- Snapshot ---------- */

    @Override
    public MetricsSnapshot snapshot() {
        return new MetricsSnapshot(
                analyticsRequests.get(),
                analyticsCompleted.get(),
                analyticsFailed.get(),
                lastAnalyticsDurationMillis.get(),
                storeQueries.get(),
                unionFallbacks.get(),
                occurrenceRowsFetched.get(),
                eventsIngested.get(),
                eventsRejected.get(),
                lastUpdatedAt.get()
        );
    }

    private void touch() {
        lastUpdatedAt.set(Instant.now());
    }
}
