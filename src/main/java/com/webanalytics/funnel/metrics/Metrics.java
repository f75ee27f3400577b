package com.webanalytics.funnel.metrics;

/**
 * Lightweight metrics API used by the analytics engine and the ingest consumer,
 * exposed via /metrics.
 */
public interface Metrics {

    void onAnalyticsRequested();

    void onAnalyticsCompleted(long durationMillis);

    void onAnalyticsFailed();

    void onStoreQueryExecuted();

    void onUnionFallback();

    void onOccurrenceRowsFetched(long rows);

    void onEventIngested();

    void onEventRejected();

    MetricsSnapshot snapshot();
}
