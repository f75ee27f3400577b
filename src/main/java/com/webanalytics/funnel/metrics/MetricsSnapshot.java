package com.webanalytics.funnel.metrics;

import java.time.Instant;

/**
 * Immutable snapshot of metrics exposed to the dashboard.
 *
 * This is a READ MODEL:
 * - No logic
 * - Nulls indicate "not yet initialized"
 */
public record MetricsSnapshot(

        /* -------- Analytics requests -------- */
        long analyticsRequests,
        long analyticsCompleted,
        long analyticsFailed,
        long lastAnalyticsDurationMillis,

        /* -------- Event store -------- */
        long storeQueries,
        long unionFallbacks,
        long occurrenceRowsFetched,

        /* -------- Ingest -------- */
        long eventsIngested,
        long eventsRejected,

        /* -------- Health -------- */
        Instant lastUpdatedAt
) {}
