package com.webanalytics.funnel.query;

import com.webanalytics.funnel.metrics.Metrics;
import com.webanalytics.funnel.model.ErrorKind;
import com.webanalytics.funnel.model.FunnelAnalyticsException;
import com.webanalytics.funnel.model.StepOccurrence;
import com.webanalytics.funnel.store.EventStore;
import com.webanalytics.funnel.store.StorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Runs a funnel's step queries against the event store.
 *
 * First tries all steps as one UNION ALL so the events table is scanned once. Any failure
 * of that combined statement is treated as recoverable: each step query is then issued on
 * its own, concurrently, and the rows merged. If one of those fails the whole fetch fails
 * with DATABASE_ERROR and the other in-flight queries are cancelled.
 */
@Slf4j
@Component
public class FunnelQueryOrchestrator {

    private final EventStore eventStore;
    private final StepQueryBuilder queryBuilder;
    private final ExecutorService executor;
    private final Metrics metrics;

    public FunnelQueryOrchestrator(
            EventStore eventStore,
            StepQueryBuilder queryBuilder,
            @Qualifier("stepQueryExecutor") ExecutorService executor,
            Metrics metrics
    ) {
        this.eventStore = eventStore;
        this.queryBuilder = queryBuilder;
        this.executor = executor;
        this.metrics = metrics;
    }

    public List<StepOccurrence> fetchOccurrences(List<SqlFragment> stepQueries) {
        if (stepQueries.isEmpty()) {
            return new ArrayList<>();
        }
        try {
            List<StepOccurrence> rows = eventStore.queryOccurrences(queryBuilder.union(stepQueries));
            metrics.onStoreQueryExecuted();
            metrics.onOccurrenceRowsFetched(rows.size());
            return rows;
        } catch (RuntimeException e) {
            log.warn("Combined query over {} steps failed, retrying each step on its own: {}",
                    stepQueries.size(), e.getMessage());
            metrics.onUnionFallback();
        }
        return fetchIndependently(stepQueries);
    }

    /**
     * Run a count query such as {@link StepQueryBuilder#visitorCount}.
     *
     * @throws FunnelAnalyticsException with kind DATABASE_ERROR if the store fails
     */
    public long count(SqlFragment countQuery) {
        try {
            long total = eventStore.queryCount(countQuery);
            metrics.onStoreQueryExecuted();
            return total;
        } catch (StorageException e) {
            log.error("Count query failed", e);
            throw new FunnelAnalyticsException(ErrorKind.DATABASE_ERROR, "Failed to count website visitors", e);
        }
    }

    List<StepOccurrence> fetchIndependently(List<SqlFragment> stepQueries) {
        CompletionService<List<StepOccurrence>> completion = new ExecutorCompletionService<>(executor);
        List<Future<List<StepOccurrence>>> futures = new ArrayList<>(stepQueries.size());
        for (SqlFragment query : stepQueries) {
            futures.add(completion.submit(() -> eventStore.queryOccurrences(query)));
        }

        List<StepOccurrence> merged = new ArrayList<>();
        try {
            for (int i = 0; i < futures.size(); i++) {
                List<StepOccurrence> rows = completion.take().get();
                metrics.onStoreQueryExecuted();
                metrics.onOccurrenceRowsFetched(rows.size());
                merged.addAll(rows);
            }
        } catch (ExecutionException e) {
            cancelAll(futures);
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Step query failed after combined query fallback", cause);
            throw new FunnelAnalyticsException(
                    ErrorKind.DATABASE_ERROR, "Failed to fetch funnel analytics", cause);
        } catch (InterruptedException e) {
            cancelAll(futures);
            Thread.currentThread().interrupt();
            throw new FunnelAnalyticsException(
                    ErrorKind.CANCELLED, "Funnel analytics request was cancelled", e);
        }
        return merged;
    }

    private static void cancelAll(List<? extends Future<?>> futures) {
        futures.forEach(f -> f.cancel(true));
    }
}
