package com.webanalytics.funnel.store;

import com.webanalytics.funnel.model.StepOccurrence;
import com.webanalytics.funnel.model.VisitorEvent;
import com.webanalytics.funnel.query.SqlFragment;

import java.util.List;

/**
 * Append-only, time-indexed table of visitor events.
 */
public interface EventStore {

    /**
     * Append an event. Re-appending an event with a known event id is a no-op.
     *
     * @return true if the event was stored, false if it was a duplicate
     * @throws StorageException if the write fails
     */
    boolean append(VisitorEvent event);

    /**
     * Run an occurrence query built by {@link com.webanalytics.funnel.query.StepQueryBuilder}.
     *
     * @throws StorageException if the query fails or times out
     */
    List<StepOccurrence> queryOccurrences(SqlFragment query);

    /**
     * Run a query whose first column of its first row is a count, such as
     * {@link com.webanalytics.funnel.query.StepQueryBuilder#visitorCount}.
     *
     * @return the count, 0 when the query yields no row
     * @throws StorageException if the query fails or times out
     */
    long queryCount(SqlFragment query);
}
