package com.webanalytics.funnel.query;

import com.webanalytics.funnel.model.DateRange;
import com.webanalytics.funnel.model.FunnelStep;
import com.webanalytics.funnel.model.StepType;
import com.webanalytics.funnel.model.VisitorEvent;
import com.webanalytics.funnel.store.SqliteEventStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Builds the occurrence query for one funnel step.
 *
 * Every query returns the same four columns ({@link #OCCURRENCE_COLUMNS}) so that step
 * queries can be combined with UNION ALL: the constant step number, the session id, the
 * session's earliest qualifying event time and, when requested, the referrer of the
 * session's earliest event in the window (NULL otherwise).
 */
@Slf4j
@Component
public class StepQueryBuilder {

    public static final String OCCURRENCE_COLUMNS = "step_number, session_id, first_occurrence, referrer";

    private static final String ALIAS = "e";

    /**
     * @param step       the step to match
     * @param stepNumber 1-based ordinal of the step
     * @param websiteId  website the events belong to
     * @param range      analysis window
     * @param filters    compiled funnel filters over alias {@code e}, possibly empty
     * @param withReferrer whether to resolve each session's first-touch referrer
     */
    public SqlFragment build(
            FunnelStep step,
            int stepNumber,
            String websiteId,
            DateRange range,
            SqlFragment filters,
            boolean withReferrer
    ) {
        long start = range.startEpochMillis();
        long end = range.endEpochMillis();

        SqlFragment select = SqlFragment.of(
                "SELECT ? AS step_number, e.session_id AS session_id, "
                        + "MIN(e.event_time) AS first_occurrence, ",
                stepNumber
        );
        select = select.append(withReferrer ? firstTouchReferrer(websiteId, start, end) : SqlFragment.of("NULL"));
        select = select.append(" AS referrer FROM " + SqliteEventStore.EVENTS_TABLE + " " + ALIAS + " WHERE ");

        List<SqlFragment> where = new ArrayList<>();
        where.add(SqlFragment.of("e.website_id = ?", websiteId));
        where.add(SqlFragment.of("e.event_time >= ?", start));
        where.add(SqlFragment.of("e.event_time <= ?", end));
        where.add(matchCondition(step));
        where.add(propertyConditions(step, stepNumber));
        where.add(filters);

        SqlFragment query = select
                .append(SqlFragment.and(where))
                .append(" GROUP BY e.session_id");

        log.debug("Built occurrence query for step {} ({} '{}'): {}",
                stepNumber, step.getType(), step.getTarget(), query.sql());
        return query;
    }

    /**
     * Number of distinct sessions with at least one page view in the window: the visitor
     * population goal conversion is measured against. Funnel filters do not apply.
     */
    public SqlFragment visitorCount(String websiteId, DateRange range) {
        SqlFragment query = SqlFragment.of(
                "SELECT COUNT(DISTINCT e.session_id) AS total FROM " + SqliteEventStore.EVENTS_TABLE + " " + ALIAS
                        + " WHERE e.website_id = ? AND e.event_time >= ? AND e.event_time <= ? AND e.event_name = ?",
                websiteId, range.startEpochMillis(), range.endEpochMillis(), VisitorEvent.PAGE_VIEW_EVENT
        );
        log.debug("Built visitor count query: {}", query.sql());
        return query;
    }

    /**
     * Combine step queries into a single statement scanning the event table once.
     */
    public SqlFragment union(List<SqlFragment> stepQueries) {
        return SqlFragment.unionAll(stepQueries, OCCURRENCE_COLUMNS);
    }

    // Referrer on the session's chronologically earliest event in the window, whatever
    // that event was. Ties on time fall back to insertion order.
    private SqlFragment firstTouchReferrer(String websiteId, long start, long end) {
        return SqlFragment.of(
                "(SELECT r.referrer FROM " + SqliteEventStore.EVENTS_TABLE + " r"
                        + " WHERE r.website_id = ? AND r.session_id = e.session_id"
                        + " AND r.event_time >= ? AND r.event_time <= ?"
                        + " ORDER BY r.event_time ASC, r.id ASC LIMIT 1)",
                websiteId, start, end
        );
    }

    private SqlFragment matchCondition(FunnelStep step) {
        String target = step.getTarget();
        if (step.getType() == StepType.PAGE_VIEW) {
            // Loose match so trailing slashes and query strings still count.
            return SqlFragment.of(
                    "e.event_name = ? AND (e.path = ? OR e.path LIKE ?" + SqlLiterals.LIKE_ESCAPE_CLAUSE + ")",
                    VisitorEvent.PAGE_VIEW_EVENT,
                    target,
                    SqlLiterals.containsPattern(target)
            );
        }
        return SqlFragment.of("e.event_name = ?", target);
    }

    private SqlFragment propertyConditions(FunnelStep step, int stepNumber) {
        Map<String, Object> conditions = step.getConditions();
        if (conditions == null || conditions.isEmpty()) {
            return SqlFragment.empty();
        }
        List<SqlFragment> clauses = new ArrayList<>();
        for (Map.Entry<String, Object> entry : new TreeMap<>(conditions).entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            if (!SqlLiterals.isValidPropertyKey(key)) {
                log.warn("Skipping condition with invalid property key '{}' on step {}", key, stepNumber);
                continue;
            }
            Object bound = bindableValue(value);
            if (bound == null) {
                log.warn("Skipping condition '{}' on step {}: unsupported value {}", key, stepNumber, value);
                continue;
            }
            clauses.add(SqlFragment.of(
                    "json_extract(e.properties, ?) = ?",
                    SqlLiterals.jsonPath(key),
                    bound
            ));
        }
        return SqlFragment.and(clauses);
    }

    private static Object bindableValue(Object value) {
        if (value instanceof String) {
            return value;
        }
        if (value instanceof Boolean b) {
            // json_extract yields 1/0 for JSON booleans
            return b ? 1 : 0;
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short) {
            return ((Number) value).longValue();
        }
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        return null;
    }
}
