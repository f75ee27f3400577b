package com.webanalytics.funnel.engine;

import com.webanalytics.funnel.metrics.Metrics;
import com.webanalytics.funnel.model.DateRange;
import com.webanalytics.funnel.model.ErrorKind;
import com.webanalytics.funnel.model.FunnelAnalytics;
import com.webanalytics.funnel.model.FunnelAnalyticsException;
import com.webanalytics.funnel.model.FunnelDefinition;
import com.webanalytics.funnel.model.FunnelStep;
import com.webanalytics.funnel.model.GoalDefinition;
import com.webanalytics.funnel.model.ReferrerAnalytics;
import com.webanalytics.funnel.model.ReferrerFunnelSlice;
import com.webanalytics.funnel.model.StepAnalytics;
import com.webanalytics.funnel.model.StepOccurrence;
import com.webanalytics.funnel.model.Website;
import com.webanalytics.funnel.query.FilterCompiler;
import com.webanalytics.funnel.query.FunnelQueryOrchestrator;
import com.webanalytics.funnel.query.SqlFragment;
import com.webanalytics.funnel.query.StepQueryBuilder;
import com.webanalytics.funnel.store.FunnelDefinitionStore;
import com.webanalytics.funnel.store.StorageException;
import com.webanalytics.funnel.store.WebsiteStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Core funnel analysis pipeline.
 *
 * definition -> compiled filters -> one query per step -> occurrence rows
 * -> per-session ordered replay -> per-step aggregates -> summary (or referrer slices).
 * Goals run the same path with a single step and the site's visitor count as denominator.
 *
 * Stateless per call; nothing is cached between requests.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FunnelAnalyticsEngine {

    private static final String EVENT_ALIAS = "e";

    private final FunnelDefinitionStore definitionStore;
    private final WebsiteStore websiteStore;
    private final FilterCompiler filterCompiler;
    private final StepQueryBuilder queryBuilder;
    private final FunnelQueryOrchestrator orchestrator;
    private final SessionProgressionReconstructor reconstructor;
    private final StepAggregator aggregator;
    private final FunnelSummaryComposer summaryComposer;
    private final ReferrerSegmenter referrerSegmenter;
    private final Metrics metrics;

    /**
     * Step-by-step analytics of one funnel over a window.
     *
     * @throws FunnelAnalyticsException if the funnel is unknown, invalid, or the store fails
     */
    public FunnelAnalytics analyze(String websiteId, String funnelId, DateRange range) {
        return measured(funnelId, () -> {
            FunnelDefinition definition = loadDefinition(websiteId, funnelId);
            List<FunnelStep> steps = definition.getSteps();

            List<StepOccurrence> rows = effectiveRange(definition, range)
                    .map(window -> orchestrator.fetchOccurrences(
                            buildStepQueries(definition, websiteId, window, false)))
                    .orElseGet(List::of);
            StepProgression progression = reconstructor.reconstruct(rows, steps.size());
            List<StepAnalytics> stepAnalytics = aggregator.aggregate(steps, progression);
            FunnelAnalytics analytics = summaryComposer.compose(stepAnalytics);

            log.info("Funnel {} analysed for {}..{}: {} rows, {} entered, {} completed",
                    funnelId, range.startDate(), range.endDate(), rows.size(),
                    analytics.getTotalEntered(), analytics.getTotalCompleted());
            return analytics;
        });
    }

    /**
     * Funnel analytics split by each session's first-touch traffic source.
     *
     * @throws FunnelAnalyticsException if the funnel is unknown, invalid, or the store fails
     */
    public ReferrerAnalytics analyzeByReferrer(String websiteId, String funnelId, DateRange range) {
        return measured(funnelId, () -> {
            FunnelDefinition definition = loadDefinition(websiteId, funnelId);
            String siteDomain = websiteStore.findById(websiteId).map(Website::domain).orElse(null);
            if (siteDomain == null) {
                log.debug("Website {} has no registered domain, self-referrals are not folded", websiteId);
            }

            List<StepOccurrence> rows = effectiveRange(definition, range)
                    .map(window -> orchestrator.fetchOccurrences(
                            buildStepQueries(definition, websiteId, window, true)))
                    .orElseGet(List::of);
            List<ReferrerFunnelSlice> slices = referrerSegmenter.segment(rows, definition.getSteps(), siteDomain);

            log.info("Funnel {} segmented by referrer for {}..{}: {} rows, {} sources",
                    funnelId, range.startDate(), range.endDate(), rows.size(), slices.size());
            return new ReferrerAnalytics(slices);
        });
    }

    /**
     * Conversion of a single goal, measured against all sessions that viewed a page of the
     * website in the window.
     *
     * @throws FunnelAnalyticsException if the goal is invalid or the store fails
     */
    public FunnelAnalytics analyzeGoal(String websiteId, GoalDefinition goal, DateRange range) {
        String subject = "goal " + goal.getName();
        return measured(subject, () -> {
            FunnelStep step = goal.toStep();
            FunnelDefinition.checkStep(step, 1);

            SqlFragment filters = filterCompiler.compile(goal.getFilters(), EVENT_ALIAS);
            List<StepOccurrence> rows = orchestrator.fetchOccurrences(
                    List.of(queryBuilder.build(step, 1, websiteId, range, filters, false)));
            int completions = reconstructor.reconstruct(rows, 1).reachedCount(1);
            int visitors = Math.toIntExact(orchestrator.count(queryBuilder.visitorCount(websiteId, range)));
            FunnelAnalytics analytics = summaryComposer.composeGoal(step.getName(), completions, visitors);

            log.info("Goal '{}' analysed for {}..{}: {} completions out of {} visitors",
                    goal.getName(), range.startDate(), range.endDate(), completions, visitors);
            return analytics;
        });
    }

    /**
     * The window actually analysed. Funnels that ignore historic data start no earlier than
     * the UTC day they were created; empty when that day is after the requested end.
     */
    static Optional<DateRange> effectiveRange(FunnelDefinition definition, DateRange requested) {
        if (!definition.isIgnoreHistoricData() || definition.getCreatedAt() == null) {
            return Optional.of(requested);
        }
        LocalDate createdDay = LocalDate.ofInstant(definition.getCreatedAt(), ZoneOffset.UTC);
        if (!createdDay.isAfter(requested.startDate())) {
            return Optional.of(requested);
        }
        if (createdDay.isAfter(requested.endDate())) {
            log.debug("Funnel {} was created on {}, after the requested window", definition.getId(), createdDay);
            return Optional.empty();
        }
        return Optional.of(new DateRange(createdDay, requested.endDate()));
    }

    List<SqlFragment> buildStepQueries(
            FunnelDefinition definition,
            String websiteId,
            DateRange range,
            boolean withReferrer
    ) {
        SqlFragment filters = filterCompiler.compile(definition.getFilters(), EVENT_ALIAS);
        List<FunnelStep> steps = definition.getSteps();
        List<SqlFragment> queries = new ArrayList<>(steps.size());
        for (int i = 0; i < steps.size(); i++) {
            queries.add(queryBuilder.build(steps.get(i), i + 1, websiteId, range, filters, withReferrer));
        }
        return queries;
    }

    private FunnelDefinition loadDefinition(String websiteId, String funnelId) {
        FunnelDefinition definition;
        try {
            definition = definitionStore.findActive(websiteId, funnelId)
                    .orElseThrow(() -> new FunnelAnalyticsException(
                            ErrorKind.FUNNEL_NOT_FOUND, "Funnel not found"));
        } catch (StorageException e) {
            throw new FunnelAnalyticsException(ErrorKind.DATABASE_ERROR, "Failed to load funnel", e);
        }
        FunnelDefinition.checkSteps(definition.getSteps());
        return definition;
    }

    private <T> T measured(String subject, Supplier<T> analysis) {
        metrics.onAnalyticsRequested();
        long started = System.currentTimeMillis();
        try {
            T result = analysis.get();
            metrics.onAnalyticsCompleted(System.currentTimeMillis() - started);
            return result;
        } catch (FunnelAnalyticsException e) {
            metrics.onAnalyticsFailed();
            if (e.getKind().status().is4xxClientError()) {
                log.warn("Funnel analytics rejected for {}: {}", subject, e.getMessage());
            } else {
                log.error("Funnel analytics failed for {}: {}", subject, e.getMessage());
            }
            throw e;
        } catch (RuntimeException e) {
            metrics.onAnalyticsFailed();
            log.error("Funnel analytics failed for {}: {}", subject, e.getMessage());
            throw e;
        }
    }
}
