package com.webanalytics.funnel.controller;

import com.webanalytics.funnel.engine.FunnelAnalyticsEngine;
import com.webanalytics.funnel.model.ApiResponse;
import com.webanalytics.funnel.model.DateRange;
import com.webanalytics.funnel.model.ErrorKind;
import com.webanalytics.funnel.model.FunnelAnalytics;
import com.webanalytics.funnel.model.FunnelAnalyticsException;
import com.webanalytics.funnel.model.GoalDefinition;
import com.webanalytics.funnel.model.ReferrerAnalytics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;

/**
 * Funnel and goal analytics endpoints.
 *
 * Dates are ISO days (UTC). A missing end date means today, a missing start date means
 * the configured default window before the end date.
 */
@Slf4j
@RestController
public class FunnelAnalyticsController {

    private final FunnelAnalyticsEngine engine;
    private final int defaultWindowDays;
    private final Clock clock;

    public FunnelAnalyticsController(
            FunnelAnalyticsEngine engine,
            @Value("${funnel.analytics.default-window-days:30}") int defaultWindowDays
    ) {
        this(engine, defaultWindowDays, Clock.systemUTC());
    }

    FunnelAnalyticsController(FunnelAnalyticsEngine engine, int defaultWindowDays, Clock clock) {
        this.engine = engine;
        this.defaultWindowDays = defaultWindowDays;
        this.clock = clock;
    }

    @GetMapping("/funnels/{funnelId}/analytics")
    public ApiResponse<FunnelAnalytics> analytics(
            @PathVariable String funnelId,
            @RequestParam("website_id") String websiteId,
            @RequestParam(value = "start_date", required = false) String startDate,
            @RequestParam(value = "end_date", required = false) String endDate
    ) {
        DateRange range = resolveRange(startDate, endDate);
        log.debug("Analytics requested for funnel {} of website {} over {}", funnelId, websiteId, range);
        return ApiResponse.ok(engine.analyze(websiteId, funnelId, range), range);
    }

    @GetMapping("/funnels/{funnelId}/analytics/referrer")
    public ApiResponse<ReferrerAnalytics> referrerAnalytics(
            @PathVariable String funnelId,
            @RequestParam("website_id") String websiteId,
            @RequestParam(value = "start_date", required = false) String startDate,
            @RequestParam(value = "end_date", required = false) String endDate
    ) {
        DateRange range = resolveRange(startDate, endDate);
        log.debug("Referrer analytics requested for funnel {} of website {} over {}", funnelId, websiteId, range);
        return ApiResponse.ok(engine.analyzeByReferrer(websiteId, funnelId, range), range);
    }

    @PostMapping("/goals/analytics")
    public ApiResponse<FunnelAnalytics> goalAnalytics(
            @RequestParam("website_id") String websiteId,
            @RequestParam(value = "start_date", required = false) String startDate,
            @RequestParam(value = "end_date", required = false) String endDate,
            @RequestBody GoalDefinition goal
    ) {
        DateRange range = resolveRange(startDate, endDate);
        log.debug("Goal analytics requested for '{}' of website {} over {}", goal.getName(), websiteId, range);
        return ApiResponse.ok(engine.analyzeGoal(websiteId, goal, range), range);
    }

    DateRange resolveRange(String startDate, String endDate) {
        LocalDate end = endDate == null || endDate.isBlank()
                ? LocalDate.now(clock)
                : parseDate("end_date", endDate);
        LocalDate start = startDate == null || startDate.isBlank()
                ? end.minusDays(defaultWindowDays)
                : parseDate("start_date", startDate);
        return new DateRange(start, end);
    }

    private static LocalDate parseDate(String parameter, String value) {
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            throw new FunnelAnalyticsException(
                    ErrorKind.INVALID_DATE_RANGE, parameter + " must be yyyy-MM-dd: " + value, e);
        }
    }
}
