package com.webanalytics.funnel.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Funnel result restricted to the sessions attributed to one traffic source.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReferrerFunnelSlice {

    @JsonProperty("referrer")
    private String referrer;

    @JsonProperty("referrer_parsed")
    private ReferrerIdentity referrerParsed;

    /** A raw referrer URL seen for this group; empty for Direct. */
    @JsonProperty("referrer_url")
    private String referrerUrl;

    @JsonProperty("total_users")
    private int enteringSessions;

    @JsonProperty("completed_users")
    private int completingSessions;

    @JsonProperty("conversion_rate")
    private double conversionRate;

    @JsonProperty("steps_analytics")
    private List<StepAnalytics> steps;
}
