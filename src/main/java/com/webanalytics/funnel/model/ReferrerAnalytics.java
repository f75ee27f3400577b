package com.webanalytics.funnel.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ReferrerAnalytics(
        @JsonProperty("referrer_analytics") List<ReferrerFunnelSlice> slices
) {}
