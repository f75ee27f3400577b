package com.webanalytics.funnel.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Website(
        @JsonProperty("id") String id,
        @JsonProperty("domain") String domain
) {}
