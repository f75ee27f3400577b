package com.webanalytics.funnel.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * One step of a funnel definition. The step's position in the definition's step list
 * (1-based) is its ordinal and defines the required order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FunnelStep {

    @JsonProperty("type")
    private StepType type;

    /** Page path for PAGE_VIEW steps, event name otherwise. */
    @JsonProperty("target")
    private String target;

    @JsonProperty("name")
    private String name;

    /** Extra property conditions, matched against the event's JSON properties. */
    @JsonProperty("conditions")
    private Map<String, Object> conditions;
}
