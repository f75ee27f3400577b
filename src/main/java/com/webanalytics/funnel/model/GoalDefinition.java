package com.webanalytics.funnel.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * A single-step conversion target. Its conversion rate is measured against every visitor
 * of the website rather than against an entry step.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GoalDefinition {

    @JsonProperty("name")
    private String name;

    @JsonProperty("type")
    private StepType type;

    /** Page path for PAGE_VIEW goals, event name otherwise. */
    @JsonProperty("target")
    private String target;

    @JsonProperty("conditions")
    private Map<String, Object> conditions;

    @Builder.Default
    @JsonProperty("filters")
    private List<AttributeFilter> filters = new ArrayList<>();

    public FunnelStep toStep() {
        return FunnelStep.builder()
                .type(type)
                .target(target)
                .name(name)
                .conditions(conditions)
                .build();
    }
}
