package com.webanalytics.funnel.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A stored funnel: an ordered list of 2 to 10 steps plus filters, scoped to one website.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FunnelDefinition {

    public static final int MIN_STEPS = 2;
    public static final int MAX_STEPS = 10;
    public static final int MAX_NAME_LENGTH = 100;

    @JsonProperty("id")
    private String id;

    @JsonProperty("website_id")
    private String websiteId;

    @JsonProperty("name")
    private String name;

    @JsonProperty("description")
    private String description;

    @Builder.Default
    @JsonProperty("steps")
    private List<FunnelStep> steps = new ArrayList<>();

    @Builder.Default
    @JsonProperty("filters")
    private List<AttributeFilter> filters = new ArrayList<>();

    @JsonProperty("is_active")
    private boolean active;

    /** When set, analytics never look at events from before the day the funnel was created. */
    @JsonProperty("ignore_historic_data")
    private boolean ignoreHistoricData;

    @JsonProperty("created_at")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss", timezone = "UTC")
    private Instant createdAt;

    @JsonProperty("updated_at")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss", timezone = "UTC")
    private Instant updatedAt;

    @JsonProperty("deleted_at")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss", timezone = "UTC")
    private Instant deletedAt;

    /**
     * Checks the structural rules every analysed or stored funnel must satisfy.
     *
     * @throws FunnelAnalyticsException with kind INVALID_DEFINITION when a rule is broken
     */
    public static void checkSteps(List<FunnelStep> steps) {
        if (steps == null || steps.size() < MIN_STEPS || steps.size() > MAX_STEPS) {
            throw new FunnelAnalyticsException(
                    ErrorKind.INVALID_DEFINITION,
                    "A funnel needs between " + MIN_STEPS + " and " + MAX_STEPS + " steps"
            );
        }
        for (int i = 0; i < steps.size(); i++) {
            checkStep(steps.get(i), i + 1);
        }
    }

    /**
     * Checks one step: it needs a type, a target and a name.
     *
     * @throws FunnelAnalyticsException with kind INVALID_DEFINITION when a rule is broken
     */
    public static void checkStep(FunnelStep step, int stepNumber) {
        if (step == null || step.getType() == null) {
            throw new FunnelAnalyticsException(
                    ErrorKind.INVALID_DEFINITION, "Step " + stepNumber + " has no type");
        }
        if (step.getTarget() == null || step.getTarget().isBlank()) {
            throw new FunnelAnalyticsException(
                    ErrorKind.INVALID_DEFINITION, "Step " + stepNumber + " has no target");
        }
        if (step.getName() == null || step.getName().isBlank()) {
            throw new FunnelAnalyticsException(
                    ErrorKind.INVALID_DEFINITION, "Step " + stepNumber + " has no name");
        }
    }
}
