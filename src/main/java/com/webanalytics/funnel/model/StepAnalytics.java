package com.webanalytics.funnel.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Conversion statistics for one funnel step. Rates are percentages rounded to 2 decimals.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StepAnalytics {

    @JsonProperty("step_number")
    private int stepNumber;

    @JsonProperty("step_name")
    private String stepName;

    /** Sessions that reached this step in order. */
    @JsonProperty("users")
    private int sessionsReached;

    /** Sessions that reached the previous step; for step 1 its own population. */
    @JsonProperty("previous_step_users")
    private int sessionsAtPreviousStep;

    /** The funnel's entry population (sessions that reached step 1). */
    @JsonProperty("total_users")
    private int entryPopulation;

    @JsonProperty("conversion_rate")
    private double conversionRate;

    @JsonProperty("dropoffs")
    private int dropoffCount;

    @JsonProperty("dropoff_rate")
    private double dropoffRate;

    /** Mean seconds from the previous step to this one. */
    @JsonProperty("avg_time_to_complete")
    private double avgTimeToComplete;
}
