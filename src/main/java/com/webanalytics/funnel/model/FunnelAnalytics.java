package com.webanalytics.funnel.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Step-by-step funnel result plus the overall figures derived from it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FunnelAnalytics {

    @JsonProperty("overall_conversion_rate")
    private double overallConversionRate;

    @JsonProperty("total_users_entered")
    private int totalEntered;

    @JsonProperty("total_users_completed")
    private int totalCompleted;

    @JsonProperty("avg_completion_time")
    private double avgCompletionTime;

    @JsonProperty("avg_completion_time_formatted")
    private String avgCompletionTimeFormatted;

    @JsonProperty("biggest_dropoff_step")
    private int biggestDropoffStep;

    @JsonProperty("biggest_dropoff_rate")
    private double biggestDropoffRate;

    @JsonProperty("steps_analytics")
    private List<StepAnalytics> steps;
}
