package com.webanalytics.funnel.engine;

import com.webanalytics.funnel.model.FunnelStep;
import com.webanalytics.funnel.model.StepAnalytics;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes per-step conversion and drop-off from a reconstructed progression.
 */
@Component
public class StepAggregator {

    public List<StepAnalytics> aggregate(List<FunnelStep> steps, StepProgression progression) {
        int entered = progression.reachedCount(1);
        List<StepAnalytics> result = new ArrayList<>(steps.size());

        int previous = entered;
        for (int i = 0; i < steps.size(); i++) {
            int stepNumber = i + 1;
            int reached = progression.reachedCount(stepNumber);

            StepAnalytics.StepAnalyticsBuilder builder = StepAnalytics.builder()
                    .stepNumber(stepNumber)
                    .stepName(steps.get(i).getName())
                    .sessionsReached(reached)
                    .entryPopulation(entered);

            if (stepNumber == 1) {
                builder.sessionsAtPreviousStep(reached)
                        .conversionRate(100.0)
                        .dropoffCount(0)
                        .dropoffRate(0)
                        .avgTimeToComplete(0);
            } else {
                int dropoffs = previous - reached;
                builder.sessionsAtPreviousStep(previous)
                        .conversionRate(Rates.percentage(reached, previous))
                        .dropoffCount(dropoffs)
                        .dropoffRate(Rates.percentage(dropoffs, previous))
                        .avgTimeToComplete(progression.averageSecondsToReach(stepNumber));
            }
            result.add(builder.build());
            previous = reached;
        }
        return result;
    }
}
