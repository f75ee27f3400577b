package com.webanalytics.funnel.engine;

import com.webanalytics.funnel.model.FunnelAnalytics;
import com.webanalytics.funnel.model.StepAnalytics;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Assembles the overall funnel figures from per-step analytics.
 */
@Component
public class FunnelSummaryComposer {

    public FunnelAnalytics compose(List<StepAnalytics> steps) {
        if (steps.isEmpty()) {
            throw new IllegalArgumentException("A funnel summary needs at least one step");
        }
        StepAnalytics first = steps.get(0);
        StepAnalytics last = steps.get(steps.size() - 1);
        StepAnalytics biggestDropoff = biggestDropoff(steps);
        double avgCompletion = averageCompletionSeconds(steps);

        return FunnelAnalytics.builder()
                .overallConversionRate(Rates.percentage(last.getSessionsReached(), first.getSessionsReached()))
                .totalEntered(first.getSessionsReached())
                .totalCompleted(last.getSessionsReached())
                .avgCompletionTime(avgCompletion)
                .avgCompletionTimeFormatted(formatDuration(avgCompletion))
                .biggestDropoffStep(biggestDropoff.getStepNumber())
                .biggestDropoffRate(biggestDropoff.getDropoffRate())
                .steps(steps)
                .build();
    }

    /**
     * Result of a single-step goal. Completions are measured against the website's visitor
     * population, which also stands in as the entered total.
     */
    public FunnelAnalytics composeGoal(String goalName, int completions, int visitors) {
        double conversionRate = Rates.percentage(completions, visitors);
        StepAnalytics step = StepAnalytics.builder()
                .stepNumber(1)
                .stepName(goalName)
                .sessionsReached(completions)
                .sessionsAtPreviousStep(visitors)
                .entryPopulation(visitors)
                .conversionRate(conversionRate)
                .build();
        return FunnelAnalytics.builder()
                .overallConversionRate(conversionRate)
                .totalEntered(visitors)
                .totalCompleted(completions)
                .avgCompletionTimeFormatted(formatDuration(0))
                .biggestDropoffStep(1)
                .steps(List.of(step))
                .build();
    }

    /**
     * Step (other than step 1) with the highest drop-off rate. Starts from step 2 and only
     * a strictly higher rate replaces the current pick, so ties keep the earlier step.
     */
    static StepAnalytics biggestDropoff(List<StepAnalytics> steps) {
        StepAnalytics max = steps.size() > 1 ? steps.get(1) : steps.get(0);
        for (int i = 2; i < steps.size(); i++) {
            if (steps.get(i).getDropoffRate() > max.getDropoffRate()) {
                max = steps.get(i);
            }
        }
        return max;
    }

    static double averageCompletionSeconds(List<StepAnalytics> steps) {
        double[] times = steps.stream()
                .mapToDouble(StepAnalytics::getAvgTimeToComplete)
                .filter(t -> t > 0)
                .toArray();
        if (times.length == 0) {
            return 0;
        }
        double sum = 0;
        for (double t : times) {
            sum += t;
        }
        return Rates.round2(sum / times.length);
    }

    static String formatDuration(double seconds) {
        if (seconds < 60) {
            return Math.round(seconds) + "s";
        }
        if (seconds < 3600) {
            return Math.round(seconds / 60) + "m";
        }
        return Math.round(seconds / 3600) + "h";
    }
}
