package com.webanalytics.funnel.engine;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Outcome of replaying a set of sessions through a funnel: which sessions reached each step.
 */
public class StepProgression {

    /** Gaps of a day or more between two steps are not counted as time to convert. */
    static final Duration MAX_STEP_GAP = Duration.ofDays(1);

    private final List<SessionProgress> sessions;

    StepProgression(List<SessionProgress> sessions) {
        this.sessions = sessions;
    }

    /**
     * Sessions credited with at least {@code stepNumber}.
     */
    public Set<String> reached(int stepNumber) {
        return sessions.stream()
                .filter(s -> s.reached(stepNumber))
                .map(SessionProgress::getSessionId)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public int reachedCount(int stepNumber) {
        return (int) sessions.stream().filter(s -> s.reached(stepNumber)).count();
    }

    /**
     * Mean seconds between reaching step {@code stepNumber - 1} and step {@code stepNumber},
     * over sessions whose gap is positive and shorter than a day. 0 when there are none.
     */
    public double averageSecondsToReach(int stepNumber) {
        if (stepNumber <= 1) {
            return 0;
        }
        long totalMillis = 0;
        int counted = 0;
        for (SessionProgress session : sessions) {
            Instant previous = session.reachedAt(stepNumber - 1);
            Instant current = session.reachedAt(stepNumber);
            if (previous == null || current == null) {
                continue;
            }
            Duration gap = Duration.between(previous, current);
            if (gap.isNegative() || gap.isZero() || gap.compareTo(MAX_STEP_GAP) >= 0) {
                continue;
            }
            totalMillis += gap.toMillis();
            counted++;
        }
        if (counted == 0) {
            return 0;
        }
        return Rates.round2(totalMillis / 1000.0 / counted);
    }
}
