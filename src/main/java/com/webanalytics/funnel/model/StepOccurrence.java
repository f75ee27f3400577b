package com.webanalytics.funnel.model;

import java.time.Instant;

/**
 * One row of a step occurrence query: the earliest time a session satisfied a step
 * inside the analysis window.
 *
 * @param referrer first-touch referrer of the session, or null when the query did not
 *                 ask for it or the session has none
 */
public record StepOccurrence(
        int stepNumber,
        String sessionId,
        Instant firstOccurrence,
        String referrer
) {

    public static StepOccurrence of(int stepNumber, String sessionId, Instant firstOccurrence) {
        return new StepOccurrence(stepNumber, sessionId, firstOccurrence, null);
    }

    public boolean hasReferrer() {
        return referrer != null && !referrer.isBlank();
    }
}
