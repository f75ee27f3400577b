package com.webanalytics.funnel.engine;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Steps one session was credited with, in funnel order, with the time each was reached.
 */
public class SessionProgress {

    private final String sessionId;
    private final List<Instant> creditedAt = new ArrayList<>();

    public SessionProgress(String sessionId) {
        this.sessionId = sessionId;
    }

    void credit(Instant at) {
        creditedAt.add(at);
    }

    public String getSessionId() {
        return sessionId;
    }

    /**
     * @return highest step reached in order, 0 if the session never reached step 1
     */
    public int highestStep() {
        return creditedAt.size();
    }

    public boolean reached(int stepNumber) {
        return stepNumber >= 1 && stepNumber <= creditedAt.size();
    }

    /**
     * @return time the step was credited, or null if it was not reached
     */
    public Instant reachedAt(int stepNumber) {
        return reached(stepNumber) ? creditedAt.get(stepNumber - 1) : null;
    }
}
