package com.webanalytics.funnel.engine;

import com.webanalytics.funnel.model.StepOccurrence;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rebuilds each session's ordered progress from unordered step occurrence rows.
 *
 * A session is credited with step N only if it was already credited with steps 1..N-1
 * at earlier (or equal) occurrence times. Rows for any other step are ignored, no matter
 * how often that step fired.
 */
@Slf4j
@Component
public class SessionProgressionReconstructor {

    /**
     * Replay order within a session. Equal timestamps fall back to the step number so
     * repeated runs over the same rows credit the same steps.
     */
    static final Comparator<StepOccurrence> REPLAY_ORDER = Comparator
            .comparing(StepOccurrence::firstOccurrence)
            .thenComparingInt(StepOccurrence::stepNumber);

    /**
     * Group rows by session id, keeping first-seen session order.
     */
    public Map<String, List<StepOccurrence>> groupBySession(Collection<StepOccurrence> rows) {
        Map<String, List<StepOccurrence>> bySession = new LinkedHashMap<>();
        for (StepOccurrence row : rows) {
            bySession.computeIfAbsent(row.sessionId(), id -> new ArrayList<>()).add(row);
        }
        return bySession;
    }

    /**
     * Replay every session found in {@code rows}.
     */
    public StepProgression reconstruct(Collection<StepOccurrence> rows, int stepCount) {
        Map<String, List<StepOccurrence>> bySession = groupBySession(rows);
        return reconstruct(bySession, bySession.keySet(), stepCount);
    }

    /**
     * Replay only the given sessions of an already grouped row set.
     */
    public StepProgression reconstruct(
            Map<String, List<StepOccurrence>> bySession,
            Collection<String> sessionIds,
            int stepCount
    ) {
        List<SessionProgress> sessions = new ArrayList<>(sessionIds.size());
        for (String sessionId : sessionIds) {
            List<StepOccurrence> occurrences = bySession.get(sessionId);
            if (occurrences == null) {
                continue;
            }
            sessions.add(replay(sessionId, occurrences, stepCount));
        }
        log.debug("Reconstructed progression of {} sessions over {} steps", sessions.size(), stepCount);
        return new StepProgression(sessions);
    }

    SessionProgress replay(String sessionId, List<StepOccurrence> occurrences, int stepCount) {
        List<StepOccurrence> ordered = new ArrayList<>(occurrences);
        ordered.sort(REPLAY_ORDER);

        SessionProgress progress = new SessionProgress(sessionId);
        int expectedNextStep = 1;
        for (StepOccurrence occurrence : ordered) {
            if (expectedNextStep > stepCount) {
                break;
            }
            if (occurrence.stepNumber() == expectedNextStep) {
                progress.credit(occurrence.firstOccurrence());
                expectedNextStep++;
            }
        }
        return progress;
    }
}
