package com.webanalytics.funnel.engine;

import com.webanalytics.funnel.model.FunnelStep;
import com.webanalytics.funnel.model.ReferrerFunnelSlice;
import com.webanalytics.funnel.model.ReferrerIdentity;
import com.webanalytics.funnel.model.StepAnalytics;
import com.webanalytics.funnel.model.StepOccurrence;
import com.webanalytics.funnel.referrer.Hosts;
import com.webanalytics.funnel.referrer.ReferrerNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Splits sessions by their first-touch traffic source and runs the funnel once per source.
 *
 * Referrers pointing back at the site itself count as Direct. Raw referrers that
 * normalize to the same source are merged into one slice.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReferrerSegmenter {

    private static final Comparator<ReferrerFunnelSlice> BY_ENTERING_DESC = Comparator
            .comparingInt(ReferrerFunnelSlice::getEnteringSessions).reversed()
            .thenComparing(ReferrerFunnelSlice::getReferrer);

    private final SessionProgressionReconstructor reconstructor;
    private final StepAggregator aggregator;
    private final ReferrerNormalizer normalizer;

    /**
     * @param rows       occurrence rows carrying each session's first-touch referrer
     * @param steps      funnel steps, in order
     * @param siteDomain the website's own domain, or null if unknown
     * @return one slice per source with at least one entering session, largest first
     */
    public List<ReferrerFunnelSlice> segment(List<StepOccurrence> rows, List<FunnelStep> steps, String siteDomain) {
        Map<String, List<StepOccurrence>> bySession = reconstructor.groupBySession(rows);

        Map<String, ReferrerGroup> groups = new LinkedHashMap<>();
        for (Map.Entry<String, List<StepOccurrence>> entry : bySession.entrySet()) {
            String raw = firstTouchReferrer(entry.getValue());
            ReferrerIdentity identity = resolve(raw, siteDomain);
            groups.computeIfAbsent(identity.groupKey(),
                            key -> new ReferrerGroup(key, identity, identity.isDirect() ? "" : raw))
                    .sessionIds.add(entry.getKey());
        }

        List<ReferrerFunnelSlice> slices = new ArrayList<>();
        for (ReferrerGroup group : groups.values()) {
            StepProgression progression = reconstructor.reconstruct(bySession, group.sessionIds, steps.size());
            int entering = progression.reachedCount(1);
            if (entering == 0) {
                continue;
            }
            int completing = progression.reachedCount(steps.size());
            List<StepAnalytics> stepAnalytics = aggregator.aggregate(steps, progression);

            slices.add(ReferrerFunnelSlice.builder()
                    .referrer(group.key)
                    .referrerParsed(group.identity)
                    .referrerUrl(group.sampleUrl)
                    .enteringSessions(entering)
                    .completingSessions(completing)
                    .conversionRate(Rates.percentage(completing, entering))
                    .steps(stepAnalytics)
                    .build());
        }
        slices.sort(BY_ENTERING_DESC);

        log.debug("Segmented {} sessions into {} referrer groups ({} with entries)",
                bySession.size(), groups.size(), slices.size());
        return slices;
    }

    /**
     * Normalized source of a raw referrer, folding self-referrals into Direct.
     */
    public ReferrerIdentity resolve(String rawReferrer, String siteDomain) {
        if (rawReferrer == null || rawReferrer.isBlank()) {
            return ReferrerIdentity.DIRECT;
        }
        if (Hosts.isSameSite(Hosts.hostOf(rawReferrer), siteDomain)) {
            return ReferrerIdentity.DIRECT;
        }
        return normalizer.normalize(rawReferrer);
    }

    // Rows of one session all carry the same session-level referrer; take the earliest
    // row that has one.
    private static String firstTouchReferrer(List<StepOccurrence> occurrences) {
        return occurrences.stream()
                .sorted(SessionProgressionReconstructor.REPLAY_ORDER)
                .filter(StepOccurrence::hasReferrer)
                .map(StepOccurrence::referrer)
                .findFirst()
                .orElse(null);
    }

    private static final class ReferrerGroup {
        private final String key;
        private final ReferrerIdentity identity;
        private final String sampleUrl;
        private final Set<String> sessionIds = new LinkedHashSet<>();

        private ReferrerGroup(String key, ReferrerIdentity identity, String sampleUrl) {
            this.key = key;
            this.identity = identity;
            this.sampleUrl = sampleUrl;
        }
    }
}
