package com.webanalytics.funnel.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Normalized traffic source.
 *
 * @param type   "direct", "search", "social" or "referrer"
 * @param name   display name
 * @param domain canonical domain, empty when unknown
 */
public record ReferrerIdentity(
        @JsonProperty("type") String type,
        @JsonProperty("name") String name,
        @JsonProperty("domain") String domain
) {

    public static final ReferrerIdentity DIRECT = new ReferrerIdentity("direct", "Direct", "");

    /**
     * Key under which sessions are grouped: the domain when known, the name otherwise.
     */
    public String groupKey() {
        if (domain != null && !domain.isEmpty()) {
            return domain.toLowerCase();
        }
        return name == null ? "direct" : name.toLowerCase();
    }

    public boolean isDirect() {
        return "direct".equals(type);
    }
}
