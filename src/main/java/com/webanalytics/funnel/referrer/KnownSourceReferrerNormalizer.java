package com.webanalytics.funnel.referrer;

import com.webanalytics.funnel.model.ReferrerIdentity;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Normalizes referrers against a table of well-known search engines and social networks.
 * Any other host is reported as a plain referrer under its own host name.
 */
@Component
public class KnownSourceReferrerNormalizer implements ReferrerNormalizer {

    // Google serves many country TLDs (google.de, google.co.uk, ...)
    private static final Pattern GOOGLE_HOST = Pattern.compile("(.+\\.)?google\\.[a-z]{2,3}(\\.[a-z]{2})?");

    private static final Map<String, ReferrerIdentity> KNOWN_SOURCES = new LinkedHashMap<>();

    static {
        search("bing.com", "Bing");
        search("duckduckgo.com", "DuckDuckGo");
        search("yahoo.com", "Yahoo");
        search("baidu.com", "Baidu");
        search("yandex.ru", "Yandex");
        search("yandex.com", "Yandex");
        search("ecosia.org", "Ecosia");
        social("facebook.com", "Facebook");
        social("fb.com", "Facebook", "facebook.com");
        social("twitter.com", "Twitter");
        social("x.com", "Twitter", "twitter.com");
        social("t.co", "Twitter", "twitter.com");
        social("linkedin.com", "LinkedIn");
        social("lnkd.in", "LinkedIn", "linkedin.com");
        social("instagram.com", "Instagram");
        social("reddit.com", "Reddit");
        social("youtube.com", "YouTube");
        social("youtu.be", "YouTube", "youtube.com");
        social("pinterest.com", "Pinterest");
        social("news.ycombinator.com", "Hacker News");
        social("tiktok.com", "TikTok");
    }

    private static void search(String host, String name) {
        KNOWN_SOURCES.put(host, new ReferrerIdentity("search", name, host));
    }

    private static void social(String host, String name) {
        social(host, name, host);
    }

    private static void social(String host, String name, String canonicalDomain) {
        KNOWN_SOURCES.put(host, new ReferrerIdentity("social", name, canonicalDomain));
    }

    @Override
    public ReferrerIdentity normalize(String rawReferrer) {
        if (rawReferrer == null || rawReferrer.isBlank() || "direct".equalsIgnoreCase(rawReferrer.trim())) {
            return ReferrerIdentity.DIRECT;
        }
        String raw = rawReferrer.trim();
        String host = Hosts.hostOf(raw);
        if (host == null) {
            return new ReferrerIdentity("referrer", raw, "");
        }
        String bareHost = Hosts.stripWww(host);

        if (GOOGLE_HOST.matcher(bareHost).matches()) {
            return new ReferrerIdentity("search", "Google", "google.com");
        }
        ReferrerIdentity known = lookup(bareHost);
        if (known != null) {
            return known;
        }
        return new ReferrerIdentity("referrer", bareHost, bareHost);
    }

    // Matches the host itself or any parent domain in the table (m.facebook.com -> facebook.com).
    private static ReferrerIdentity lookup(String host) {
        String candidate = host;
        while (true) {
            ReferrerIdentity identity = KNOWN_SOURCES.get(candidate);
            if (identity != null) {
                return identity;
            }
            int dot = candidate.indexOf('.');
            if (dot < 0 || candidate.indexOf('.', dot + 1) < 0) {
                return null;
            }
            candidate = candidate.substring(dot + 1).toLowerCase(Locale.ROOT);
        }
    }
}
