package com.webanalytics.funnel.referrer;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * Host name helpers for referrer strings, which arrive with or without a scheme.
 */
public final class Hosts {

    private Hosts() {}

    /**
     * @return the lower-cased host of a URL or bare host name, or null if none can be parsed
     */
    public static String hostOf(String referrer) {
        if (referrer == null || referrer.isBlank()) {
            return null;
        }
        String candidate = referrer.trim();
        if (!candidate.contains("://")) {
            candidate = "http://" + candidate;
        }
        try {
            String host = new URI(candidate).getHost();
            if (host == null || host.isEmpty() || !host.contains(".")) {
                return null;
            }
            return host.toLowerCase(Locale.ROOT);
        } catch (URISyntaxException e) {
            return null;
        }
    }

    public static String stripWww(String host) {
        return host.startsWith("www.") ? host.substring(4) : host;
    }

    /**
     * True when {@code host} is the site's domain, one of its subdomains, or differs from it
     * only by a leading "www.".
     */
    public static boolean isSameSite(String host, String siteDomain) {
        if (host == null || siteDomain == null || siteDomain.isBlank()) {
            return false;
        }
        String site = stripWww(siteDomain.trim().toLowerCase(Locale.ROOT));
        String h = host.toLowerCase(Locale.ROOT);
        return h.equals(site) || h.endsWith("." + site);
    }
}
