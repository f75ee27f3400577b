package com.webanalytics.funnel.query;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * The single place where user-supplied text is prepared for use inside a query.
 *
 * Values are always bound as parameters; what remains here is escaping LIKE wildcards in
 * bound patterns, checking identifiers against a whitelist and building JSON paths.
 */
public final class SqlLiterals {

    /** Escape character declared on every LIKE built by this package. */
    public static final char LIKE_ESCAPE = '\\';

    public static final String LIKE_ESCAPE_CLAUSE = " ESCAPE '\\'";

    /** Event columns a filter may reference. */
    public static final Set<String> FILTERABLE_COLUMNS = Set.of(
            "event_name",
            "path",
            "referrer",
            "country",
            "city",
            "device_type",
            "browser_name",
            "os_name",
            "language",
            "screen_resolution",
            "utm_source",
            "utm_medium",
            "utm_campaign",
            "utm_term",
            "utm_content"
    );

    private static final Pattern PROPERTY_KEY = Pattern.compile("[A-Za-z0-9_.\\-]+");

    private SqlLiterals() {}

    /**
     * Escapes the LIKE metacharacters {@code %}, {@code _} and the escape character itself
     * so the value matches literally.
     */
    public static String escapeLike(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 8);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '%' || c == '_' || c == LIKE_ESCAPE) {
                sb.append(LIKE_ESCAPE);
            }
            sb.append(c);
        }
        return sb.toString();
    }

    public static String containsPattern(String value) {
        return "%" + escapeLike(value) + "%";
    }

    public static String prefixPattern(String value) {
        return escapeLike(value) + "%";
    }

    public static String suffixPattern(String value) {
        return "%" + escapeLike(value);
    }

    public static boolean isFilterableColumn(String column) {
        return column != null && FILTERABLE_COLUMNS.contains(column);
    }

    public static boolean isValidPropertyKey(String key) {
        return key != null && PROPERTY_KEY.matcher(key).matches();
    }

    /**
     * JSON path selecting a top-level property, for use as a bound json_extract argument.
     */
    public static String jsonPath(String key) {
        if (!isValidPropertyKey(key)) {
            throw new IllegalArgumentException("Invalid property key: " + key);
        }
        return "$.\"" + key + "\"";
    }
}
