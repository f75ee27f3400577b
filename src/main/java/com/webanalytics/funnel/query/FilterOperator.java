package com.webanalytics.funnel.query;

import java.util.Arrays;
import java.util.Optional;

/**
 * Operators understood by the filter compiler, keyed by their wire name.
 */
public enum FilterOperator {
    EQUALS("equals", true),
    NOT_EQUALS("not_equals", true),
    CONTAINS("contains", true),
    NOT_CONTAINS("not_contains", true),
    STARTS_WITH("starts_with", true),
    ENDS_WITH("ends_with", true),
    IN("in", true),
    NOT_IN("not_in", true),
    IS_NULL("is_null", false),
    IS_NOT_NULL("is_not_null", false),
    GREATER_THAN("greater_than", true),
    LESS_THAN("less_than", true),
    GREATER_THAN_OR_EQUAL("greater_than_or_equal", true),
    LESS_THAN_OR_EQUAL("less_than_or_equal", true);

    private final String wireName;
    private final boolean requiresValue;

    FilterOperator(String wireName, boolean requiresValue) {
        this.wireName = wireName;
        this.requiresValue = requiresValue;
    }

    public boolean requiresValue() {
        return requiresValue;
    }

    public static Optional<FilterOperator> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(op -> op.wireName.equals(name))
                .findFirst();
    }
}
