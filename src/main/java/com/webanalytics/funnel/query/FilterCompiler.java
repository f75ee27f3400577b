package com.webanalytics.funnel.query;

import com.webanalytics.funnel.model.AttributeFilter;
import com.webanalytics.funnel.model.ErrorKind;
import com.webanalytics.funnel.model.FunnelAnalyticsException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Turns a funnel's attribute filters into one AND-combined predicate over an event table
 * alias.
 *
 * Unknown operators compile to nothing and are logged, so one stale filter does not take
 * the whole funnel down. Unknown fields and missing values are rejected, since field names
 * end up in the query text.
 */
@Slf4j
@Component
public class FilterCompiler {

    /**
     * Compile filters into a predicate over {@code alias}.
     *
     * @param filters the funnel's filters, may be null
     * @param alias   table alias the columns are qualified with
     * @return the combined predicate, or the empty fragment when nothing applies
     * @throws FunnelAnalyticsException with kind INVALID_FILTER listing every invalid filter
     */
    public SqlFragment compile(List<AttributeFilter> filters, String alias) {
        if (filters == null || filters.isEmpty()) {
            return SqlFragment.empty();
        }

        List<SqlFragment> clauses = new ArrayList<>();
        List<String> errors = new ArrayList<>();

        for (AttributeFilter filter : filters) {
            String error = validate(filter);
            if (error != null) {
                errors.add(error);
                continue;
            }
            Optional<FilterOperator> operator = FilterOperator.fromWireName(filter.getOperator());
            if (operator.isEmpty()) {
                log.warn("Skipping filter on '{}' with unknown operator '{}'",
                        filter.getField(), filter.getOperator());
                continue;
            }
            clauses.add(compileOne(alias + "." + filter.getField(), operator.get(), values(filter)));
        }

        if (!errors.isEmpty()) {
            throw new FunnelAnalyticsException(
                    ErrorKind.INVALID_FILTER,
                    "Invalid filters: " + String.join(", ", errors)
            );
        }
        return SqlFragment.and(clauses);
    }

    private String validate(AttributeFilter filter) {
        if (filter == null) {
            return "Empty filter";
        }
        if (!SqlLiterals.isFilterableColumn(filter.getField())) {
            return "Invalid field: " + filter.getField();
        }
        Optional<FilterOperator> operator = FilterOperator.fromWireName(filter.getOperator());
        if (operator.isPresent() && operator.get().requiresValue() && values(filter).isEmpty()) {
            return "Value is required for operator: " + filter.getOperator();
        }
        return null;
    }

    private SqlFragment compileOne(String column, FilterOperator operator, List<String> values) {
        switch (operator) {
            case IS_NULL:
                return SqlFragment.of(column + " IS NULL");
            case IS_NOT_NULL:
                return SqlFragment.of(column + " IS NOT NULL");
            case IN:
                return SqlFragment.of(column + " IN (" + placeholders(values.size()) + ")", values);
            case NOT_IN:
                return SqlFragment.of(column + " NOT IN (" + placeholders(values.size()) + ")", values);
            case EQUALS:
                if (values.size() > 1) {
                    return compileOne(column, FilterOperator.IN, values);
                }
                return SqlFragment.of(column + " = ?", values.get(0));
            case NOT_EQUALS:
                if (values.size() > 1) {
                    return compileOne(column, FilterOperator.NOT_IN, values);
                }
                return SqlFragment.of(column + " != ?", values.get(0));
            default:
                return compileEach(column, operator, values);
        }
    }

    // A list value on a scalar operator matches any of the values, or none of them for
    // the negated operator.
    private SqlFragment compileEach(String column, FilterOperator operator, List<String> values) {
        List<SqlFragment> parts = values.stream()
                .map(v -> compileScalar(column, operator, v))
                .toList();
        if (parts.size() == 1) {
            return parts.get(0);
        }
        String joiner = operator == FilterOperator.NOT_CONTAINS ? " AND " : " OR ";
        String sql = parts.stream().map(SqlFragment::sql).collect(Collectors.joining(joiner, "(", ")"));
        List<Object> params = new ArrayList<>();
        parts.forEach(p -> params.addAll(p.parameters()));
        return SqlFragment.of(sql, params);
    }

    private SqlFragment compileScalar(String column, FilterOperator operator, String value) {
        switch (operator) {
            case CONTAINS:
                return SqlFragment.of(column + " LIKE ?" + SqlLiterals.LIKE_ESCAPE_CLAUSE,
                        SqlLiterals.containsPattern(value));
            case NOT_CONTAINS:
                return SqlFragment.of(column + " NOT LIKE ?" + SqlLiterals.LIKE_ESCAPE_CLAUSE,
                        SqlLiterals.containsPattern(value));
            case STARTS_WITH:
                return SqlFragment.of(column + " LIKE ?" + SqlLiterals.LIKE_ESCAPE_CLAUSE,
                        SqlLiterals.prefixPattern(value));
            case ENDS_WITH:
                return SqlFragment.of(column + " LIKE ?" + SqlLiterals.LIKE_ESCAPE_CLAUSE,
                        SqlLiterals.suffixPattern(value));
            case GREATER_THAN:
                return SqlFragment.of(column + " > ?", value);
            case LESS_THAN:
                return SqlFragment.of(column + " < ?", value);
            case GREATER_THAN_OR_EQUAL:
                return SqlFragment.of(column + " >= ?", value);
            case LESS_THAN_OR_EQUAL:
                return SqlFragment.of(column + " <= ?", value);
            default:
                throw new IllegalStateException("Not a scalar operator: " + operator);
        }
    }

    private static List<String> values(AttributeFilter filter) {
        Object value = filter.getValue();
        if (value == null) {
            return Collections.emptyList();
        }
        if (value instanceof Collection<?> collection) {
            return collection.stream()
                    .filter(v -> v != null && !String.valueOf(v).isEmpty())
                    .map(String::valueOf)
                    .toList();
        }
        String text = String.valueOf(value);
        return text.isEmpty() ? Collections.emptyList() : List.of(text);
    }

    private static String placeholders(int count) {
        return String.join(", ", Collections.nCopies(count, "?"));
    }
}
