package com.webanalytics.funnel.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * SQL text paired with the values bound to its {@code ?} placeholders, in order.
 *
 * Literal values never appear in the text itself; composing fragments concatenates both
 * the text and the parameter lists.
 */
public final class SqlFragment {

    private static final SqlFragment EMPTY = new SqlFragment("", List.of());

    private final String sql;
    private final List<Object> parameters;

    private SqlFragment(String sql, List<Object> parameters) {
        this.sql = sql;
        this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
    }

    public static SqlFragment empty() {
        return EMPTY;
    }

    public static SqlFragment of(String sql, Object... parameters) {
        List<Object> params = new ArrayList<>(parameters.length);
        Collections.addAll(params, parameters);
        return new SqlFragment(sql, params);
    }

    public static SqlFragment of(String sql, List<?> parameters) {
        return new SqlFragment(sql, new ArrayList<>(parameters));
    }

    /**
     * Joins non-empty fragments with AND. Returns the empty fragment when nothing remains.
     */
    public static SqlFragment and(List<SqlFragment> clauses) {
        List<SqlFragment> present = clauses.stream()
                .filter(c -> !c.isEmpty())
                .toList();
        if (present.isEmpty()) {
            return EMPTY;
        }
        String sql = present.stream()
                .map(SqlFragment::sql)
                .collect(Collectors.joining(" AND "));
        List<Object> params = new ArrayList<>();
        present.forEach(c -> params.addAll(c.parameters));
        return new SqlFragment(sql, params);
    }

    /**
     * Combines complete queries into one UNION ALL query. Each member is wrapped in a
     * sub-select so it can keep its own GROUP BY.
     */
    public static SqlFragment unionAll(List<SqlFragment> queries, String columns) {
        if (queries.isEmpty()) {
            throw new IllegalArgumentException("Nothing to union");
        }
        if (queries.size() == 1) {
            return queries.get(0);
        }
        StringBuilder sql = new StringBuilder();
        List<Object> params = new ArrayList<>();
        for (int i = 0; i < queries.size(); i++) {
            if (i > 0) {
                sql.append("\nUNION ALL\n");
            }
            sql.append("SELECT ").append(columns).append(" FROM (")
                    .append(queries.get(i).sql)
                    .append(")");
            params.addAll(queries.get(i).parameters);
        }
        return new SqlFragment(sql.toString(), params);
    }

    public SqlFragment append(SqlFragment other) {
        if (other.isEmpty()) {
            return this;
        }
        List<Object> params = new ArrayList<>(parameters);
        params.addAll(other.parameters);
        return new SqlFragment(sql + other.sql, params);
    }

    public SqlFragment append(String text) {
        return new SqlFragment(sql + text, parameters);
    }

    public boolean isEmpty() {
        return sql.isEmpty();
    }

    public String sql() {
        return sql;
    }

    public List<Object> parameters() {
        return parameters;
    }

    @Override
    public String toString() {
        return sql + " " + parameters;
    }
}
