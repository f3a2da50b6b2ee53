package com.filterduck.filter;

import com.filterduck.expression.ResolutionContext;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * AND or OR combination of filters and nested groups.
 *
 * <p>Every child is parenthesized, since a single filter may itself be a
 * disjunction (e.g. {@code status = ? OR status IS NULL}):
 * <pre>
 *   (status = ? OR status IS NULL) AND (amount > ?)
 * </pre>
 * An empty group renders as {@code 1 = 1}.
 */
public final class FilterGroup implements FilterItem {

    /**
     * Group operators.
     */
    public enum Operator {
        AND(" AND "),
        OR(" OR ");

        private final String separator;

        Operator(String separator) {
            this.separator = separator;
        }

        public String separator() {
            return separator;
        }
    }

    static final String EMPTY_GROUP_SQL = "1 = 1";

    private final Operator operator;
    private final List<FilterItem> items;

    public FilterGroup(Operator operator, List<? extends FilterItem> items) {
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        Objects.requireNonNull(items, "items must not be null");
        this.items = Collections.unmodifiableList(new ArrayList<>(items));
    }

    public static FilterGroup and(List<? extends FilterItem> items) {
        return new FilterGroup(Operator.AND, items);
    }

    public static FilterGroup or(List<? extends FilterItem> items) {
        return new FilterGroup(Operator.OR, items);
    }

    public Operator operator() {
        return operator;
    }

    public List<FilterItem> items() {
        return items;
    }

    @Override
    public String toSQL(ResolutionContext context) {
        if (items.isEmpty()) {
            return EMPTY_GROUP_SQL;
        }
        StringBuilder sql = new StringBuilder();
        for (int i = 0; i < items.size(); i++) {
            if (i > 0) {
                sql.append(operator.separator());
            }
            sql.append('(').append(items.get(i).toSQL(context)).append(')');
        }
        return sql.toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FilterGroup that)) return false;
        return operator == that.operator && Objects.equals(items, that.items);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, items);
    }

    @Override
    public String toString() {
        return "FilterGroup(" + operator + ", " + items.size() + " items)";
    }
}
