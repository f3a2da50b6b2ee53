package com.filterduck.filter;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Filter operators.
 *
 * <p>The set is closed: {@link FilterCompiler} switches over it without a
 * default branch, so a new constant does not compile until it has a rendering
 * strategy.
 *
 * <p>Each operator carries the name used for it in query definitions,
 * e.g. {@code "notStartsWith"} for {@link #NOT_STARTS_WITH}.
 */
public enum FilterOperator {
    EQUAL("equals", false),
    NOT_EQUAL("notEquals", true),
    IN_DATE_RANGE("inDateRange", false),
    IN_DATE_RANGE_EXTENDED("inDateRangeExtended", false),
    IN("in", false),
    NOT_IN("notIn", true),
    SET("set", false),
    NOT_SET("notSet", false),
    GT("gt", false),
    GTE("gte", false),
    LT("lt", false),
    LTE("lte", false),
    CONTAINS("contains", false),
    NOT_CONTAINS("notContains", true),
    STARTS_WITH("startsWith", false),
    NOT_STARTS_WITH("notStartsWith", true),
    ENDS_WITH("endsWith", false),
    NOT_ENDS_WITH("notEndsWith", true);

    private static final Map<String, FilterOperator> BY_NAME = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(FilterOperator::operatorName, Function.identity()));

    private final String operatorName;
    private final boolean negated;

    FilterOperator(String operatorName, boolean negated) {
        this.operatorName = operatorName;
        this.negated = negated;
    }

    /**
     * Returns the name of this operator in query definitions.
     *
     * @return the operator name, e.g. "notEquals"
     */
    public String operatorName() {
        return operatorName;
    }

    /**
     * Returns whether this operator is the negated form of a value match.
     *
     * <p>NOT_SET is a presence test, not a negated match, and returns false.
     *
     * @return true for notEquals, notIn and the negated pattern operators
     */
    public boolean isNegated() {
        return negated;
    }

    /**
     * Looks up an operator by its query-definition name (case-sensitive).
     *
     * @param name the operator name
     * @return the operator
     * @throws IllegalArgumentException if the name is unknown
     */
    public static FilterOperator fromName(String name) {
        FilterOperator op = name == null ? null : BY_NAME.get(name);
        if (op == null) {
            throw new IllegalArgumentException(
                "Unknown filter operator: '%s'. Valid values: %s".formatted(
                    name,
                    Arrays.stream(values()).map(FilterOperator::operatorName)
                        .collect(Collectors.joining(", "))));
        }
        return op;
    }
}
