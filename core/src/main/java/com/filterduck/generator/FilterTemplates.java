package com.filterduck.generator;

import com.filterduck.exception.FilterCompilationException;

import java.util.List;

/**
 * Dialect-specific renderers for the SQL constructs a filter is built from.
 *
 * <p>Renderers receive SQL tokens that are already computed (the member SQL,
 * parameter placeholders, cast timestamps) and only decide the syntax that
 * joins them. They never see raw filter values, except interval literals
 * which they validate and quote themselves.
 *
 * <p>Any renderer may throw a {@link FilterCompilationException} of kind
 * TEMPLATE when its inputs are structurally invalid.
 *
 * @see SqlDialect
 */
public interface FilterTemplates {

    /** {@code column = value}, followed by an OR IS NULL guard if requested. */
    String equals(String column, String value, boolean isNullCheck);

    /** {@code column <> value}, followed by an OR IS NULL guard if requested. */
    String notEquals(String column, String value, boolean isNullCheck);

    /** {@code column IN (v1, v2, ...)}, followed by an OR IS NULL guard if requested. */
    String inWhere(String column, List<String> values, boolean isNullCheck);

    /** {@code column NOT IN (v1, v2, ...)}, followed by an OR IS NULL guard if requested. */
    String notInWhere(String column, List<String> values, boolean isNullCheck);

    /** {@code column IS NOT NULL}. */
    String setWhere(String column);

    /** {@code column IS NULL}. */
    String notSetWhere(String column);

    String gt(String column, String param);

    String gte(String column, String param);

    String lt(String column, String param);

    String lte(String column, String param);

    /**
     * Case-insensitive pattern match of a column against a parameter.
     *
     * @param column the column SQL
     * @param value the parameter placeholder holding the search text
     * @param startWild whether anything may precede the value
     * @param endWild whether anything may follow the value
     * @param negated whether to render the NOT form
     * @return the pattern-match fragment
     */
    String ilike(String column, String value, boolean startWild, boolean endWild, boolean negated);

    /** Guard appended to a positive condition: {@code " OR column IS NULL"}. */
    String orIsNullCheck(String column);

    /** Guard appended to a negated condition: {@code " AND column IS NOT NULL"}. */
    String andIsNotNullCheck(String column);

    /** Inclusive range test of a column between two timestamp expressions. */
    String timeRangeFilter(String column, String fromTimestamp, String toTimestamp);

    /** Moves a timestamp expression forward by an interval literal such as {@code "2 day"}. */
    String addInterval(String date, String interval);

    /** Moves a timestamp expression back by an interval literal such as {@code "2 day"}. */
    String subInterval(String date, String interval);

    /** Casts a parameter placeholder to timestamp with time zone. */
    String timestampParam(String placeholder);

    /**
     * Returns the SQL NULL literal.
     *
     * @return "NULL"
     */
    default String nullLiteral() {
        return "NULL";
    }
}
