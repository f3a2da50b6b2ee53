package com.filterduck.filter;

/**
 * Three-valued-logic rule for NULL guards.
 *
 * <p>A comparison against NULL is UNKNOWN in SQL, so a filter's condition
 * alone cannot express every intent. The guard rule:
 * <pre>
 *                      no NULL in values    NULL in values
 *   positive operator  no guard             guard (OR column IS NULL)
 *   negated operator   guard                no guard
 * </pre>
 * A positive filter that lists NULL must also match NULL rows. A negated
 * filter without NULL in its list has to spell out how NULL rows are treated,
 * because {@code NOT (NULL = x)} is UNKNOWN rather than TRUE.
 */
public final class NullSemantics {

    private NullSemantics() {}

    /**
     * Decides whether a NULL guard must be appended to a condition.
     *
     * @param negated whether the operator is a negated form
     * @param containsNull whether any filter value is NULL
     * @return {@code negated ? !containsNull : containsNull}
     */
    public static boolean isNeedNullCheck(boolean negated, boolean containsNull) {
        return negated ? !containsNull : containsNull;
    }
}
