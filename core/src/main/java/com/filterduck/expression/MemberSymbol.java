package com.filterduck.expression;

/**
 * A member of the data model that a filter can be applied to.
 *
 * <p>Members are resolved to SQL text by an {@link ExpressionResolver}; the
 * member itself only knows its name.
 */
public interface MemberSymbol {

    /**
     * Returns the fully qualified member name, e.g. {@code "orders.status"}.
     *
     * @return the member name
     */
    String fullName();
}
