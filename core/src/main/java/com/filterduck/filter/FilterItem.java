package com.filterduck.filter;

import com.filterduck.expression.ResolutionContext;

/**
 * Anything that compiles to a SQL boolean condition: a single filter or a group.
 */
public interface FilterItem {

    /**
     * Compiles this item to SQL.
     *
     * @param context the context members are resolved in
     * @return the SQL boolean fragment
     */
    String toSQL(ResolutionContext context);
}
