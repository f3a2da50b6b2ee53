package com.filterduck.expression;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Context in which members are resolved to SQL.
 *
 * <p>Carries the table alias that unqualified columns are rendered against,
 * and per-member SQL overrides for members that an enclosing query has
 * already rendered (for example, a column of a pre-aggregated subquery).
 *
 * <p>Contexts are immutable; the {@code with*} methods return new instances.
 */
public final class ResolutionContext {

    private static final ResolutionContext EMPTY = new ResolutionContext(null, Map.of());

    private final String tableAlias;
    private final Map<String, String> renderedReferences;

    private ResolutionContext(String tableAlias, Map<String, String> renderedReferences) {
        this.tableAlias = tableAlias;
        this.renderedReferences = renderedReferences;
    }

    /**
     * Returns a context without alias or overrides.
     *
     * @return the empty context
     */
    public static ResolutionContext empty() {
        return EMPTY;
    }

    /**
     * Returns a context that qualifies columns with the given alias.
     *
     * @param tableAlias the table alias
     * @return a new context
     */
    public static ResolutionContext forAlias(String tableAlias) {
        return EMPTY.withTableAlias(tableAlias);
    }

    public ResolutionContext withTableAlias(String alias) {
        return new ResolutionContext(Objects.requireNonNull(alias, "alias must not be null"),
                                     renderedReferences);
    }

    /**
     * Returns a context in which the named member renders as the given SQL.
     *
     * @param memberName the member name
     * @param sql the SQL to use for it
     * @return a new context
     */
    public ResolutionContext withRenderedReference(String memberName, String sql) {
        Objects.requireNonNull(memberName, "memberName must not be null");
        Objects.requireNonNull(sql, "sql must not be null");
        Map<String, String> refs = new HashMap<>(renderedReferences);
        refs.put(memberName, sql);
        return new ResolutionContext(tableAlias, Collections.unmodifiableMap(refs));
    }

    /**
     * Returns the table alias.
     *
     * @return the alias, or null if none
     */
    public String tableAlias() {
        return tableAlias;
    }

    /**
     * Returns the SQL override registered for a member.
     *
     * @param memberName the member name
     * @return the SQL, or null if none is registered
     */
    public String renderedReference(String memberName) {
        return renderedReferences.get(memberName);
    }

    @Override
    public String toString() {
        return "ResolutionContext(alias=" + tableAlias + ", references=" + renderedReferences.keySet() + ")";
    }
}
