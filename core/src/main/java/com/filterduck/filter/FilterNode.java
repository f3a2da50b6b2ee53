package com.filterduck.filter;

import com.filterduck.exception.FilterCompilationException;
import com.filterduck.exception.FilterCompilationException.ErrorKind;
import com.filterduck.expression.MemberSymbol;
import com.filterduck.expression.ResolutionContext;
import com.filterduck.runtime.QueryTools;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A single filter: a member, an operator and an ordered list of values.
 *
 * <p>Values are literal strings. A {@code null} element stands for SQL NULL,
 * which is different from supplying no values at all (an empty list). Order
 * matters: for date ranges positions 0 and 1 are the bounds and positions 2
 * and 3 optional interval extensions.
 *
 * <p>Examples:
 * <pre>
 *   status = ?                              equals ["shipped"]
 *   status IS NULL                          equals [null]
 *   status IN (?, ?) OR status IS NULL      in ["a", "b", null]
 *   (name ILIKE '%' || ? || '%')            contains ["smith"]
 * </pre>
 *
 * <p>Nodes are immutable. Two nodes are equal when their kind, operator and
 * values are equal; the member is not compared, so structurally identical
 * filters deduplicate even when they were built from different member
 * instances.
 */
public final class FilterNode implements FilterItem {

    private static final Logger logger = LoggerFactory.getLogger(FilterNode.class);

    private final QueryTools tools;
    private final MemberSymbol member;
    private final FilterKind kind;
    private final FilterOperator operator;
    private final List<String> values;

    /**
     * Creates a filter node.
     *
     * @param tools the compile-time collaborators (shared, not copied)
     * @param member the filtered member
     * @param kind dimension or measure
     * @param operator the operator
     * @param values the values; null elements are SQL NULLs, a null list means no values
     */
    public FilterNode(QueryTools tools, MemberSymbol member, FilterKind kind,
                      FilterOperator operator, List<String> values) {
        this.tools = Objects.requireNonNull(tools, "tools must not be null");
        this.member = Objects.requireNonNull(member, "member must not be null");
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.values = values == null
            ? Collections.emptyList()
            : Collections.unmodifiableList(new ArrayList<>(values));
    }

    /**
     * Returns a node with the same member, kind and tools but a different
     * operator and values. This node is unchanged.
     *
     * <p>This is the change-operator operation used to derive one filter from
     * another, e.g. turning {@code equals} into {@code notEquals}.
     *
     * @param newOperator the operator of the new node
     * @param newValues the values of the new node
     * @return the new node
     */
    public FilterNode withOperator(FilterOperator newOperator, List<String> newValues) {
        return new FilterNode(tools, member, kind, newOperator, newValues);
    }

    public MemberSymbol member() {
        return member;
    }

    public String memberName() {
        return member.fullName();
    }

    public FilterKind kind() {
        return kind;
    }

    /** Returns the filter operator. */
    public FilterOperator operator() {
        return operator;
    }

    /**
     * Returns the values.
     *
     * @return an unmodifiable list; elements may be null
     */
    public List<String> values() {
        return values;
    }

    QueryTools tools() {
        return tools;
    }

    /**
     * Compiles this filter to a SQL boolean fragment.
     *
     * <p>Bind parameters are allocated on the tools' allocator as a side effect.
     *
     * @param context the context the member is resolved in
     * @return the SQL fragment
     * @throws FilterCompilationException if the filter is invalid, or as thrown
     *         by the resolver or templates
     */
    @Override
    public String toSQL(ResolutionContext context) {
        String memberSql = tools.resolver().resolve(member, context);
        String sql = new FilterCompiler(this, memberSql).compile();
        logger.debug("Compiled {} filter on {}: {}", operator.operatorName(), memberName(), sql);
        return sql;
    }

    // ==================== Value Shape ====================

    /**
     * Returns whether more than one value was supplied.
     *
     * @return true if the filter lists several values
     */
    public boolean isArrayValue() {
        return values.size() > 1;
    }

    /**
     * Returns whether any value is NULL.
     *
     * @return true if a null element is present
     */
    public boolean isValuesContainsNull() {
        return values.stream().anyMatch(Objects::isNull);
    }

    /**
     * Decides whether this filter's condition needs a NULL guard.
     *
     * @param negated whether the operator is being rendered in its negated form
     * @return see {@link NullSemantics#isNeedNullCheck}
     */
    public boolean isNeedNullCheck(boolean negated) {
        return NullSemantics.isNeedNullCheck(negated, isValuesContainsNull());
    }

    /**
     * Allocates a parameter for every non-null value, in order.
     *
     * @return the placeholders; NULL values are skipped
     */
    List<String> filterAndAllocateValues() {
        List<String> placeholders = new ArrayList<>(values.size());
        for (String value : values) {
            if (value != null) {
                placeholders.add(tools.allocateParam(value));
            }
        }
        return placeholders;
    }

    /**
     * Returns the SQL for the first value: a placeholder, or NULL.
     *
     * @return the placeholder or the NULL literal
     * @throws FilterCompilationException ARGUMENT_COUNT if there are no values
     */
    String firstParam() {
        if (values.isEmpty()) {
            throw new FilterCompilationException(ErrorKind.ARGUMENT_COUNT,
                "Expected one parameter but nothing found", memberName());
        }
        String value = values.get(0);
        return value != null ? tools.allocateParam(value) : tools.templates().nullLiteral();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FilterNode that)) return false;
        return kind == that.kind &&
               operator == that.operator &&
               Objects.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, operator, values);
    }

    @Override
    public String toString() {
        return "FilterNode(" + memberName() + " " + operator.operatorName() + " " + values + ")";
    }
}
