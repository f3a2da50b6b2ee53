package com.filterduck.expression;

import java.util.Objects;

/**
 * Member backed by a single table column.
 *
 * <p>The column is rendered as an identifier, qualified by its own qualifier
 * if one was given, otherwise by the table alias of the resolution context.
 *
 * <p>Examples:
 * <pre>
 *   ColumnMember.of("orders.status", "status")          // status, or o.status under alias o
 *   ColumnMember.qualified("orders.id", "ord", "id")     // ord.id
 * </pre>
 */
public final class ColumnMember implements MemberSymbol {

    private final String name;
    private final String columnName;
    private final String qualifier;

    /**
     * Creates a column member.
     *
     * @param name the member name
     * @param columnName the column name
     * @param qualifier the table or alias qualifier (may be null)
     */
    public ColumnMember(String name, String columnName, String qualifier) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.columnName = Objects.requireNonNull(columnName, "columnName must not be null");
        this.qualifier = qualifier;
    }

    public String columnName() {
        return columnName;
    }

    /**
     * Returns the explicit qualifier.
     *
     * @return the qualifier, or null if the context alias applies
     */
    public String qualifier() {
        return qualifier;
    }

    @Override
    public String fullName() {
        return name;
    }

    @Override
    public String toString() {
        return "ColumnMember(" + name + " -> " + columnName + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ColumnMember that)) return false;
        return Objects.equals(name, that.name) &&
               Objects.equals(columnName, that.columnName) &&
               Objects.equals(qualifier, that.qualifier);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, columnName, qualifier);
    }

    public static ColumnMember of(String name, String columnName) {
        return new ColumnMember(name, columnName, null);
    }

    public static ColumnMember qualified(String name, String qualifier, String columnName) {
        return new ColumnMember(name, columnName, qualifier);
    }
}
