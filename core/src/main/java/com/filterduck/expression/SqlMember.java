package com.filterduck.expression;

import java.util.Objects;

/**
 * Member defined by a SQL expression.
 *
 * <p>The SQL is passed through as written, except that every occurrence of
 * {@value #TABLE_PLACEHOLDER} is replaced by the table alias of the
 * resolution context.
 *
 * <p>Examples:
 * <pre>
 *   COALESCE({TABLE}.first_name, {TABLE}.last_name)
 *   CASE WHEN amount > 100 THEN 'large' ELSE 'small' END
 * </pre>
 */
public final class SqlMember implements MemberSymbol {

    public static final String TABLE_PLACEHOLDER = "{TABLE}";

    private final String name;
    private final String sql;

    public SqlMember(String name, String sql) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.sql = Objects.requireNonNull(sql, "sql must not be null");
    }

    public String sql() {
        return sql;
    }

    /**
     * Returns whether the SQL refers to the context table alias.
     *
     * @return true if the SQL contains {@value #TABLE_PLACEHOLDER}
     */
    public boolean referencesTable() {
        return sql.contains(TABLE_PLACEHOLDER);
    }

    @Override
    public String fullName() {
        return name;
    }

    @Override
    public String toString() {
        return "SqlMember(" + name + ": " + sql + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof SqlMember that)) return false;
        return Objects.equals(name, that.name) && Objects.equals(sql, that.sql);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, sql);
    }
}
