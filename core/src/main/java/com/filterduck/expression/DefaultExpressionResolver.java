package com.filterduck.expression;

import com.filterduck.exception.FilterCompilationException;
import com.filterduck.generator.SQLQuoting;

/**
 * Resolver for the member types shipped with the library.
 *
 * <p>Resolution order:
 * <ol>
 *   <li>an override registered in the context for the member name</li>
 *   <li>{@link ColumnMember}: quoted column, qualified by its own qualifier or the context alias</li>
 *   <li>{@link SqlMember}: raw SQL with the table placeholder substituted</li>
 * </ol>
 */
public final class DefaultExpressionResolver implements ExpressionResolver {

    private static final DefaultExpressionResolver INSTANCE = new DefaultExpressionResolver();

    public static DefaultExpressionResolver get() {
        return INSTANCE;
    }

    private DefaultExpressionResolver() {}

    @Override
    public String resolve(MemberSymbol member, ResolutionContext context) {
        if (member == null) {
            throw FilterCompilationException.resolution("member must not be null", null);
        }
        ResolutionContext ctx = context != null ? context : ResolutionContext.empty();

        String rendered = ctx.renderedReference(member.fullName());
        if (rendered != null) {
            return rendered;
        }

        if (member instanceof ColumnMember column) {
            return resolveColumn(column, ctx);
        }
        if (member instanceof SqlMember sqlMember) {
            return resolveSql(sqlMember, ctx);
        }
        throw FilterCompilationException.resolution(
            "Unsupported member type: " + member.getClass().getSimpleName(), member.fullName());
    }

    private static String resolveColumn(ColumnMember column, ResolutionContext ctx) {
        String qualifier = column.qualifier() != null ? column.qualifier() : ctx.tableAlias();
        String columnSql = SQLQuoting.quoteIdentifierIfNeeded(column.columnName());
        if (qualifier != null) {
            return SQLQuoting.quoteIdentifierIfNeeded(qualifier) + "." + columnSql;
        }
        return columnSql;
    }

    private static String resolveSql(SqlMember member, ResolutionContext ctx) {
        String sql = member.sql();
        if (sql.isBlank()) {
            throw FilterCompilationException.resolution("Member SQL is empty", member.fullName());
        }
        if (member.referencesTable()) {
            if (ctx.tableAlias() == null) {
                throw FilterCompilationException.resolution(
                    "Member SQL references " + SqlMember.TABLE_PLACEHOLDER +
                    " but no table alias is set", member.fullName());
            }
            sql = sql.replace(SqlMember.TABLE_PLACEHOLDER,
                              SQLQuoting.quoteIdentifierIfNeeded(ctx.tableAlias()));
        }
        return sql;
    }
}
