package com.filterduck.generator;

import com.filterduck.exception.FilterCompilationException;

import java.util.List;

/**
 * ANSI renderings shared by the shipped dialects.
 *
 * <p>Subclasses supply the timestamp cast and interval arithmetic, which is
 * where the supported dialects differ.
 *
 * <p>An IN list needs at least one value. When a filter only supplied NULLs
 * the list is empty, and the guard alone decides the result: a positive list
 * with its null guard becomes {@code IS NULL}, a negated list without one
 * becomes {@code IS NOT NULL}. Any other empty list is rejected.
 */
public abstract class AbstractFilterTemplates implements FilterTemplates {

    @Override
    public String equals(String column, String value, boolean isNullCheck) {
        return "%s = %s%s".formatted(
            requireToken("column", column), requireToken("value", value), nullCheck(column, isNullCheck));
    }

    @Override
    public String notEquals(String column, String value, boolean isNullCheck) {
        return "%s <> %s%s".formatted(
            requireToken("column", column), requireToken("value", value), nullCheck(column, isNullCheck));
    }

    @Override
    public String inWhere(String column, List<String> values, boolean isNullCheck) {
        requireToken("column", column);
        if (values == null || values.isEmpty()) {
            if (isNullCheck) {
                return notSetWhere(column);
            }
            throw FilterCompilationException.template("IN clause requires at least one value");
        }
        return "%s IN (%s)%s".formatted(column, joinValues(values), nullCheck(column, isNullCheck));
    }

    @Override
    public String notInWhere(String column, List<String> values, boolean isNullCheck) {
        requireToken("column", column);
        if (values == null || values.isEmpty()) {
            if (!isNullCheck) {
                return setWhere(column);
            }
            throw FilterCompilationException.template("NOT IN clause requires at least one value");
        }
        return "%s NOT IN (%s)%s".formatted(column, joinValues(values), nullCheck(column, isNullCheck));
    }

    @Override
    public String setWhere(String column) {
        return requireToken("column", column) + " IS NOT NULL";
    }

    @Override
    public String notSetWhere(String column) {
        return requireToken("column", column) + " IS NULL";
    }

    @Override
    public String gt(String column, String param) {
        return comparison(column, ">", param);
    }

    @Override
    public String gte(String column, String param) {
        return comparison(column, ">=", param);
    }

    @Override
    public String lt(String column, String param) {
        return comparison(column, "<", param);
    }

    @Override
    public String lte(String column, String param) {
        return comparison(column, "<=", param);
    }

    @Override
    public String ilike(String column, String value, boolean startWild, boolean endWild, boolean negated) {
        String pattern = likePattern(requireToken("value", value), startWild, endWild);
        String not = negated ? "NOT " : "";
        return "%s %sILIKE %s".formatted(requireToken("column", column), not, pattern);
    }

    @Override
    public String orIsNullCheck(String column) {
        return " OR " + requireToken("column", column) + " IS NULL";
    }

    @Override
    public String andIsNotNullCheck(String column) {
        return " AND " + requireToken("column", column) + " IS NOT NULL";
    }

    @Override
    public String timeRangeFilter(String column, String fromTimestamp, String toTimestamp) {
        requireToken("column", column);
        return "%s >= %s AND %s <= %s".formatted(
            column, requireToken("from", fromTimestamp), column, requireToken("to", toTimestamp));
    }

    @Override
    public String addInterval(String date, String interval) {
        return intervalArithmetic(requireToken("date", date), "+", quoteInterval(interval));
    }

    @Override
    public String subInterval(String date, String interval) {
        return intervalArithmetic(requireToken("date", date), "-", quoteInterval(interval));
    }

    /**
     * Renders {@code date <op> interval}.
     *
     * @param date the timestamp expression
     * @param op "+" or "-"
     * @param quotedInterval the interval, already quoted, e.g. {@code '2 day'}
     * @return the SQL
     */
    protected abstract String intervalArithmetic(String date, String op, String quotedInterval);

    /**
     * Builds the pattern operand of a LIKE from a placeholder.
     *
     * @param value the placeholder
     * @param startWild prepend a wildcard
     * @param endWild append a wildcard
     * @return the pattern expression
     */
    protected String likePattern(String value, boolean startWild, boolean endWild) {
        StringBuilder pattern = new StringBuilder();
        if (startWild) {
            pattern.append("'%' || ");
        }
        pattern.append(value);
        if (endWild) {
            pattern.append(" || '%'");
        }
        return pattern.toString();
    }

    private String comparison(String column, String op, String param) {
        return "%s %s %s".formatted(requireToken("column", column), op, requireToken("param", param));
    }

    private String nullCheck(String column, boolean isNullCheck) {
        return isNullCheck ? orIsNullCheck(column) : "";
    }

    private static String joinValues(List<String> values) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(requireToken("value", values.get(i)));
        }
        return sb.toString();
    }

    private static String quoteInterval(String interval) {
        if (!SQLQuoting.isValidInterval(interval)) {
            throw FilterCompilationException.template("Invalid interval: " + interval);
        }
        return SQLQuoting.quoteInterval(interval);
    }

    protected static String requireToken(String name, String token) {
        if (token == null || token.isBlank()) {
            throw FilterCompilationException.template(name + " must not be empty");
        }
        return token;
    }
}
