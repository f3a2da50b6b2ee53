package com.filterduck.generator;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Utilities for quoting SQL identifiers and literals in emitted filter SQL.
 *
 * <p>Filter values never reach the SQL text directly: they are bound as
 * parameters. What does get inlined is identifiers (column names, table
 * aliases) and interval literals used to extend date ranges, and both go
 * through this class.
 *
 * <p>Example usage:
 * <pre>
 *   SQLQuoting.quoteIdentifierIfNeeded("status");   // status
 *   SQLQuoting.quoteIdentifierIfNeeded("order");    // "order"
 *   SQLQuoting.quoteLiteral("O'Reilly");             // 'O''Reilly'
 *   SQLQuoting.quoteInterval("2 day");               // '2 day'
 * </pre>
 */
public final class SQLQuoting {

    /** One or more {@code <amount> <unit>} pairs, e.g. "1 year 2 months". */
    private static final Pattern INTERVAL_PATTERN =
        Pattern.compile("^-?\\d+ [a-zA-Z]+( -?\\d+ [a-zA-Z]+)*$");

    private static final Set<String> RESERVED_WORDS = Set.of(
        "SELECT", "FROM", "WHERE", "GROUP", "BY", "ORDER", "HAVING", "JOIN",
        "LEFT", "RIGHT", "INNER", "OUTER", "FULL", "CROSS", "ON", "USING", "AS",
        "AND", "OR", "NOT", "IN", "EXISTS", "CASE", "WHEN", "THEN", "ELSE", "END",
        "NULL", "TRUE", "FALSE", "UNION", "INTERSECT", "EXCEPT", "LIMIT", "OFFSET",
        "ALL", "DISTINCT", "IS", "BETWEEN", "LIKE", "ILIKE", "ASC", "DESC",
        "NULLS", "FIRST", "LAST", "INTERVAL", "TIMESTAMP", "DATE", "USER");

    private SQLQuoting() {}

    /**
     * Quotes an identifier (table name, column name, alias).
     *
     * <p>Uses double quotes and escapes internal quotes according to SQL standard.
     *
     * @param identifier the identifier to quote
     * @return quoted identifier safe for SQL
     * @throws IllegalArgumentException if identifier is null or empty
     */
    public static String quoteIdentifier(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }

        String escaped = identifier.replace("\"", "\"\"");
        return "\"" + escaped + "\"";
    }

    /**
     * Quotes an identifier only if needed.
     *
     * <p>Simple identifiers (letters, digits, underscores, not starting with a
     * digit, not reserved) are left bare to keep SQL readable.
     *
     * @param identifier the identifier to conditionally quote
     * @return the identifier, quoted if necessary
     * @throws IllegalArgumentException if identifier is null or empty
     */
    public static String quoteIdentifierIfNeeded(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }

        if (needsQuoting(identifier)) {
            return quoteIdentifier(identifier);
        }
        return identifier;
    }

    /**
     * Quotes a string literal value.
     *
     * <p>Returns NULL (without quotes) if the value is null.
     *
     * @param value the string value to quote
     * @return quoted literal safe for SQL, or NULL if value is null
     */
    public static String quoteLiteral(String value) {
        if (value == null) {
            return "NULL";
        }

        String escaped = value.replace("'", "''");
        return "'" + escaped + "'";
    }

    /**
     * Validates and quotes an interval literal such as {@code "2 day"}.
     *
     * @param interval the interval text
     * @return the quoted interval, e.g. {@code '2 day'}
     * @throws IllegalArgumentException if the text is not a sequence of
     *         {@code <amount> <unit>} pairs
     */
    public static String quoteInterval(String interval) {
        if (interval == null || !INTERVAL_PATTERN.matcher(interval.trim()).matches()) {
            throw new IllegalArgumentException("Invalid interval: " + interval);
        }
        return quoteLiteral(interval.trim());
    }

    /**
     * Checks whether a text is an acceptable interval literal.
     *
     * @param interval the interval text
     * @return true if {@link #quoteInterval} would accept it
     */
    public static boolean isValidInterval(String interval) {
        return interval != null && INTERVAL_PATTERN.matcher(interval.trim()).matches();
    }

    private static boolean needsQuoting(String identifier) {
        char first = identifier.charAt(0);
        if (!Character.isLetter(first) && first != '_') {
            return true;
        }

        for (int i = 0; i < identifier.length(); i++) {
            char c = identifier.charAt(i);
            if (!Character.isLetterOrDigit(c) && c != '_') {
                return true;
            }
        }

        return RESERVED_WORDS.contains(identifier.toUpperCase());
    }
}
