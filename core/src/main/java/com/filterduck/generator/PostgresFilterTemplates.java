package com.filterduck.generator;

/**
 * PostgreSQL renderings.
 *
 * <pre>
 *   ?::timestamptz
 *   ?::timestamptz - interval '2 day'
 * </pre>
 */
public final class PostgresFilterTemplates extends AbstractFilterTemplates {

    private static final PostgresFilterTemplates INSTANCE = new PostgresFilterTemplates();

    public static PostgresFilterTemplates get() {
        return INSTANCE;
    }

    private PostgresFilterTemplates() {}

    @Override
    public String timestampParam(String placeholder) {
        return requireToken("placeholder", placeholder) + "::timestamptz";
    }

    @Override
    protected String intervalArithmetic(String date, String op, String quotedInterval) {
        return "%s %s interval %s".formatted(date, op, quotedInterval);
    }
}
