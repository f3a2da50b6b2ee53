package com.filterduck.generator;

/**
 * DuckDB renderings.
 *
 * <pre>
 *   CAST(? AS TIMESTAMPTZ)
 *   (CAST(? AS TIMESTAMPTZ) - INTERVAL '2 day')
 * </pre>
 */
public final class DuckDBFilterTemplates extends AbstractFilterTemplates {

    private static final DuckDBFilterTemplates INSTANCE = new DuckDBFilterTemplates();

    public static DuckDBFilterTemplates get() {
        return INSTANCE;
    }

    private DuckDBFilterTemplates() {}

    @Override
    public String timestampParam(String placeholder) {
        return "CAST(%s AS TIMESTAMPTZ)".formatted(requireToken("placeholder", placeholder));
    }

    @Override
    protected String intervalArithmetic(String date, String op, String quotedInterval) {
        return "(%s %s INTERVAL %s)".formatted(date, op, quotedInterval);
    }
}
