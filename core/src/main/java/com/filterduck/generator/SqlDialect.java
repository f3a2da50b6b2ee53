package com.filterduck.generator;

/**
 * Supported SQL dialects and their template sets.
 */
public enum SqlDialect {
    POSTGRES,
    DUCKDB;

    /**
     * Returns the template set rendering this dialect.
     *
     * @return the templates
     */
    public FilterTemplates templates() {
        return switch (this) {
            case POSTGRES -> PostgresFilterTemplates.get();
            case DUCKDB -> DuckDBFilterTemplates.get();
        };
    }

    /**
     * Parse a dialect string (case-insensitive).
     *
     * @param value "postgres" (or "postgresql") or "duckdb"
     * @return the parsed dialect, POSTGRES if value is null
     * @throws IllegalArgumentException if value is not recognized
     */
    public static SqlDialect parse(String value) {
        if (value == null) {
            return POSTGRES;
        }
        return switch (value.trim().toLowerCase()) {
            case "postgres", "postgresql" -> POSTGRES;
            case "duckdb" -> DUCKDB;
            default -> throw new IllegalArgumentException(
                "Unknown SQL dialect: '%s'. Valid values: postgres, duckdb".formatted(value));
        };
    }
}
