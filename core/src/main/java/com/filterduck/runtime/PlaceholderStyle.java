package com.filterduck.runtime;

/**
 * How bind-parameter placeholders are spelled in emitted SQL.
 *
 * <ul>
 *   <li>{@code POSITIONAL} (default): {@code ?}, as used by JDBC</li>
 *   <li>{@code NUMBERED}: {@code $1}, {@code $2}, ... as used by PostgreSQL wire clients</li>
 * </ul>
 */
public enum PlaceholderStyle {
    POSITIONAL,
    NUMBERED;

    /**
     * Returns the placeholder for the parameter at a 1-based position.
     *
     * @param position the 1-based parameter position
     * @return the placeholder text
     */
    public String placeholder(int position) {
        return switch (this) {
            case POSITIONAL -> "?";
            case NUMBERED -> "$" + position;
        };
    }

    /**
     * Parse a style string (case-insensitive).
     *
     * @param value "positional" or "numbered"
     * @return the parsed style, POSITIONAL if value is null
     * @throws IllegalArgumentException if value is not recognized
     */
    public static PlaceholderStyle parse(String value) {
        if (value == null) {
            return POSITIONAL;
        }
        return switch (value.trim().toLowerCase()) {
            case "positional" -> POSITIONAL;
            case "numbered" -> NUMBERED;
            default -> throw new IllegalArgumentException(
                "Unknown placeholder style: '%s'. Valid values: positional, numbered".formatted(value));
        };
    }
}
