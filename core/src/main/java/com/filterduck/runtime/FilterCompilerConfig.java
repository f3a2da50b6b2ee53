package com.filterduck.runtime;

import com.filterduck.exception.FilterCompilationException;
import com.filterduck.exception.FilterCompilationException.ErrorKind;
import com.filterduck.generator.SqlDialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Objects;
import java.util.Properties;

/**
 * Filter compiler configuration.
 *
 * <p>{@link #load()} reads {@value #RESOURCE_NAME} from the classpath (if
 * present) and then applies system properties with the same keys on top:
 * <ul>
 *   <li>{@code filterduck.dialect}: postgres (default) or duckdb</li>
 *   <li>{@code filterduck.timestamp.precision}: fractional-second digits, 3 (default) or 6</li>
 *   <li>{@code filterduck.timezone.query}: zone filter values are written in (default UTC)</li>
 *   <li>{@code filterduck.timezone.database}: zone the database expects (default UTC)</li>
 *   <li>{@code filterduck.placeholder.style}: positional (default) or numbered</li>
 * </ul>
 *
 * <p>A non-numeric precision is rejected here. The numeric range is not
 * checked; a precision other than 3 or 6 fails when a date-range filter is
 * compiled.
 */
public final class FilterCompilerConfig {

    private static final Logger logger = LoggerFactory.getLogger(FilterCompilerConfig.class);

    public static final String RESOURCE_NAME = "filterduck.properties";

    public static final String PROP_DIALECT = "filterduck.dialect";
    public static final String PROP_TIMESTAMP_PRECISION = "filterduck.timestamp.precision";
    public static final String PROP_QUERY_TIMEZONE = "filterduck.timezone.query";
    public static final String PROP_DATABASE_TIMEZONE = "filterduck.timezone.database";
    public static final String PROP_PLACEHOLDER_STYLE = "filterduck.placeholder.style";

    public static final int DEFAULT_TIMESTAMP_PRECISION = 3;

    private final SqlDialect dialect;
    private final int timestampPrecision;
    private final ZoneId queryTimeZone;
    private final ZoneId databaseTimeZone;
    private final PlaceholderStyle placeholderStyle;

    public FilterCompilerConfig(SqlDialect dialect, int timestampPrecision, ZoneId queryTimeZone,
                                ZoneId databaseTimeZone, PlaceholderStyle placeholderStyle) {
        this.dialect = Objects.requireNonNull(dialect, "dialect must not be null");
        this.timestampPrecision = timestampPrecision;
        this.queryTimeZone = Objects.requireNonNull(queryTimeZone, "queryTimeZone must not be null");
        this.databaseTimeZone = Objects.requireNonNull(databaseTimeZone, "databaseTimeZone must not be null");
        this.placeholderStyle = Objects.requireNonNull(placeholderStyle, "placeholderStyle must not be null");
    }

    /**
     * Returns the built-in defaults: PostgreSQL, precision 3, UTC, positional placeholders.
     *
     * @return the default configuration
     */
    public static FilterCompilerConfig defaults() {
        return new FilterCompilerConfig(SqlDialect.POSTGRES, DEFAULT_TIMESTAMP_PRECISION,
            ZoneOffset.UTC, ZoneOffset.UTC, PlaceholderStyle.POSITIONAL);
    }

    /**
     * Loads configuration from the classpath resource and system properties.
     *
     * @return the configuration
     * @throws FilterCompilationException with kind CONFIGURATION on invalid values
     */
    public static FilterCompilerConfig load() {
        Properties props = new Properties();
        try (InputStream in = FilterCompilerConfig.class.getClassLoader().getResourceAsStream(RESOURCE_NAME)) {
            if (in != null) {
                props.load(in);
                logger.info("Loaded filter compiler configuration from {}", RESOURCE_NAME);
            }
        } catch (IOException e) {
            throw new FilterCompilationException(ErrorKind.CONFIGURATION,
                "Failed to read " + RESOURCE_NAME, null, e);
        }
        for (String key : new String[] {PROP_DIALECT, PROP_TIMESTAMP_PRECISION, PROP_QUERY_TIMEZONE,
                                        PROP_DATABASE_TIMEZONE, PROP_PLACEHOLDER_STYLE}) {
            String value = System.getProperty(key);
            if (value != null) {
                props.setProperty(key, value);
            }
        }
        return fromProperties(props);
    }

    /**
     * Builds a configuration from properties; missing keys take defaults.
     *
     * @param props the properties
     * @return the configuration
     * @throws FilterCompilationException with kind CONFIGURATION on invalid values
     */
    public static FilterCompilerConfig fromProperties(Properties props) {
        try {
            FilterCompilerConfig config = new FilterCompilerConfig(
                SqlDialect.parse(props.getProperty(PROP_DIALECT)),
                parsePrecision(props.getProperty(PROP_TIMESTAMP_PRECISION)),
                parseZone(props.getProperty(PROP_QUERY_TIMEZONE)),
                parseZone(props.getProperty(PROP_DATABASE_TIMEZONE)),
                PlaceholderStyle.parse(props.getProperty(PROP_PLACEHOLDER_STYLE)));
            logger.debug("Filter compiler configuration: {}", config);
            return config;
        } catch (IllegalArgumentException | DateTimeException e) {
            throw new FilterCompilationException(ErrorKind.CONFIGURATION, e.getMessage(), null, e);
        }
    }

    private static int parsePrecision(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT_TIMESTAMP_PRECISION;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                "Invalid %s: '%s' is not a number".formatted(PROP_TIMESTAMP_PRECISION, value), e);
        }
    }

    private static ZoneId parseZone(String value) {
        if (value == null || value.isBlank()) {
            return ZoneOffset.UTC;
        }
        return ZoneId.of(value.trim());
    }

    public SqlDialect dialect() {
        return dialect;
    }

    public int timestampPrecision() {
        return timestampPrecision;
    }

    public ZoneId queryTimeZone() {
        return queryTimeZone;
    }

    public ZoneId databaseTimeZone() {
        return databaseTimeZone;
    }

    public PlaceholderStyle placeholderStyle() {
        return placeholderStyle;
    }

    public FilterCompilerConfig withDialect(SqlDialect newDialect) {
        return new FilterCompilerConfig(newDialect, timestampPrecision, queryTimeZone,
                                        databaseTimeZone, placeholderStyle);
    }

    public FilterCompilerConfig withTimestampPrecision(int precision) {
        return new FilterCompilerConfig(dialect, precision, queryTimeZone,
                                        databaseTimeZone, placeholderStyle);
    }

    public FilterCompilerConfig withTimeZones(ZoneId query, ZoneId database) {
        return new FilterCompilerConfig(dialect, timestampPrecision, query, database, placeholderStyle);
    }

    public FilterCompilerConfig withPlaceholderStyle(PlaceholderStyle style) {
        return new FilterCompilerConfig(dialect, timestampPrecision, queryTimeZone,
                                        databaseTimeZone, style);
    }

    @Override
    public String toString() {
        return "FilterCompilerConfig(dialect=" + dialect + ", precision=" + timestampPrecision +
               ", queryTimeZone=" + queryTimeZone + ", databaseTimeZone=" + databaseTimeZone +
               ", placeholders=" + placeholderStyle + ")";
    }
}
