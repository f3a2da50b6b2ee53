package com.filterduck.runtime;

import com.filterduck.exception.FilterCompilationException;
import com.filterduck.exception.FilterCompilationException.ErrorKind;

import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * {@link TimeSettings} backed by {@code java.time} zones.
 *
 * <p>Local timestamps are read as wall-clock times in the query timezone and
 * re-expressed in the database timezone with an explicit offset:
 * <pre>
 *   query zone America/New_York, database zone UTC, precision 3
 *   2023-01-05T00:00:00.000  ->  2023-01-05T05:00:00.000Z
 * </pre>
 */
public final class ZoneTimeSettings implements TimeSettings {

    private final int precision;
    private final ZoneId queryZone;
    private final ZoneId databaseZone;

    /**
     * Creates time settings.
     *
     * @param precision fractional-second digits (validated when date filters compile)
     * @param queryZone zone the filter values are expressed in
     * @param databaseZone zone timestamps are sent to the database in
     */
    public ZoneTimeSettings(int precision, ZoneId queryZone, ZoneId databaseZone) {
        this.precision = precision;
        this.queryZone = Objects.requireNonNull(queryZone, "queryZone must not be null");
        this.databaseZone = Objects.requireNonNull(databaseZone, "databaseZone must not be null");
    }

    /**
     * Creates UTC-to-UTC settings with the given precision.
     *
     * @param precision fractional-second digits
     * @return the settings
     */
    public static ZoneTimeSettings utc(int precision) {
        return new ZoneTimeSettings(precision, ZoneOffset.UTC, ZoneOffset.UTC);
    }

    @Override
    public int timestampPrecision() {
        return precision;
    }

    public ZoneId queryZone() {
        return queryZone;
    }

    public ZoneId databaseZone() {
        return databaseZone;
    }

    @Override
    public String inDbTimeZone(String localTimestamp) {
        LocalDateTime local;
        try {
            local = LocalDateTime.parse(localTimestamp);
        } catch (DateTimeException e) {
            throw new FilterCompilationException(ErrorKind.UNRECOGNIZED_DATE_FORMAT,
                "Invalid timestamp: " + localTimestamp, null, e);
        }
        ZonedDateTime converted = local.atZone(queryZone).withZoneSameInstant(databaseZone);
        return converted.format(formatter());
    }

    private DateTimeFormatter formatter() {
        if (precision < 1 || precision > 9) {
            throw new FilterCompilationException(ErrorKind.UNSUPPORTED_PRECISION,
                "Unsupported timestamp precision: " + precision);
        }
        return DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss." + "S".repeat(precision) + "XXX");
    }

    @Override
    public String toString() {
        return "ZoneTimeSettings(precision=" + precision + ", query=" + queryZone +
               ", database=" + databaseZone + ")";
    }
}
