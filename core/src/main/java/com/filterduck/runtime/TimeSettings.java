package com.filterduck.runtime;

/**
 * Source of timestamp precision and timezone conversion for date filters.
 */
public interface TimeSettings {

    /**
     * Returns the number of fractional-second digits the database uses.
     *
     * <p>Only 3 and 6 are supported by the date normalizer; other values are
     * reported as configuration errors when a date filter is compiled.
     *
     * @return the precision
     */
    int timestampPrecision();

    /**
     * Converts a local timestamp into the database timezone.
     *
     * @param localTimestamp timestamp text in {@code YYYY-MM-DDTHH:MM:SS.fff} form
     * @return the converted timestamp text
     */
    String inDbTimeZone(String localTimestamp);
}
