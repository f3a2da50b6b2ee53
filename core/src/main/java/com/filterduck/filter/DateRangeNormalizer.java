package com.filterduck.filter;

import com.filterduck.exception.FilterCompilationException;
import com.filterduck.exception.FilterCompilationException.ErrorKind;

import java.util.regex.Pattern;

/**
 * Normalizes date-range bounds to local timestamp text at a fixed precision.
 *
 * <p>Only three shapes are accepted; there is no general date parsing:
 * <ul>
 *   <li>{@code YYYY-MM-DDTHH:MM:SS.SSS}</li>
 *   <li>{@code YYYY-MM-DDTHH:MM:SS.SSSSSS}</li>
 *   <li>{@code YYYY-MM-DD}, expanded to the start or end of the day</li>
 * </ul>
 *
 * <p>At precision 6 a millisecond upper bound ending in {@code .999} is read
 * as "through the end of that millisecond" and padded with {@code 999}.
 */
public final class DateRangeNormalizer {

    private static final Pattern DATE_TIME_LOCAL_MS =
        Pattern.compile("^\\d\\d\\d\\d-\\d\\d-\\d\\dT\\d\\d:\\d\\d:\\d\\d\\.\\d\\d\\d$");
    private static final Pattern DATE_TIME_LOCAL_U =
        Pattern.compile("^\\d\\d\\d\\d-\\d\\d-\\d\\dT\\d\\d:\\d\\d:\\d\\d\\.\\d\\d\\d\\d\\d\\d$");
    private static final Pattern DATE =
        Pattern.compile("^\\d\\d\\d\\d-\\d\\d-\\d\\d$");

    private DateRangeNormalizer() {}

    /**
     * Normalizes a lower bound.
     *
     * @param date the bound as supplied
     * @param precision fractional-second digits, 3 or 6
     * @return the normalized local timestamp
     * @throws FilterCompilationException UNSUPPORTED_PRECISION or UNRECOGNIZED_DATE_FORMAT
     */
    public static String formatFromDate(String date, int precision) {
        return format(date, precision, false);
    }

    /**
     * Normalizes an upper bound.
     *
     * @param date the bound as supplied
     * @param precision fractional-second digits, 3 or 6
     * @return the normalized local timestamp
     * @throws FilterCompilationException UNSUPPORTED_PRECISION or UNRECOGNIZED_DATE_FORMAT
     */
    public static String formatToDate(String date, int precision) {
        return format(date, precision, true);
    }

    private static String format(String date, int precision, boolean upperBound) {
        if (precision == 3) {
            if (DATE_TIME_LOCAL_MS.matcher(date).matches()) {
                return date;
            }
        } else if (precision == 6) {
            if (DATE_TIME_LOCAL_MS.matcher(date).matches()) {
                return upperBound && date.endsWith(".999") ? date + "999" : date + "000";
            }
            if (DATE_TIME_LOCAL_U.matcher(date).matches()) {
                return date;
            }
        } else {
            throw new FilterCompilationException(ErrorKind.UNSUPPORTED_PRECISION,
                "Unsupported timestamp precision: " + precision);
        }

        if (DATE.matcher(date).matches()) {
            return upperBound
                ? date + "T23:59:59." + "9".repeat(precision)
                : date + "T00:00:00." + "0".repeat(precision);
        }
        throw new FilterCompilationException(ErrorKind.UNRECOGNIZED_DATE_FORMAT,
            "Unsupported date format: " + date);
    }
}
