package com.filterduck.exception;

/**
 * Exception thrown when a filter cannot be compiled into SQL.
 *
 * <p>Every failure aborts compilation of the containing statement. The
 * {@link ErrorKind} tells callers what went wrong without parsing the message,
 * and the member name (when known) identifies the filter that failed.
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       String sql = filter.toSQL(context);
 *   } catch (FilterCompilationException e) {
 *       System.err.println(e.getUserMessage());
 *       System.err.println("Failed member: " + e.getMemberName());
 *   }
 * </pre>
 *
 * @see com.filterduck.filter.FilterNode#toSQL
 */
public class FilterCompilationException extends RuntimeException {

    /**
     * Categories of compilation failure.
     */
    public enum ErrorKind {
        /** An operator required more values than were supplied. */
        ARGUMENT_COUNT,
        /** A date-range bound is present in the list but holds no value. */
        MISSING_BOUND,
        /** Configured fractional-second precision is neither 3 nor 6. */
        UNSUPPORTED_PRECISION,
        /** A date literal matches none of the accepted shapes. */
        UNRECOGNIZED_DATE_FORMAT,
        /** The filtered member could not be turned into SQL text. */
        RESOLUTION,
        /** A template renderer rejected its inputs. */
        TEMPLATE,
        /** Invalid compiler configuration. */
        CONFIGURATION
    }

    private final ErrorKind kind;
    private final String memberName;

    /**
     * Creates a compilation exception.
     *
     * @param kind the failure category
     * @param message the error message
     */
    public FilterCompilationException(ErrorKind kind, String message) {
        this(kind, message, null, null);
    }

    /**
     * Creates a compilation exception bound to a member.
     *
     * @param kind the failure category
     * @param message the error message
     * @param memberName the member whose filter failed (may be null)
     */
    public FilterCompilationException(ErrorKind kind, String message, String memberName) {
        this(kind, message, memberName, null);
    }

    /**
     * Creates a compilation exception with a cause.
     *
     * @param kind the failure category
     * @param message the error message
     * @param memberName the member whose filter failed (may be null)
     * @param cause the underlying cause (may be null)
     */
    public FilterCompilationException(ErrorKind kind, String message, String memberName, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.memberName = memberName;
    }

    /**
     * Returns the failure category.
     *
     * @return the error kind
     */
    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Returns the name of the member whose filter failed.
     *
     * @return the member name, or null if not available
     */
    public String getMemberName() {
        return memberName;
    }

    /**
     * Returns a user-friendly error message.
     *
     * <p>Prefixes the raw message with guidance for the error category.
     *
     * @return user-friendly error message
     */
    public String getUserMessage() {
        String target = memberName != null ? " on '" + memberName + "'" : "";
        return switch (kind) {
            case ARGUMENT_COUNT -> "Filter" + target + " has too few values: " + getMessage();
            case MISSING_BOUND -> "Date range filter" + target +
                " needs both a start and an end date: " + getMessage();
            case UNSUPPORTED_PRECISION -> "Timestamp precision is misconfigured. " +
                "Supported precisions are 3 and 6: " + getMessage();
            case UNRECOGNIZED_DATE_FORMAT -> "Date value" + target +
                " must look like YYYY-MM-DD or YYYY-MM-DDTHH:MM:SS.SSS: " + getMessage();
            case RESOLUTION -> "Cannot resolve filtered member" + target + ": " + getMessage();
            case TEMPLATE -> "Cannot render SQL for filter" + target + ": " + getMessage();
            case CONFIGURATION -> "Filter compiler configuration is invalid: " + getMessage();
        };
    }

    /**
     * Returns a detailed technical message for debugging.
     *
     * @return technical error message with full context
     */
    public String getTechnicalMessage() {
        StringBuilder sb = new StringBuilder();
        sb.append("Filter Compilation Failed\n");
        sb.append("Kind: ").append(kind).append("\n");
        sb.append("Error: ").append(getMessage()).append("\n");

        if (memberName != null) {
            sb.append("Member: ").append(memberName).append("\n");
        }

        if (getCause() != null) {
            sb.append("Cause: ").append(getCause().getMessage()).append("\n");
        }

        return sb.toString();
    }

    public static FilterCompilationException argumentCount(String message) {
        return new FilterCompilationException(ErrorKind.ARGUMENT_COUNT, message);
    }

    public static FilterCompilationException template(String message) {
        return new FilterCompilationException(ErrorKind.TEMPLATE, message);
    }

    public static FilterCompilationException resolution(String message, String memberName) {
        return new FilterCompilationException(ErrorKind.RESOLUTION, message, memberName);
    }
}
