package com.filterduck.filter;

import com.filterduck.exception.FilterCompilationException;
import com.filterduck.exception.FilterCompilationException.ErrorKind;
import com.filterduck.generator.FilterTemplates;
import com.filterduck.runtime.TimeSettings;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders one {@link FilterNode} against already-resolved member SQL.
 *
 * <p>Each operator has one strategy. The strategies decide which tokens go
 * where and which NULL guard applies; the node's {@link FilterTemplates}
 * decide the SQL syntax.
 */
final class FilterCompiler {

    /** Interval extension value that leaves a date-range bound as is. */
    static final String UNBOUNDED = "unbounded";

    private final FilterNode node;
    private final String memberSql;
    private final FilterTemplates templates;

    FilterCompiler(FilterNode node, String memberSql) {
        this.node = node;
        this.memberSql = memberSql;
        this.templates = node.tools().templates();
    }

    String compile() {
        return switch (node.operator()) {
            case EQUAL -> equalsWhere();
            case NOT_EQUAL -> notEqualsWhere();
            case IN_DATE_RANGE -> inDateRange();
            case IN_DATE_RANGE_EXTENDED -> inDateRangeExtended();
            case IN -> templates.inWhere(memberSql, node.filterAndAllocateValues(), node.isNeedNullCheck(false));
            case NOT_IN -> templates.notInWhere(memberSql, node.filterAndAllocateValues(), node.isNeedNullCheck(true));
            case SET -> templates.setWhere(memberSql);
            case NOT_SET -> templates.notSetWhere(memberSql);
            case GT -> templates.gt(memberSql, node.firstParam());
            case GTE -> templates.gte(memberSql, node.firstParam());
            case LT -> templates.lt(memberSql, node.firstParam());
            case LTE -> templates.lte(memberSql, node.firstParam());
            case CONTAINS -> likeWhere(false, true, true);
            case NOT_CONTAINS -> likeWhere(true, true, true);
            case STARTS_WITH -> likeWhere(false, false, true);
            case NOT_STARTS_WITH -> likeWhere(true, false, true);
            case ENDS_WITH -> likeWhere(false, true, false);
            case NOT_ENDS_WITH -> likeWhere(true, true, false);
        };
    }

    // ==================== Equality ====================

    private String equalsWhere() {
        boolean needNullCheck = node.isNeedNullCheck(false);
        if (node.isArrayValue()) {
            return templates.inWhere(memberSql, node.filterAndAllocateValues(), needNullCheck);
        }
        if (node.isValuesContainsNull()) {
            return templates.notSetWhere(memberSql);
        }
        return templates.equals(memberSql, node.firstParam(), needNullCheck);
    }

    private String notEqualsWhere() {
        boolean needNullCheck = node.isNeedNullCheck(true);
        if (node.isArrayValue()) {
            return templates.notInWhere(memberSql, node.filterAndAllocateValues(), needNullCheck);
        }
        if (node.isValuesContainsNull()) {
            return templates.setWhere(memberSql);
        }
        return templates.notEquals(memberSql, node.firstParam(), needNullCheck);
    }

    // ==================== Pattern Matching ====================

    /**
     * One ILIKE per non-null value, ORed (positive) or ANDed (negated), then
     * the NULL guard: {@code OR m IS NULL} for a positive filter listing
     * NULL, {@code AND m IS NOT NULL} for a negated filter that does not.
     */
    private String likeWhere(boolean negated, boolean startWild, boolean endWild) {
        if (node.values().isEmpty()) {
            throw new FilterCompilationException(ErrorKind.ARGUMENT_COUNT,
                "Expected at least one value for " + node.operator().operatorName(), node.memberName());
        }
        List<String> likeParts = new ArrayList<>();
        for (String placeholder : node.filterAndAllocateValues()) {
            likeParts.add(templates.ilike(memberSql, placeholder, startWild, endWild, negated));
        }
        if (likeParts.isEmpty()) {
            // only NULLs were given
            return negated ? templates.setWhere(memberSql) : templates.notSetWhere(memberSql);
        }

        String nullCheck = "";
        if (node.isNeedNullCheck(negated)) {
            nullCheck = negated ? templates.andIsNotNullCheck(memberSql) : templates.orIsNullCheck(memberSql);
        }
        String logicalSymbol = negated ? " AND " : " OR ";
        return "(" + String.join(logicalSymbol, likeParts) + ")" + nullCheck;
    }

    // ==================== Date Ranges ====================

    private String inDateRange() {
        String[] bounds = allocateDateParams();
        return templates.timeRangeFilter(memberSql, bounds[0], bounds[1]);
    }

    private String inDateRangeExtended() {
        String[] bounds = allocateDateParams();
        List<String> values = node.values();
        String from = bounds[0];
        String to = bounds[1];
        if (values.size() >= 3) {
            from = extendDateRangeBound(from, values.get(2), true);
        }
        if (values.size() >= 4) {
            to = extendDateRangeBound(to, values.get(3), false);
        }
        return templates.timeRangeFilter(memberSql, from, to);
    }

    private String extendDateRangeBound(String date, String interval, boolean isSub) {
        if (interval == null || UNBOUNDED.equals(interval)) {
            return date;
        }
        return isSub ? templates.subInterval(date, interval) : templates.addInterval(date, interval);
    }

    /**
     * Validates, normalizes, converts and allocates both bounds.
     *
     * @return {from, to} as cast parameter expressions
     */
    private String[] allocateDateParams() {
        List<String> values = node.values();
        if (values.size() < 2) {
            throw new FilterCompilationException(ErrorKind.ARGUMENT_COUNT,
                "2 arguments expected for date range, got " + values.size(), node.memberName());
        }
        String fromValue = values.get(0);
        String toValue = values.get(1);
        if (fromValue == null || toValue == null) {
            throw new FilterCompilationException(ErrorKind.MISSING_BOUND,
                "Arguments for date range is not valid", node.memberName());
        }

        TimeSettings time = node.tools().timeSettings();
        int precision = time.timestampPrecision();
        String from = time.inDbTimeZone(DateRangeNormalizer.formatFromDate(fromValue, precision));
        String to = time.inDbTimeZone(DateRangeNormalizer.formatToDate(toValue, precision));

        return new String[] {
            templates.timestampParam(node.tools().allocateParam(from)),
            templates.timestampParam(node.tools().allocateParam(to))
        };
    }
}
