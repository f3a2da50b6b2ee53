package com.filterduck.filter;

/**
 * Classifies what a filter applies to.
 *
 * <p>Recorded for downstream consumers that split filters between the WHERE
 * and HAVING clauses; rendering does not depend on it.
 */
public enum FilterKind {
    DIMENSION,
    MEASURE
}
