package io.quantum.core.model;

/** Iteration kinds of {@code q:loop}. */
public enum LoopType {
    /** Inclusive numeric range: {@code from}, {@code to}, optional {@code step}. */
    RANGE,
    /** A list value given by {@code items}. */
    ARRAY,
    /** A delimited string given by {@code items} and {@code delimiter}. */
    LIST,
    /** Rows of a query result named by {@code query}. */
    QUERY
}
