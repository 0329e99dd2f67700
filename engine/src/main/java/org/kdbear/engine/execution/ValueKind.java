package org.kdbear.engine.execution;

/**
 * Cases of the canonical {@link Value}.
 *
 * Temporal cases are offsets from 2000-01-01 in a case-specific unit.
 */
public enum ValueKind {
    NULL,
    BOOLEAN,
    BYTE,
    SHORT,
    INTEGER,
    LONG,
    REAL,
    FLOAT,
    CHAR,
    SYMBOL,
    /** nanoseconds since epoch */
    TIMESTAMP,
    /** months since epoch */
    MONTH,
    /** days since epoch */
    DATE,
    /** fractional days since epoch */
    DATETIME,
    /** nanoseconds */
    TIMESPAN,
    /** minutes since midnight */
    MINUTE,
    /** seconds since midnight */
    SECOND,
    /** milliseconds since midnight */
    TIME
}
