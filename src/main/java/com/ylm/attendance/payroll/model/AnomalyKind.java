package com.ylm.attendance.payroll.model;

/**
 * Malformed-data conditions that are recovered locally during a calculation.
 */
public enum AnomalyKind {
    UNPARSEABLE_TIME,
    UNPARSEABLE_DATE,
    NEGATIVE_DURATION
}
