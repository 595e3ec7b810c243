package com.ylm.attendance.payroll.model;

/**
 * A start/end pair exactly as it arrived from the attendance source.
 * Either side may be null or unparseable; the calculation drops such periods.
 */
public record RawPeriod(String start, String end) {
}
