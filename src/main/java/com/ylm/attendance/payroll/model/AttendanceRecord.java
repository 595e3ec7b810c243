package com.ylm.attendance.payroll.model;

import java.util.List;
import java.util.Optional;

/**
 * A single workday as reported by the attendance source: the date text,
 * the periods punched on that day in the order they were entered, and an
 * optional clock-in/clock-out pair used when none of the periods are usable.
 */
public final class AttendanceRecord {

    private final String dateText;
    private final List<RawPeriod> periods;
    private final RawPeriod clockPair;

    public AttendanceRecord(String dateText, List<RawPeriod> periods) {
        this(dateText, periods, null);
    }

    public AttendanceRecord(String dateText, List<RawPeriod> periods, RawPeriod clockPair) {
        this.dateText = dateText;
        this.periods = periods == null ? List.of() : List.copyOf(periods);
        this.clockPair = clockPair;
    }

    public String getDateText() { return dateText; }

    public List<RawPeriod> getPeriods() { return periods; }

    public Optional<RawPeriod> getClockPair() { return Optional.ofNullable(clockPair); }

    @Override
    public String toString() {
        return "AttendanceRecord{date=" + dateText + ", periods=" + periods.size()
                + (clockPair != null ? ", clock=" + clockPair : "") + "}";
    }
}
