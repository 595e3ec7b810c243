package com.ylm.attendance.payroll.model;

/**
 * One parsed work shift within a calendar day. When {@code end} is not after
 * {@code start} the shift runs past midnight into the next day.
 */
public record Period(TimeOfDay start, TimeOfDay end) {

    public boolean crossesMidnight() {
        return end.compareTo(start) <= 0;
    }
}
