package com.ylm.attendance.payroll.model;

import java.time.LocalDateTime;

/**
 * Absolute weekend-premium interval for one week, half-open: {@code [start, end)}.
 */
public record WeekendWindow(LocalDateTime start, LocalDateTime end) {

    public boolean overlaps(LocalDateTime periodStart, LocalDateTime periodEnd) {
        return periodStart.isBefore(end) && periodEnd.isAfter(start);
    }
}
