package com.ylm.attendance.payroll.model;

import java.time.DayOfWeek;

/**
 * A weekly recurring instant: weekday (0 = Monday ... 6 = Sunday) plus hour and minute.
 */
public record WeekdayTime(int weekday, int hour, int minute) {

    public DayOfWeek dayOfWeek() {
        return DayOfWeek.of(weekday + 1);
    }

    @Override
    public String toString() {
        return dayOfWeek() + " " + String.format("%02d:%02d", hour, minute);
    }
}
