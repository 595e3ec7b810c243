package com.ylm.attendance.payroll.service;

import com.ylm.attendance.payroll.model.Period;
import com.ylm.attendance.payroll.model.WeekdayTime;
import com.ylm.attendance.payroll.model.WeekendWindow;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * Locates the recurring weekly weekend-premium window relative to a work date.
 */
@Component
public class WeekendWindowCalculator {

    /**
     * The window anchored on the most recent occurrence of the start weekday at or before {@code date}.
     * The window end is the end weekday on or after the anchor, so a Friday 17:00 to Sunday 05:00
     * configuration gives the same window for any date from that Friday to the following Thursday.
     */
    public WeekendWindow windowFor(LocalDate date, WeekdayTime start, WeekdayTime end) {
        int weekday = date.getDayOfWeek().getValue() - 1;
        LocalDate anchor = date.minusDays(Math.floorMod(weekday - start.weekday(), 7));
        LocalDateTime windowStart = anchor.atTime(start.hour(), start.minute());
        LocalDate endDay = anchor.plusDays(Math.floorMod(end.weekday() - start.weekday(), 7));
        LocalDateTime windowEnd = endDay.atTime(end.hour(), end.minute());
        return new WeekendWindow(windowStart, windowEnd);
    }

    /**
     * Whether {@code period}, worked on {@code date}, overlaps that week's window. Touching either
     * boundary without any shared time does not count.
     */
    public boolean overlaps(LocalDate date, Period period, WeekdayTime start, WeekdayTime end) {
        WeekendWindow window = windowFor(date, start, end);
        LocalDateTime periodStart = date.atTime(period.start().toLocalTime());
        LocalDateTime periodEnd = date.atTime(period.end().toLocalTime());
        if (period.crossesMidnight()) {
            periodEnd = periodEnd.plusDays(1);
        }
        return window.overlaps(periodStart, periodEnd);
    }
}
