package com.ylm.attendance.payroll.model;

import java.util.List;

/**
 * Result of one salary calculation: one breakdown per input record, in input order.
 */
public final class SalaryReport {

    private final int year;
    private final int month;
    private final List<DaySalaryBreakdown> days;
    private final double total;

    public SalaryReport(int year, int month, List<DaySalaryBreakdown> days, double total) {
        this.year = year;
        this.month = month;
        this.days = List.copyOf(days);
        this.total = total;
    }

    public int getYear() { return year; }

    public int getMonth() { return month; }

    public List<DaySalaryBreakdown> getDays() { return days; }

    public double getTotal() { return total; }
}
