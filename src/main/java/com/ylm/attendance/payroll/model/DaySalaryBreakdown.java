package com.ylm.attendance.payroll.model;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Calculated pay for one attendance record.
 */
public final class DaySalaryBreakdown {

    private final String label;
    private final LocalDate date;
    private final double regularHours;
    private final double overtime125Hours;
    private final double overtime150Hours;
    private final double dayTotal;
    private final boolean weekendPremiumApplied;
    private final List<RawPeriod> rawPeriods;

    public DaySalaryBreakdown(String label, LocalDate date, TierAllocation tiers, double dayTotal,
                              boolean weekendPremiumApplied, List<RawPeriod> rawPeriods) {
        this.label = label;
        this.date = date;
        this.regularHours = tiers.regularHours();
        this.overtime125Hours = tiers.overtime125Hours();
        this.overtime150Hours = tiers.overtime150Hours();
        this.dayTotal = dayTotal;
        this.weekendPremiumApplied = weekendPremiumApplied;
        this.rawPeriods = rawPeriods == null ? List.of() : List.copyOf(rawPeriods);
    }

    /**
     * ISO date when the record's date could be resolved, otherwise the literal date text.
     */
    public String getLabel() { return label; }

    public Optional<LocalDate> getDate() { return Optional.ofNullable(date); }

    public double getRegularHours() { return regularHours; }

    public double getOvertime125Hours() { return overtime125Hours; }

    public double getOvertime150Hours() { return overtime150Hours; }

    public double getTotalHours() {
        return regularHours + overtime125Hours + overtime150Hours;
    }

    public double getDayTotal() { return dayTotal; }

    public boolean isWeekendPremiumApplied() { return weekendPremiumApplied; }

    /** Periods that contributed to the totals, in entry order. */
    public List<RawPeriod> getRawPeriods() { return rawPeriods; }
}
