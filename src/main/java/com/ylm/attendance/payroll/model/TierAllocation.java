package com.ylm.attendance.payroll.model;

/**
 * Hours of a single day split across the three pay tiers.
 */
public record TierAllocation(double regularHours, double overtime125Hours, double overtime150Hours) {

    public static final TierAllocation ZERO = new TierAllocation(0.0, 0.0, 0.0);

    public double totalHours() {
        return regularHours + overtime125Hours + overtime150Hours;
    }
}
