package com.ylm.attendance.payroll.service;

import com.ylm.attendance.payroll.model.AnomalyKind;
import com.ylm.attendance.payroll.model.DaySalaryBreakdown;
import com.ylm.attendance.payroll.model.PayrollConfig;
import com.ylm.attendance.payroll.model.RawPeriod;
import com.ylm.attendance.payroll.model.TierAllocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;

import static com.ylm.attendance.payroll.service.TimeModel.roundCurrency;
import static com.ylm.attendance.payroll.service.TimeModel.roundHours;

/**
 * Splits a day's hours into the regular, 125% and 150% tiers and prices them.
 */
@Component
public class HourAllocator {

    private static final Logger logger = LoggerFactory.getLogger(HourAllocator.class);

    public TierAllocation allocate(double totalHours, PayrollConfig config) {
        double hours = clampNegative(totalHours);
        double regular = Math.min(hours, config.getRegularLimit());
        double remaining = Math.max(0.0, hours - regular);
        double overtime125 = Math.min(remaining, Math.max(0.0, config.getLimit125() - config.getRegularLimit()));
        double overtime150 = Math.max(0.0, hours - regular - overtime125);
        return new TierAllocation(roundHours(regular), roundHours(overtime125), roundHours(overtime150));
    }

    /**
     * Weekend days put every hour in the 150% tier; other days use the tiered split.
     */
    public DaySalaryBreakdown breakdown(String label, LocalDate date, double totalHours, boolean weekendApplied,
                                        List<RawPeriod> periods, PayrollConfig config) {
        TierAllocation tiers;
        double dayTotal;
        if (weekendApplied) {
            double hours = roundHours(clampNegative(totalHours));
            tiers = new TierAllocation(0.0, 0.0, hours);
            dayTotal = roundCurrency(hours * config.getRate150());
        } else {
            tiers = allocate(totalHours, config);
            dayTotal = roundCurrency(tiers.regularHours() * config.getRateRegular()
                    + tiers.overtime125Hours() * config.getRate125()
                    + tiers.overtime150Hours() * config.getRate150());
        }
        return new DaySalaryBreakdown(label, date, tiers, dayTotal, weekendApplied, periods);
    }

    private double clampNegative(double totalHours) {
        if (totalHours < 0) {
            logger.warn("{}: total hours {} clamped to zero", AnomalyKind.NEGATIVE_DURATION, totalHours);
            return 0.0;
        }
        return totalHours;
    }
}
