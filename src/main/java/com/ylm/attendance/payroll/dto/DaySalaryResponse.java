package com.ylm.attendance.payroll.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public class DaySalaryResponse {
    private String date;

    @JsonProperty("regular_hours")
    private double regularHours;

    @JsonProperty("overtime_125_hours")
    private double overtime125Hours;

    @JsonProperty("overtime_150_hours")
    private double overtime150Hours;

    @JsonProperty("day_total")
    private double dayTotal;

    @JsonProperty("weekend_premium_applied")
    private boolean weekendPremiumApplied;

    @JsonProperty("raw_periods")
    private List<List<String>> rawPeriods;

    public String getDate() { return date; }
    public void setDate(String date) { this.date = date; }

    public double getRegularHours() { return regularHours; }
    public void setRegularHours(double regularHours) { this.regularHours = regularHours; }

    public double getOvertime125Hours() { return overtime125Hours; }
    public void setOvertime125Hours(double overtime125Hours) { this.overtime125Hours = overtime125Hours; }

    public double getOvertime150Hours() { return overtime150Hours; }
    public void setOvertime150Hours(double overtime150Hours) { this.overtime150Hours = overtime150Hours; }

    public double getDayTotal() { return dayTotal; }
    public void setDayTotal(double dayTotal) { this.dayTotal = dayTotal; }

    public boolean isWeekendPremiumApplied() { return weekendPremiumApplied; }
    public void setWeekendPremiumApplied(boolean weekendPremiumApplied) { this.weekendPremiumApplied = weekendPremiumApplied; }

    public List<List<String>> getRawPeriods() { return rawPeriods; }
    public void setRawPeriods(List<List<String>> rawPeriods) { this.rawPeriods = rawPeriods; }
}
