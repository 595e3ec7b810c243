package com.ylm.attendance.payroll.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public class SalaryReportResponse {
    private int year;
    private int month;
    private double total;

    @JsonProperty("days_worked")
    private int daysWorked;

    @JsonProperty("total_hours")
    private double totalHours;

    @JsonProperty("regular_hours")
    private double regularHours;

    @JsonProperty("overtime_125_hours")
    private double overtime125Hours;

    @JsonProperty("overtime_150_hours")
    private double overtime150Hours;

    private List<DaySalaryResponse> days;

    public int getYear() { return year; }
    public void setYear(int year) { this.year = year; }

    public int getMonth() { return month; }
    public void setMonth(int month) { this.month = month; }

    public double getTotal() { return total; }
    public void setTotal(double total) { this.total = total; }

    public int getDaysWorked() { return daysWorked; }
    public void setDaysWorked(int daysWorked) { this.daysWorked = daysWorked; }

    public double getTotalHours() { return totalHours; }
    public void setTotalHours(double totalHours) { this.totalHours = totalHours; }

    public double getRegularHours() { return regularHours; }
    public void setRegularHours(double regularHours) { this.regularHours = regularHours; }

    public double getOvertime125Hours() { return overtime125Hours; }
    public void setOvertime125Hours(double overtime125Hours) { this.overtime125Hours = overtime125Hours; }

    public double getOvertime150Hours() { return overtime150Hours; }
    public void setOvertime150Hours(double overtime150Hours) { this.overtime150Hours = overtime150Hours; }

    public List<DaySalaryResponse> getDays() { return days; }
    public void setDays(List<DaySalaryResponse> days) { this.days = days; }
}
