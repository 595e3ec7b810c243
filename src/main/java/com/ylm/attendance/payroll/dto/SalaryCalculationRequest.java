package com.ylm.attendance.payroll.dto;

import jakarta.validation.constraints.NotNull;

import java.util.List;

public class SalaryCalculationRequest {

    @NotNull(message = "Records must be provided")
    private List<AttendanceEntryRequest> records;

    // store the report as the latest one when true
    private boolean persist;

    public List<AttendanceEntryRequest> getRecords() { return records; }
    public void setRecords(List<AttendanceEntryRequest> records) { this.records = records; }

    public boolean isPersist() { return persist; }
    public void setPersist(boolean persist) { this.persist = persist; }
}
