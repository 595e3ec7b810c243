package com.ylm.attendance.payroll.dto;

import com.fasterxml.jackson.annotation.JsonFormat;

import java.time.LocalDateTime;

/**
 * File representation of the most recent calculation.
 */
public class StoredSalaryReport {
    private boolean success;

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss")
    private LocalDateTime timestamp;

    private SalaryReportResponse report;

    public StoredSalaryReport() {
    }

    public StoredSalaryReport(LocalDateTime timestamp, SalaryReportResponse report) {
        this.success = true;
        this.timestamp = timestamp;
        this.report = report;
    }

    public boolean isSuccess() { return success; }
    public void setSuccess(boolean success) { this.success = success; }

    public LocalDateTime getTimestamp() { return timestamp; }
    public void setTimestamp(LocalDateTime timestamp) { this.timestamp = timestamp; }

    public SalaryReportResponse getReport() { return report; }
    public void setReport(SalaryReportResponse report) { this.report = report; }
}
