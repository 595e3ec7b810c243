package com.ylm.attendance.payroll.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One day of attendance as delivered by the scraper: either a list of
 * {@code [start, end]} pairs or a single clock-in/clock-out pair.
 */
public class AttendanceEntryRequest {

    private String date;

    private List<List<String>> periods;

    @JsonProperty("clock_in")
    private String clockIn;

    @JsonProperty("clock_out")
    private String clockOut;

    public AttendanceEntryRequest() {
    }

    public AttendanceEntryRequest(String date, List<List<String>> periods) {
        this.date = date;
        this.periods = periods;
    }

    public String getDate() { return date; }
    public void setDate(String date) { this.date = date; }

    public List<List<String>> getPeriods() { return periods; }
    public void setPeriods(List<List<String>> periods) { this.periods = periods; }

    public String getClockIn() { return clockIn; }
    public void setClockIn(String clockIn) { this.clockIn = clockIn; }

    public String getClockOut() { return clockOut; }
    public void setClockOut(String clockOut) { this.clockOut = clockOut; }
}
