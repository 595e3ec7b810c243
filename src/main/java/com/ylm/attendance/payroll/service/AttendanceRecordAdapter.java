package com.ylm.attendance.payroll.service;

import com.ylm.attendance.payroll.dto.AttendanceEntryRequest;
import com.ylm.attendance.payroll.model.AttendanceRecord;
import com.ylm.attendance.payroll.model.RawPeriod;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Normalizes incoming attendance entries into {@link AttendanceRecord}s.
 * The clock-in/clock-out pair is carried separately and only counts when none of
 * the listed periods parse.
 */
@Component
public class AttendanceRecordAdapter {

    public List<AttendanceRecord> toRecords(List<AttendanceEntryRequest> entries) {
        if (entries == null) {
            return List.of();
        }
        List<AttendanceRecord> records = new ArrayList<>(entries.size());
        for (AttendanceEntryRequest entry : entries) {
            records.add(toRecord(entry));
        }
        return records;
    }

    public AttendanceRecord toRecord(AttendanceEntryRequest entry) {
        if (entry == null) {
            return new AttendanceRecord(null, List.of());
        }
        List<RawPeriod> periods = new ArrayList<>();
        if (entry.getPeriods() != null) {
            for (List<String> pair : entry.getPeriods()) {
                periods.add(toRawPeriod(pair));
            }
        }
        RawPeriod clockPair = null;
        if (entry.getClockIn() != null || entry.getClockOut() != null) {
            clockPair = new RawPeriod(entry.getClockIn(), entry.getClockOut());
        }
        return new AttendanceRecord(entry.getDate(), periods, clockPair);
    }

    // short pairs keep a null endpoint so the period is dropped rather than rejected here
    private RawPeriod toRawPeriod(List<String> pair) {
        if (pair == null) {
            return new RawPeriod(null, null);
        }
        String start = pair.size() > 0 ? pair.get(0) : null;
        String end = pair.size() > 1 ? pair.get(1) : null;
        return new RawPeriod(start, end);
    }
}
