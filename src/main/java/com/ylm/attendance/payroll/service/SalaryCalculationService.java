package com.ylm.attendance.payroll.service;

import com.ylm.attendance.payroll.exception.NoRecordsProvidedException;
import com.ylm.attendance.payroll.model.AnomalyKind;
import com.ylm.attendance.payroll.model.AttendanceRecord;
import com.ylm.attendance.payroll.model.DaySalaryBreakdown;
import com.ylm.attendance.payroll.model.PayrollConfig;
import com.ylm.attendance.payroll.model.Period;
import com.ylm.attendance.payroll.model.RawPeriod;
import com.ylm.attendance.payroll.model.SalaryReport;
import com.ylm.attendance.payroll.model.TimeOfDay;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.ylm.attendance.payroll.service.TimeModel.roundCurrency;
import static com.ylm.attendance.payroll.service.TimeModel.roundHours;

/**
 * Turns attendance records into a salary report. Holds no state between calls; the only
 * input besides the arguments is the clock, read when the first record's date cannot be resolved.
 */
@Service
@RequiredArgsConstructor
public class SalaryCalculationService {

    private static final Logger logger = LoggerFactory.getLogger(SalaryCalculationService.class);

    private final TimeModel timeModel;
    private final WeekendWindowCalculator weekendWindowCalculator;
    private final HourAllocator hourAllocator;
    private final Clock clock;

    /**
     * Compute one breakdown per record, in input order.
     * <p>
     * The report month and year come from the first record's date. If that date cannot be resolved
     * the current date is used instead; callers should not rely on the month in that case.
     *
     * @throws NoRecordsProvidedException if {@code records} is null or empty
     */
    public SalaryReport compute(List<AttendanceRecord> records, PayrollConfig config) {
        if (records == null || records.isEmpty()) {
            logger.warn("No records provided for calculation");
            throw new NoRecordsProvidedException();
        }

        LocalDate reportDate = timeModel.parseDate(records.get(0).getDateText())
                .orElseGet(() -> {
                    LocalDate today = LocalDate.now(clock);
                    logger.warn("Could not determine date from first record '{}', using current month {}",
                            records.get(0).getDateText(), today.getMonth());
                    return today;
                });
        logger.info("Starting salary calculation for {}/{} with {} records",
                reportDate.getMonthValue(), reportDate.getYear(), records.size());

        List<DaySalaryBreakdown> days = new ArrayList<>(records.size());
        double total = 0.0;
        for (AttendanceRecord record : records) {
            DaySalaryBreakdown day = computeDay(record, config);
            days.add(day);
            total += day.getDayTotal();
        }

        SalaryReport report = new SalaryReport(reportDate.getYear(), reportDate.getMonthValue(), days,
                roundCurrency(total));
        logger.info("Salary calculation completed for {}/{}: {} days, total {}",
                report.getMonth(), report.getYear(), days.size(), report.getTotal());
        return report;
    }

    DaySalaryBreakdown computeDay(AttendanceRecord record, PayrollConfig config) {
        Optional<LocalDate> date = timeModel.parseDate(record.getDateText());
        if (date.isEmpty()) {
            logger.warn("{}: '{}', weekend premium check skipped", AnomalyKind.UNPARSEABLE_DATE, record.getDateText());
        }
        String label = date.map(LocalDate::toString).orElse(record.getDateText());

        List<RawPeriod> accepted = new ArrayList<>();
        List<Period> parsed = new ArrayList<>();
        for (RawPeriod raw : record.getPeriods()) {
            Optional<Period> period = toPeriod(raw);
            if (period.isEmpty()) {
                logger.debug("{}: skipping period {} on {}", AnomalyKind.UNPARSEABLE_TIME, raw, label);
                continue;
            }
            accepted.add(raw);
            parsed.add(period.get());
        }
        // the clock pair stands in only when no listed period was usable
        if (accepted.isEmpty() && record.getClockPair().isPresent()) {
            RawPeriod clock = record.getClockPair().get();
            Optional<Period> period = toPeriod(clock);
            if (period.isPresent()) {
                accepted.add(clock);
                parsed.add(period.get());
            } else {
                logger.debug("{}: skipping clock pair {} on {}", AnomalyKind.UNPARSEABLE_TIME, clock, label);
            }
        }

        double totalHours = 0.0;
        boolean weekendApplied = false;
        for (Period period : parsed) {
            totalHours += timeModel.durationHours(period.start(), period.end());
            if (date.isPresent() && weekendWindowCalculator.overlaps(date.get(), period,
                    config.getWeekendStart(), config.getWeekendEnd())) {
                weekendApplied = true;
            }
        }

        return hourAllocator.breakdown(label, date.orElse(null), roundHours(totalHours), weekendApplied,
                accepted, config);
    }

    private Optional<Period> toPeriod(RawPeriod raw) {
        Optional<TimeOfDay> start = timeModel.parseTime(raw.start());
        Optional<TimeOfDay> end = timeModel.parseTime(raw.end());
        if (start.isEmpty() || end.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new Period(start.get(), end.get()));
    }
}
