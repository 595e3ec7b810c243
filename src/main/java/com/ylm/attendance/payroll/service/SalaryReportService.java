package com.ylm.attendance.payroll.service;

import com.ylm.attendance.payroll.dto.DaySalaryResponse;
import com.ylm.attendance.payroll.dto.SalaryCalculationRequest;
import com.ylm.attendance.payroll.dto.SalaryReportResponse;
import com.ylm.attendance.payroll.dto.StoredSalaryReport;
import com.ylm.attendance.payroll.exception.ResourceNotFoundException;
import com.ylm.attendance.payroll.model.AttendanceRecord;
import com.ylm.attendance.payroll.model.DaySalaryBreakdown;
import com.ylm.attendance.payroll.model.PayrollConfig;
import com.ylm.attendance.payroll.model.SalaryReport;
import com.ylm.attendance.payroll.repository.SalaryReportStore;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

import static com.ylm.attendance.payroll.service.TimeModel.roundHours;

@Service
@RequiredArgsConstructor
public class SalaryReportService {

    private static final Logger logger = LoggerFactory.getLogger(SalaryReportService.class);

    private final AttendanceRecordAdapter attendanceRecordAdapter;
    private final SalaryCalculationService salaryCalculationService;
    private final SalaryReportStore salaryReportStore;
    private final PayrollConfig payrollConfig;
    private final Clock clock;

    public SalaryReportResponse calculate(SalaryCalculationRequest request) {
        List<AttendanceRecord> records = attendanceRecordAdapter.toRecords(request.getRecords());
        SalaryReport report = salaryCalculationService.compute(records, payrollConfig);
        SalaryReportResponse response = toResponse(report);
        if (request.isPersist()) {
            salaryReportStore.save(new StoredSalaryReport(LocalDateTime.now(clock), response));
            logger.info("Stored salary report for {}/{}", response.getMonth(), response.getYear());
        }
        return response;
    }

    public StoredSalaryReport getLatest() {
        return salaryReportStore.load()
                .orElseThrow(() -> new ResourceNotFoundException(
                        "No salary data found. Please calculate and persist a report first.",
                        ResourceNotFoundException.ResourceType.SALARY_REPORT));
    }

    public SalaryReportResponse toResponse(SalaryReport report) {
        List<DaySalaryResponse> days = report.getDays().stream()
                .map(this::toDayResponse)
                .collect(Collectors.toList());

        SalaryReportResponse response = new SalaryReportResponse();
        response.setYear(report.getYear());
        response.setMonth(report.getMonth());
        response.setTotal(report.getTotal());
        response.setDays(days);
        response.setDaysWorked((int) report.getDays().stream().filter(d -> d.getTotalHours() > 0).count());
        response.setRegularHours(roundHours(report.getDays().stream()
                .mapToDouble(DaySalaryBreakdown::getRegularHours).sum()));
        response.setOvertime125Hours(roundHours(report.getDays().stream()
                .mapToDouble(DaySalaryBreakdown::getOvertime125Hours).sum()));
        response.setOvertime150Hours(roundHours(report.getDays().stream()
                .mapToDouble(DaySalaryBreakdown::getOvertime150Hours).sum()));
        response.setTotalHours(roundHours(response.getRegularHours() + response.getOvertime125Hours()
                + response.getOvertime150Hours()));
        return response;
    }

    private DaySalaryResponse toDayResponse(DaySalaryBreakdown day) {
        DaySalaryResponse dto = new DaySalaryResponse();
        dto.setDate(day.getLabel());
        dto.setRegularHours(day.getRegularHours());
        dto.setOvertime125Hours(day.getOvertime125Hours());
        dto.setOvertime150Hours(day.getOvertime150Hours());
        dto.setDayTotal(day.getDayTotal());
        dto.setWeekendPremiumApplied(day.isWeekendPremiumApplied());
        dto.setRawPeriods(day.getRawPeriods().stream()
                .map(p -> List.of(p.start(), p.end()))
                .collect(Collectors.toList()));
        return dto;
    }
}
