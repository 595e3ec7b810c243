package com.ylm.attendance.payroll.controller;

import com.ylm.attendance.payroll.dto.ApiResponse;
import com.ylm.attendance.payroll.dto.SalaryCalculationRequest;
import com.ylm.attendance.payroll.dto.SalaryReportResponse;
import com.ylm.attendance.payroll.dto.StoredSalaryReport;
import com.ylm.attendance.payroll.service.SalaryReportService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api")
@Tag(name = "Salary API")
public class SalaryController {

    @Autowired
    private SalaryReportService salaryReportService;

    @Autowired
    private Clock clock;

    @Operation(summary = "Calculate a salary report from attendance records")
    @PostMapping("/salary/calculate")
    public ResponseEntity<ApiResponse<SalaryReportResponse>> calculate(
            @Valid @RequestBody SalaryCalculationRequest request) {
        SalaryReportResponse report = salaryReportService.calculate(request);
        return ResponseEntity.ok(ApiResponse.success("Salary calculated", report));
    }

    @Operation(summary = "Latest stored salary report")
    @GetMapping("/salary")
    public ResponseEntity<ApiResponse<StoredSalaryReport>> getLatest() {
        StoredSalaryReport stored = salaryReportService.getLatest();
        return ResponseEntity.ok(ApiResponse.success("Salary report retrieved", stored));
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("timestamp", Instant.now(clock).toString());
        return ResponseEntity.ok(body);
    }
}
