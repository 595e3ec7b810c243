package com.ylm.attendance.payroll.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ylm.attendance.payroll.config.PayrollProperties;
import com.ylm.attendance.payroll.config.WebConfig;
import com.ylm.attendance.payroll.dto.SalaryCalculationRequest;
import com.ylm.attendance.payroll.dto.SalaryReportResponse;
import com.ylm.attendance.payroll.exception.GlobalExceptionHandler;
import com.ylm.attendance.payroll.exception.NoRecordsProvidedException;
import com.ylm.attendance.payroll.exception.ResourceNotFoundException;
import com.ylm.attendance.payroll.service.SalaryReportService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.SpringBootConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = SalaryController.class)
@AutoConfigureMockMvc(addFilters = false)
class SalaryControllerTest {

    @SpringBootConfiguration
    @EnableConfigurationProperties(PayrollProperties.class)
    @Import({SalaryController.class, GlobalExceptionHandler.class, WebConfig.class})
    static class TestApplication {

        @Bean
        Clock clock() {
            return Clock.fixed(Instant.parse("2025-01-31T18:00:00Z"), ZoneOffset.UTC);
        }
    }

    @Autowired
    MockMvc mockMvc;

    @Autowired
    ObjectMapper objectMapper;

    @MockBean
    SalaryReportService salaryReportService;

    @BeforeEach
    void setup() {
        Mockito.reset(salaryReportService);
    }

    @Test
    void calculate_returnsReportEnvelope() throws Exception {
        SalaryReportResponse report = new SalaryReportResponse();
        report.setYear(2025);
        report.setMonth(1);
        report.setTotal(600.0);
        report.setDays(List.of());
        when(salaryReportService.calculate(any(SalaryCalculationRequest.class))).thenReturn(report);

        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("date", "2025-01-15");
        entry.put("clock_in", "09:00");
        entry.put("clock_out", "17:00");
        Map<String, Object> body = Map.of("records", List.of(entry), "persist", true);

        mockMvc.perform(post("/api/salary/calculate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(body)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.year").value(2025))
                .andExpect(jsonPath("$.data.total").value(600.0));

        ArgumentCaptor<SalaryCalculationRequest> captor = ArgumentCaptor.forClass(SalaryCalculationRequest.class);
        verify(salaryReportService).calculate(captor.capture());
        assertThat(captor.getValue().isPersist()).isTrue();
        assertThat(captor.getValue().getRecords()).hasSize(1);
        assertThat(captor.getValue().getRecords().get(0).getClockIn()).isEqualTo("09:00");
        assertThat(captor.getValue().getRecords().get(0).getClockOut()).isEqualTo("17:00");
    }

    @Test
    void calculate_emptyRecords_returns400WithErrorCode() throws Exception {
        when(salaryReportService.calculate(any())).thenThrow(new NoRecordsProvidedException());

        mockMvc.perform(post("/api/salary/calculate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"records\":[]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.errorCode").value("NO_RECORDS"));
    }

    @Test
    void calculate_missingRecords_failsValidation() throws Exception {
        mockMvc.perform(post("/api/salary/calculate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Request validation failed"));

        verifyNoInteractions(salaryReportService);
    }

    @Test
    void calculate_malformedJson_returns400() throws Exception {
        mockMvc.perform(post("/api/salary/calculate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"records\": [ "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Malformed JSON request"));
    }

    @Test
    void getLatest_withoutReport_returns404() throws Exception {
        when(salaryReportService.getLatest()).thenThrow(new ResourceNotFoundException(
                "No salary data found", ResourceNotFoundException.ResourceType.SALARY_REPORT));

        mockMvc.perform(get("/api/salary"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.errorMessage").value("No salary data found"));
    }

    @Test
    void health_isOk() throws Exception {
        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"))
                .andExpect(jsonPath("$.timestamp").value("2025-01-31T18:00:00Z"));
    }

    @Test
    void preflight_fromConfiguredOrigin_isAllowed() throws Exception {
        mockMvc.perform(options("/api/salary/calculate")
                        .header(HttpHeaders.ORIGIN, "http://localhost:5000")
                        .header(HttpHeaders.ACCESS_CONTROL_REQUEST_METHOD, "POST"))
                .andExpect(status().isOk())
                .andExpect(header().string(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, "http://localhost:5000"));
    }

    @Test
    void preflight_fromForeignOrigin_isRejected() throws Exception {
        mockMvc.perform(options("/api/salary/calculate")
                        .header(HttpHeaders.ORIGIN, "http://evil.example")
                        .header(HttpHeaders.ACCESS_CONTROL_REQUEST_METHOD, "POST"))
                .andExpect(status().isForbidden())
                .andExpect(header().doesNotExist(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN));
    }

    @Test
    void request_fromForeignOrigin_isRejected() throws Exception {
        mockMvc.perform(get("/api/health").header(HttpHeaders.ORIGIN, "http://evil.example"))
                .andExpect(status().isForbidden());
    }
}
