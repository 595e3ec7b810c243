package com.ylm.attendance.payroll;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.file.Path;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class SalaryApiIntegrationTest {

    @TempDir
    static Path dataDir;

    @DynamicPropertySource
    static void storage(DynamicPropertyRegistry registry) {
        registry.add("payroll.storage.report-path", () -> dataDir.resolve("salary_data.json").toString());
    }

    @Autowired
    MockMvc mockMvc;

    @Test
    void calculateAndPersist_thenReadBack() throws Exception {
        String body = "{\"persist\": true, \"records\": ["
                + "{\"date\": \"2025-01-15\", \"periods\": [[\"09:00\", \"17:00\"]]},"
                + "{\"date\": \"2025-01-04\", \"periods\": [[\"10:00\", \"18:00\"]]},"
                + "{\"date\": \"2025-01-16\", \"periods\": [[\"invalid\", \"17:00\"]]}"
                + "]}";

        mockMvc.perform(post("/api/salary/calculate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.year").value(2025))
                .andExpect(jsonPath("$.data.month").value(1))
                .andExpect(jsonPath("$.data.total").value(1500.0))
                .andExpect(jsonPath("$.data.days.length()").value(3))
                .andExpect(jsonPath("$.data.days[0].regular_hours").value(8.0))
                .andExpect(jsonPath("$.data.days[0].day_total").value(600.0))
                .andExpect(jsonPath("$.data.days[1].weekend_premium_applied").value(true))
                .andExpect(jsonPath("$.data.days[1].overtime_150_hours").value(8.0))
                .andExpect(jsonPath("$.data.days[1].day_total").value(900.0))
                .andExpect(jsonPath("$.data.days[2].day_total").value(0.0))
                .andExpect(jsonPath("$.data.days[2].raw_periods.length()").value(0));

        mockMvc.perform(get("/api/salary"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.success").value(true))
                .andExpect(jsonPath("$.data.report.total").value(1500.0))
                .andExpect(jsonPath("$.data.report.days_worked").value(2));
    }

    @Test
    void emptyRecords_isRejected() throws Exception {
        mockMvc.perform(post("/api/salary/calculate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"records\": []}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.errorCode").value("NO_RECORDS"));
    }
}
