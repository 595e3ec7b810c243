package com.ylm.attendance.payroll.service;

import com.ylm.attendance.payroll.dto.AttendanceEntryRequest;
import com.ylm.attendance.payroll.dto.DaySalaryResponse;
import com.ylm.attendance.payroll.dto.SalaryCalculationRequest;
import com.ylm.attendance.payroll.dto.SalaryReportResponse;
import com.ylm.attendance.payroll.dto.StoredSalaryReport;
import com.ylm.attendance.payroll.exception.NoRecordsProvidedException;
import com.ylm.attendance.payroll.exception.ResourceNotFoundException;
import com.ylm.attendance.payroll.model.PayrollConfig;
import com.ylm.attendance.payroll.repository.SalaryReportStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class SalaryReportServiceTest {

    private final Clock clock = Clock.fixed(Instant.parse("2025-02-01T08:30:00Z"), ZoneOffset.UTC);
    private SalaryReportStore store;
    private SalaryReportService service;

    @BeforeEach
    void setup() {
        store = Mockito.mock(SalaryReportStore.class);
        SalaryCalculationService calculation = new SalaryCalculationService(
                new TimeModel(), new WeekendWindowCalculator(), new HourAllocator(), clock);
        service = new SalaryReportService(new AttendanceRecordAdapter(), calculation, store,
                PayrollConfig.defaults(), clock);
    }

    @Test
    void calculate_buildsSummaryAndDays() {
        SalaryCalculationRequest request = request(
                new AttendanceEntryRequest("2025-01-15", List.of(List.of("09:00", "20:00"))),
                new AttendanceEntryRequest("2025-01-04", List.of(List.of("10:00", "18:00"))),
                new AttendanceEntryRequest("2025-01-16", List.of(List.of("bad", "17:00"))));

        SalaryReportResponse response = service.calculate(request);

        assertThat(response.getYear()).isEqualTo(2025);
        assertThat(response.getMonth()).isEqualTo(1);
        assertThat(response.getDays()).hasSize(3);
        assertThat(response.getDaysWorked()).isEqualTo(2);
        assertThat(response.getRegularHours()).isEqualTo(8.0);
        assertThat(response.getOvertime125Hours()).isEqualTo(2.0);
        assertThat(response.getOvertime150Hours()).isEqualTo(9.0);
        assertThat(response.getTotalHours()).isEqualTo(19.0);
        assertThat(response.getTotal()).isEqualTo(900.0 + 900.0);

        DaySalaryResponse saturday = response.getDays().get(1);
        assertThat(saturday.getDate()).isEqualTo("2025-01-04");
        assertThat(saturday.isWeekendPremiumApplied()).isTrue();
        assertThat(saturday.getRawPeriods()).containsExactly(List.of("10:00", "18:00"));
        assertThat(response.getDays().get(2).getRawPeriods()).isEmpty();

        verifyNoInteractions(store);
    }

    @Test
    void calculate_withPersist_storesTheReport() {
        SalaryCalculationRequest request = request(
                new AttendanceEntryRequest("2025-01-15", List.of(List.of("09:00", "17:00"))));
        request.setPersist(true);

        SalaryReportResponse response = service.calculate(request);

        ArgumentCaptor<StoredSalaryReport> captor = ArgumentCaptor.forClass(StoredSalaryReport.class);
        verify(store).save(captor.capture());
        assertThat(captor.getValue().isSuccess()).isTrue();
        assertThat(captor.getValue().getTimestamp()).isEqualTo(LocalDateTime.of(2025, 2, 1, 8, 30));
        assertThat(captor.getValue().getReport()).isSameAs(response);
    }

    @Test
    void calculate_emptyRecords_propagates() {
        assertThatThrownBy(() -> service.calculate(request()))
                .isInstanceOf(NoRecordsProvidedException.class);
        verify(store, never()).save(any());
    }

    @Test
    void getLatest_withoutStoredReport_throwsNotFound() {
        when(store.load()).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.getLatest())
                .isInstanceOf(ResourceNotFoundException.class)
                .hasMessageContaining("No salary data found");
    }

    @Test
    void getLatest_returnsStoredReport() {
        StoredSalaryReport stored = new StoredSalaryReport(LocalDateTime.of(2025, 2, 1, 8, 30), new SalaryReportResponse());
        when(store.load()).thenReturn(Optional.of(stored));

        assertThat(service.getLatest()).isSameAs(stored);
    }

    private static SalaryCalculationRequest request(AttendanceEntryRequest... entries) {
        SalaryCalculationRequest request = new SalaryCalculationRequest();
        request.setRecords(List.of(entries));
        return request;
    }
}
