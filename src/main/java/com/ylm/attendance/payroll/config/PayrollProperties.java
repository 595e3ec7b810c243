package com.ylm.attendance.payroll.config;

import com.ylm.attendance.payroll.exception.ValidationException;
import com.ylm.attendance.payroll.model.PayrollConfig;
import com.ylm.attendance.payroll.model.WeekdayTime;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Payroll settings bound from the {@code payroll.*} keys of application.yml.
 */
@ConfigurationProperties(prefix = "payroll")
public class PayrollProperties {

    private double rateRegular = PayrollConfig.DEFAULT_RATE_REGULAR;
    private Double rate125;
    private Double rate150;
    private double regularLimit = PayrollConfig.DEFAULT_REGULAR_LIMIT;
    private double limit125 = PayrollConfig.DEFAULT_LIMIT_125;
    private WeekendBoundary weekendStart = WeekendBoundary.of(PayrollConfig.DEFAULT_WEEKEND_START);
    private WeekendBoundary weekendEnd = WeekendBoundary.of(PayrollConfig.DEFAULT_WEEKEND_END);
    private Storage storage = new Storage();
    // origins allowed to call /api/** from a browser
    private List<String> corsOrigins = new ArrayList<>(List.of("http://localhost:5000"));

    /**
     * Validate and freeze the settings.
     *
     * @throws ValidationException listing every invalid setting
     */
    public PayrollConfig toConfig() {
        Map<String, String> errors = new LinkedHashMap<>();
        if (rateRegular < 0) errors.put("rate-regular", "must not be negative");
        if (rate125 != null && rate125 < 0) errors.put("rate125", "must not be negative");
        if (rate150 != null && rate150 < 0) errors.put("rate150", "must not be negative");
        if (regularLimit < 0) errors.put("regular-limit", "must not be negative");
        if (limit125 < regularLimit) errors.put("limit125", "must not be below regular-limit");
        weekendStart.validate("weekend-start", errors);
        weekendEnd.validate("weekend-end", errors);
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }

        return PayrollConfig.builder()
                .rateRegular(rateRegular)
                .rate125(rate125)
                .rate150(rate150)
                .regularLimit(regularLimit)
                .limit125(limit125)
                .weekendStart(weekendStart.toWeekdayTime())
                .weekendEnd(weekendEnd.toWeekdayTime())
                .build();
    }

    public double getRateRegular() { return rateRegular; }
    public void setRateRegular(double rateRegular) { this.rateRegular = rateRegular; }

    public Double getRate125() { return rate125; }
    public void setRate125(Double rate125) { this.rate125 = rate125; }

    public Double getRate150() { return rate150; }
    public void setRate150(Double rate150) { this.rate150 = rate150; }

    public double getRegularLimit() { return regularLimit; }
    public void setRegularLimit(double regularLimit) { this.regularLimit = regularLimit; }

    public double getLimit125() { return limit125; }
    public void setLimit125(double limit125) { this.limit125 = limit125; }

    public WeekendBoundary getWeekendStart() { return weekendStart; }
    public void setWeekendStart(WeekendBoundary weekendStart) { this.weekendStart = weekendStart; }

    public WeekendBoundary getWeekendEnd() { return weekendEnd; }
    public void setWeekendEnd(WeekendBoundary weekendEnd) { this.weekendEnd = weekendEnd; }

    public Storage getStorage() { return storage; }
    public void setStorage(Storage storage) { this.storage = storage; }

    public List<String> getCorsOrigins() { return corsOrigins; }
    public void setCorsOrigins(List<String> corsOrigins) { this.corsOrigins = corsOrigins; }

    public static class WeekendBoundary {
        // 0 = Monday ... 6 = Sunday
        private int weekday;
        private int hour;
        private int minute;

        static WeekendBoundary of(WeekdayTime time) {
            WeekendBoundary boundary = new WeekendBoundary();
            boundary.setWeekday(time.weekday());
            boundary.setHour(time.hour());
            boundary.setMinute(time.minute());
            return boundary;
        }

        void validate(String prefix, Map<String, String> errors) {
            if (weekday < 0 || weekday > 6) errors.put(prefix + ".weekday", "must be between 0 and 6");
            if (hour < 0 || hour > 23) errors.put(prefix + ".hour", "must be between 0 and 23");
            if (minute < 0 || minute > 59) errors.put(prefix + ".minute", "must be between 0 and 59");
        }

        WeekdayTime toWeekdayTime() {
            return new WeekdayTime(weekday, hour, minute);
        }

        public int getWeekday() { return weekday; }
        public void setWeekday(int weekday) { this.weekday = weekday; }

        public int getHour() { return hour; }
        public void setHour(int hour) { this.hour = hour; }

        public int getMinute() { return minute; }
        public void setMinute(int minute) { this.minute = minute; }
    }

    public static class Storage {
        private String reportPath = "data/salary_data.json";

        public String getReportPath() { return reportPath; }
        public void setReportPath(String reportPath) { this.reportPath = reportPath; }
    }
}
