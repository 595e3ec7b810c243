package com.ylm.attendance.payroll.model;

/**
 * Rates, tier thresholds and weekend-premium window used by one calculation.
 * Immutable; passed explicitly to the engine.
 */
public final class PayrollConfig {

    public static final double DEFAULT_RATE_REGULAR = 75.0;
    public static final double DEFAULT_REGULAR_LIMIT = 8.0;
    public static final double DEFAULT_LIMIT_125 = 10.0;
    public static final WeekdayTime DEFAULT_WEEKEND_START = new WeekdayTime(4, 17, 0);
    public static final WeekdayTime DEFAULT_WEEKEND_END = new WeekdayTime(6, 5, 0);

    private final double rateRegular;
    private final double rate125;
    private final double rate150;
    private final double regularLimit;
    private final double limit125;
    private final WeekdayTime weekendStart;
    private final WeekdayTime weekendEnd;

    private PayrollConfig(Builder builder) {
        this.rateRegular = builder.rateRegular;
        this.rate125 = builder.rate125 != null ? builder.rate125 : builder.rateRegular * 1.25;
        this.rate150 = builder.rate150 != null ? builder.rate150 : builder.rateRegular * 1.5;
        this.regularLimit = builder.regularLimit;
        this.limit125 = builder.limit125;
        this.weekendStart = builder.weekendStart;
        this.weekendEnd = builder.weekendEnd;
    }

    public static PayrollConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public double getRateRegular() { return rateRegular; }
    public double getRate125() { return rate125; }
    public double getRate150() { return rate150; }
    public double getRegularLimit() { return regularLimit; }
    public double getLimit125() { return limit125; }
    public WeekdayTime getWeekendStart() { return weekendStart; }
    public WeekdayTime getWeekendEnd() { return weekendEnd; }

    @Override
    public String toString() {
        return "PayrollConfig{rates=" + rateRegular + "/" + rate125 + "/" + rate150
                + ", limits=" + regularLimit + "/" + limit125
                + ", weekend=" + weekendStart + " -> " + weekendEnd + "}";
    }

    public static final class Builder {
        private double rateRegular = DEFAULT_RATE_REGULAR;
        private Double rate125;
        private Double rate150;
        private double regularLimit = DEFAULT_REGULAR_LIMIT;
        private double limit125 = DEFAULT_LIMIT_125;
        private WeekdayTime weekendStart = DEFAULT_WEEKEND_START;
        private WeekdayTime weekendEnd = DEFAULT_WEEKEND_END;

        private Builder() {
        }

        public Builder rateRegular(double rateRegular) { this.rateRegular = rateRegular; return this; }

        /** Null derives the rate as 1.25 x the regular rate. */
        public Builder rate125(Double rate125) { this.rate125 = rate125; return this; }

        /** Null derives the rate as 1.5 x the regular rate. */
        public Builder rate150(Double rate150) { this.rate150 = rate150; return this; }

        public Builder regularLimit(double regularLimit) { this.regularLimit = regularLimit; return this; }
        public Builder limit125(double limit125) { this.limit125 = limit125; return this; }
        public Builder weekendStart(WeekdayTime weekendStart) { this.weekendStart = weekendStart; return this; }
        public Builder weekendEnd(WeekdayTime weekendEnd) { this.weekendEnd = weekendEnd; return this; }

        public PayrollConfig build() {
            return new PayrollConfig(this);
        }
    }
}
