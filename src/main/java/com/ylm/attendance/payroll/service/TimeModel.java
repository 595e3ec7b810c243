package com.ylm.attendance.payroll.service;

import com.ylm.attendance.payroll.model.TimeOfDay;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Optional;
import java.util.function.Function;

/**
 * Parsing of punch-clock time and date text, and shift duration arithmetic.
 */
@Component
public class TimeModel {

    private static final Logger logger = LoggerFactory.getLogger(TimeModel.class);

    static final int HOURS_SCALE = 4;
    private static final int MINUTES_PER_DAY = 24 * 60;

    private static final DateTimeFormatter DAY_FIRST_DATE =
            DateTimeFormatter.ofPattern("d/M/uuuu").withResolverStyle(ResolverStyle.STRICT);

    /**
     * Parse {@code H:MM} or {@code HH:MM}; a trailing {@code :SS} component is tolerated and ignored.
     * Out-of-range values are rejected, never wrapped.
     */
    public Optional<TimeOfDay> parseTime(String text) {
        if (StringUtils.isBlank(text)) {
            return Optional.empty();
        }
        String[] parts = text.trim().split(":", -1);
        if (parts.length < 2 || parts.length > 3) {
            logger.debug("Unparseable time '{}': expected H:MM", text);
            return Optional.empty();
        }
        for (String part : parts) {
            if (!StringUtils.isNumeric(part) || part.length() > 2) {
                logger.debug("Unparseable time '{}': non-numeric component", text);
                return Optional.empty();
            }
        }
        int hour = Integer.parseInt(parts[0]);
        int minute = Integer.parseInt(parts[1]);
        if (hour > 23 || minute > 59 || (parts.length == 3 && Integer.parseInt(parts[2]) > 59)) {
            logger.debug("Invalid time values in '{}': hour={}, minute={}", text, hour, minute);
            return Optional.empty();
        }
        return Optional.of(TimeOfDay.of(hour, minute));
    }

    /**
     * Hours from {@code start} to {@code end}. An end at or before the start is read as the next day,
     * so equal times yield a full 24 hours.
     */
    public double durationHours(TimeOfDay start, TimeOfDay end) {
        int minutes = end.minuteOfDay() - start.minuteOfDay();
        if (minutes <= 0) {
            minutes += MINUTES_PER_DAY;
        }
        return roundHours(minutes / 60.0);
    }

    /**
     * Resolve attendance date text: ISO {@code yyyy-MM-dd} first, then an ISO date-time
     * (offset allowed; the written date is kept as is), then {@code dd/MM/yyyy}.
     */
    public Optional<LocalDate> parseDate(String text) {
        if (StringUtils.isBlank(text)) {
            return Optional.empty();
        }
        String value = text.trim();
        return tryParse(value, LocalDate::parse)
                .or(() -> value.indexOf('T') > 0
                        ? tryParse(value, v -> LocalDate.parse(v, DateTimeFormatter.ISO_DATE_TIME))
                        : Optional.<LocalDate>empty())
                .or(() -> tryParse(value, v -> LocalDate.parse(v, DAY_FIRST_DATE)));
    }

    private static Optional<LocalDate> tryParse(String value, Function<String, LocalDate> parser) {
        try {
            return Optional.of(parser.apply(value));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    static double roundHours(double hours) {
        return round(hours, HOURS_SCALE);
    }

    static double roundCurrency(double amount) {
        return round(amount, 2);
    }

    private static double round(double value, int scale) {
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }
}
