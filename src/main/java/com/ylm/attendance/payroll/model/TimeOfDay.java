package com.ylm.attendance.payroll.model;

import java.time.LocalTime;
import java.util.Objects;

/**
 * Wall-clock time within a day, minute precision.
 */
public final class TimeOfDay implements Comparable<TimeOfDay> {

    private final int hour;
    private final int minute;

    private TimeOfDay(int hour, int minute) {
        this.hour = hour;
        this.minute = minute;
    }

    public static TimeOfDay of(int hour, int minute) {
        if (hour < 0 || hour > 23) {
            throw new IllegalArgumentException("Hour out of range: " + hour);
        }
        if (minute < 0 || minute > 59) {
            throw new IllegalArgumentException("Minute out of range: " + minute);
        }
        return new TimeOfDay(hour, minute);
    }

    public int getHour() { return hour; }

    public int getMinute() { return minute; }

    public int minuteOfDay() {
        return hour * 60 + minute;
    }

    public LocalTime toLocalTime() {
        return LocalTime.of(hour, minute);
    }

    @Override
    public int compareTo(TimeOfDay other) {
        return Integer.compare(minuteOfDay(), other.minuteOfDay());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TimeOfDay)) return false;
        TimeOfDay that = (TimeOfDay) o;
        return hour == that.hour && minute == that.minute;
    }

    @Override
    public int hashCode() {
        return Objects.hash(hour, minute);
    }

    @Override
    public String toString() {
        return String.format("%02d:%02d", hour, minute);
    }
}
