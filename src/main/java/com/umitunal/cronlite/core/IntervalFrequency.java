package com.umitunal.cronlite.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.util.Objects;

/**
 * Fixed-period trigger. All units are added together.
 */
public final class IntervalFrequency implements FrequencyConfig {
    private final long seconds;
    private final long minutes;
    private final long hours;
    private final long days;

    @JsonCreator
    public IntervalFrequency(@JsonProperty("seconds") Long seconds,
                             @JsonProperty("minutes") Long minutes,
                             @JsonProperty("hours") Long hours,
                             @JsonProperty("days") Long days) {
        this.seconds = seconds == null ? 0 : seconds;
        this.minutes = minutes == null ? 0 : minutes;
        this.hours = hours == null ? 0 : hours;
        this.days = days == null ? 0 : days;
    }

    public static IntervalFrequency ofSeconds(long seconds) {
        return new IntervalFrequency(seconds, 0L, 0L, 0L);
    }

    public static IntervalFrequency ofMinutes(long minutes) {
        return new IntervalFrequency(0L, minutes, 0L, 0L);
    }

    public static IntervalFrequency ofHours(long hours) {
        return new IntervalFrequency(0L, 0L, hours, 0L);
    }

    public static IntervalFrequency ofDays(long days) {
        return new IntervalFrequency(0L, 0L, 0L, days);
    }

    @Override
    public FrequencyKind kind() {
        return FrequencyKind.INTERVAL;
    }

    public long getSeconds() { return seconds; }
    public long getMinutes() { return minutes; }
    public long getHours() { return hours; }
    public long getDays() { return days; }

    /**
     * Period between two consecutive fires.
     */
    public Duration toDuration() {
        return Duration.ofSeconds(seconds)
                .plusMinutes(minutes)
                .plusHours(hours)
                .plusDays(days);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IntervalFrequency)) return false;
        IntervalFrequency that = (IntervalFrequency) o;
        return seconds == that.seconds && minutes == that.minutes
                && hours == that.hours && days == that.days;
    }

    @Override
    public int hashCode() {
        return Objects.hash(seconds, minutes, hours, days);
    }

    @Override
    public String toString() {
        return String.format("interval[%dd %dh %dm %ds]", days, hours, minutes, seconds);
    }
}
