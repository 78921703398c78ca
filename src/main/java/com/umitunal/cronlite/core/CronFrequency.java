package com.umitunal.cronlite.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Cron trigger: a 5-field (minute first) or 6-field (second first) expression
 * evaluated in an IANA timezone. A null timezone means the scheduler default.
 */
public final class CronFrequency implements FrequencyConfig {
    private final String cronExpression;
    private final String timezone;

    @JsonCreator
    public CronFrequency(@JsonProperty("cronExpression") String cronExpression,
                         @JsonProperty("timezone") String timezone) {
        this.cronExpression = cronExpression;
        this.timezone = timezone;
    }

    public static CronFrequency of(String cronExpression) {
        return new CronFrequency(cronExpression, null);
    }

    public static CronFrequency of(String cronExpression, String timezone) {
        return new CronFrequency(cronExpression, timezone);
    }

    @Override
    public FrequencyKind kind() {
        return FrequencyKind.CRON;
    }

    public String getCronExpression() {
        return cronExpression;
    }

    public String getTimezone() {
        return timezone;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CronFrequency)) return false;
        CronFrequency that = (CronFrequency) o;
        return Objects.equals(cronExpression, that.cronExpression)
                && Objects.equals(timezone, that.timezone);
    }

    @Override
    public int hashCode() {
        return Objects.hash(cronExpression, timezone);
    }

    @Override
    public String toString() {
        return String.format("cron[%s @ %s]", cronExpression, timezone == null ? "default" : timezone);
    }
}
