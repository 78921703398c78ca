package com.umitunal.cronlite.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * One-shot trigger at an absolute instant.
 */
public final class DateFrequency implements FrequencyConfig {
    private final Instant runDate;

    @JsonCreator
    public DateFrequency(@JsonProperty("runDate") Instant runDate) {
        this.runDate = runDate;
    }

    public static DateFrequency at(Instant runDate) {
        return new DateFrequency(runDate);
    }

    @Override
    public FrequencyKind kind() {
        return FrequencyKind.DATE;
    }

    public Instant getRunDate() {
        return runDate;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DateFrequency)) return false;
        return Objects.equals(runDate, ((DateFrequency) o).runDate);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(runDate);
    }

    @Override
    public String toString() {
        return "date[" + runDate + "]";
    }
}
