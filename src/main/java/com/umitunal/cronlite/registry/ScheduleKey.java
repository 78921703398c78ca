package com.umitunal.cronlite.registry;

import java.time.Instant;
import java.util.Objects;

/**
 * Position of an armed job on the timeline: ordered by fire time, then job id,
 * so two jobs due at the same instant never collide.
 */
final class ScheduleKey implements Comparable<ScheduleKey> {
    private final Instant fireAt;
    private final String jobId;

    ScheduleKey(Instant fireAt, String jobId) {
        this.fireAt = Objects.requireNonNull(fireAt, "fireAt");
        this.jobId = Objects.requireNonNull(jobId, "jobId");
    }

    Instant fireAt() {
        return fireAt;
    }

    String jobId() {
        return jobId;
    }

    @Override
    public int compareTo(ScheduleKey other) {
        int byTime = fireAt.compareTo(other.fireAt);
        return byTime != 0 ? byTime : jobId.compareTo(other.jobId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScheduleKey)) return false;
        ScheduleKey that = (ScheduleKey) o;
        return fireAt.equals(that.fireAt) && jobId.equals(that.jobId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fireAt, jobId);
    }

    @Override
    public String toString() {
        return fireAt + "/" + jobId;
    }
}
