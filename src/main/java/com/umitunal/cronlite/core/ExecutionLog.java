package com.umitunal.cronlite.core;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Record of one execution of a job. Created as RUNNING when dispatched and
 * completed exactly once; a terminal record is never changed again.
 */
@JsonDeserialize(builder = ExecutionLog.Builder.class)
public final class ExecutionLog {
    private final String id;
    private final String schedulerId;
    private final JobType jobType;
    private final ExecutionStatus status;
    private final String message;
    private final Instant startedAt;
    private final Instant completedAt;
    private final Double duration;

    private ExecutionLog(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id");
        this.schedulerId = Objects.requireNonNull(builder.schedulerId, "schedulerId");
        this.jobType = Objects.requireNonNull(builder.jobType, "jobType");
        this.status = Objects.requireNonNull(builder.status, "status");
        this.message = builder.message;
        this.startedAt = Objects.requireNonNull(builder.startedAt, "startedAt");
        this.completedAt = builder.completedAt;
        this.duration = builder.duration;
    }

    /**
     * Open a RUNNING record for a job that is being dispatched now.
     */
    public static ExecutionLog started(String logId, JobDefinition job, Instant startedAt) {
        return new Builder()
                .withId(logId)
                .withSchedulerId(job.getId())
                .withJobType(job.getJobType())
                .withStatus(ExecutionStatus.RUNNING)
                .withStartedAt(startedAt)
                .build();
    }

    /**
     * Produce the terminal version of this record.
     *
     * @param outcome SUCCESS or ERROR
     * @param message handler result text or failure detail
     * @param completedAt completion instant
     * @throws IllegalStateException if this record is already terminal
     */
    public ExecutionLog complete(ExecutionStatus outcome, String message, Instant completedAt) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Execution " + id + " already completed as " + status);
        }
        if (!outcome.isTerminal()) {
            throw new IllegalArgumentException("Completion status must be terminal: " + outcome);
        }
        long millis = Math.max(0, Duration.between(startedAt, completedAt).toMillis());
        return new Builder()
                .withId(id)
                .withSchedulerId(schedulerId)
                .withJobType(jobType)
                .withStatus(outcome)
                .withMessage(message)
                .withStartedAt(startedAt)
                .withCompletedAt(completedAt)
                .withDuration(millis / 1000.0)
                .build();
    }

    public String getId() { return id; }
    public String getSchedulerId() { return schedulerId; }
    public JobType getJobType() { return jobType; }
    public ExecutionStatus getStatus() { return status; }
    public String getMessage() { return message; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getCompletedAt() { return completedAt; }

    /**
     * Gets the execution time in seconds, or null while running.
     */
    public Double getDuration() { return duration; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExecutionLog)) return false;
        ExecutionLog that = (ExecutionLog) o;
        return id.equals(that.id)
                && schedulerId.equals(that.schedulerId)
                && jobType == that.jobType
                && status == that.status
                && Objects.equals(message, that.message)
                && startedAt.equals(that.startedAt)
                && Objects.equals(completedAt, that.completedAt)
                && Objects.equals(duration, that.duration);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, schedulerId, status, startedAt);
    }

    @Override
    public String toString() {
        return String.format("ExecutionLog{id='%s', job='%s', type=%s, status=%s, started=%s, duration=%s}",
                id, schedulerId, jobType, status, startedAt, duration);
    }

    @JsonPOJOBuilder(withPrefix = "with")
    public static class Builder {
        private String id;
        private String schedulerId;
        private JobType jobType;
        private ExecutionStatus status;
        private String message;
        private Instant startedAt;
        private Instant completedAt;
        private Double duration;

        public Builder() {
        }

        public Builder withId(String id) {
            this.id = id;
            return this;
        }

        public Builder withSchedulerId(String schedulerId) {
            this.schedulerId = schedulerId;
            return this;
        }

        public Builder withJobType(JobType jobType) {
            this.jobType = jobType;
            return this;
        }

        public Builder withStatus(ExecutionStatus status) {
            this.status = status;
            return this;
        }

        public Builder withMessage(String message) {
            this.message = message;
            return this;
        }

        public Builder withStartedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder withCompletedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Builder withDuration(Double duration) {
            this.duration = duration;
            return this;
        }

        public ExecutionLog build() {
            return new ExecutionLog(this);
        }
    }
}
