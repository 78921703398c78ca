package com.umitunal.cronlite.core;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.time.Instant;
import java.util.Objects;

/**
 * Declarative description of a job together with its schedule bookkeeping.
 * Instances are immutable; every change produces a new instance via {@link #toBuilder()}.
 */
@JsonDeserialize(builder = JobDefinition.Builder.class)
public final class JobDefinition {
    private final String id;
    private final String name;
    private final String description;
    private final JobType jobType;
    private final FrequencyConfig frequency;
    private final boolean active;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final Instant lastRun;
    private final Instant nextRun;

    private JobDefinition(Builder builder) {
        this.id = builder.id;
        this.name = builder.name;
        this.description = builder.description;
        this.jobType = builder.jobType;
        this.frequency = builder.frequency;
        this.active = builder.active;
        this.createdAt = builder.createdAt;
        this.updatedAt = builder.updatedAt;
        this.lastRun = builder.lastRun;
        this.nextRun = builder.nextRun;
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public String getDescription() { return description; }
    public JobType getJobType() { return jobType; }
    public FrequencyConfig getFrequency() { return frequency; }
    public boolean isActive() { return active; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }

    /**
     * Gets the instant the last execution started, or null if the job never ran.
     */
    public Instant getLastRun() { return lastRun; }

    /**
     * Gets the next instant the job is due, or null if no fire remains.
     */
    public Instant getNextRun() { return nextRun; }

    @JsonIgnore
    public FrequencyKind getFrequencyKind() {
        return frequency == null ? null : frequency.kind();
    }

    public Builder toBuilder() {
        return new Builder()
                .withId(id)
                .withName(name)
                .withDescription(description)
                .withJobType(jobType)
                .withFrequency(frequency)
                .withActive(active)
                .withCreatedAt(createdAt)
                .withUpdatedAt(updatedAt)
                .withLastRun(lastRun)
                .withNextRun(nextRun);
    }

    public static Builder newBuilder(String name, JobType jobType, FrequencyConfig frequency) {
        return new Builder()
                .withName(name)
                .withJobType(jobType)
                .withFrequency(frequency);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JobDefinition)) return false;
        JobDefinition that = (JobDefinition) o;
        return active == that.active
                && Objects.equals(id, that.id)
                && Objects.equals(name, that.name)
                && Objects.equals(description, that.description)
                && jobType == that.jobType
                && Objects.equals(frequency, that.frequency)
                && Objects.equals(createdAt, that.createdAt)
                && Objects.equals(updatedAt, that.updatedAt)
                && Objects.equals(lastRun, that.lastRun)
                && Objects.equals(nextRun, that.nextRun);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, jobType, frequency, active, createdAt, updatedAt, lastRun, nextRun);
    }

    @Override
    public String toString() {
        return String.format("JobDefinition{id='%s', name='%s', type=%s, %s, active=%s, next=%s}",
                id, name, jobType, frequency, active, nextRun);
    }

    @JsonPOJOBuilder(withPrefix = "with")
    public static class Builder {
        private String id;
        private String name;
        private String description;
        private JobType jobType;
        private FrequencyConfig frequency;
        private boolean active = true;
        private Instant createdAt;
        private Instant updatedAt;
        private Instant lastRun;
        private Instant nextRun;

        public Builder() {
        }

        public Builder withId(String id) {
            this.id = id;
            return this;
        }

        public Builder withName(String name) {
            this.name = name;
            return this;
        }

        public Builder withDescription(String description) {
            this.description = description;
            return this;
        }

        public Builder withJobType(JobType jobType) {
            this.jobType = jobType;
            return this;
        }

        public Builder withFrequency(FrequencyConfig frequency) {
            this.frequency = frequency;
            return this;
        }

        /**
         * Default: true
         */
        public Builder withActive(boolean active) {
            this.active = active;
            return this;
        }

        public Builder withCreatedAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder withUpdatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder withLastRun(Instant lastRun) {
            this.lastRun = lastRun;
            return this;
        }

        public Builder withNextRun(Instant nextRun) {
            this.nextRun = nextRun;
            return this;
        }

        public JobDefinition build() {
            return new JobDefinition(this);
        }
    }
}
