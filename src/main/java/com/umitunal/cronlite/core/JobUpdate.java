package com.umitunal.cronlite.core;

/**
 * Partial change to a job definition. Null fields keep the current value.
 */
public final class JobUpdate {
    private final String name;
    private final String description;
    private final JobType jobType;
    private final FrequencyConfig frequency;
    private final Boolean active;

    private JobUpdate(Builder builder) {
        this.name = builder.name;
        this.description = builder.description;
        this.jobType = builder.jobType;
        this.frequency = builder.frequency;
        this.active = builder.active;
    }

    public String getName() { return name; }
    public String getDescription() { return description; }
    public JobType getJobType() { return jobType; }
    public FrequencyConfig getFrequency() { return frequency; }
    public Boolean getActive() { return active; }

    /**
     * Apply this update on top of an existing definition.
     */
    public JobDefinition.Builder applyTo(JobDefinition current) {
        JobDefinition.Builder builder = current.toBuilder();
        if (name != null) builder.withName(name);
        if (description != null) builder.withDescription(description);
        if (jobType != null) builder.withJobType(jobType);
        if (frequency != null) builder.withFrequency(frequency);
        if (active != null) builder.withActive(active);
        return builder;
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private String description;
        private JobType jobType;
        private FrequencyConfig frequency;
        private Boolean active;

        private Builder() {
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

        public Builder withActive(boolean active) {
            this.active = active;
            return this;
        }

        public JobUpdate build() {
            return new JobUpdate(this);
        }
    }
}
