package com.umitunal.cronlite.registry;

import com.umitunal.cronlite.core.JobDefinition;

import java.time.Instant;

/**
 * A job handed to the engine for execution. Holds the definition as it was when
 * the job became due and the fire time it was due at.
 */
public final class Dispatch {
    private final JobDefinition job;
    private final Instant scheduledAt;
    private final long generation;
    final JobRegistry.Entry entry;

    Dispatch(JobDefinition job, Instant scheduledAt, long generation, JobRegistry.Entry entry) {
        this.job = job;
        this.scheduledAt = scheduledAt;
        this.generation = generation;
        this.entry = entry;
    }

    public JobDefinition getJob() {
        return job;
    }

    public String getJobId() {
        return job.getId();
    }

    /**
     * Fire time the job was due at; the base for computing the following fire time.
     */
    public Instant getScheduledAt() {
        return scheduledAt;
    }

    long getGeneration() {
        return generation;
    }

    @Override
    public String toString() {
        return "Dispatch{job=" + job.getId() + ", scheduledAt=" + scheduledAt + "}";
    }
}
