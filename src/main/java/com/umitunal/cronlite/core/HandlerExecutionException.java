package com.umitunal.cronlite.core;

/**
 * A handler failed while executing a job. Recorded in the execution log; never
 * propagated out of the engine.
 */
public class HandlerExecutionException extends SchedulerException {
    private final JobType jobType;

    public HandlerExecutionException(JobType jobType, String message) {
        super(message);
        this.jobType = jobType;
    }

    public HandlerExecutionException(JobType jobType, String message, Throwable cause) {
        super(message, cause);
        this.jobType = jobType;
    }

    public JobType getJobType() {
        return jobType;
    }
}
