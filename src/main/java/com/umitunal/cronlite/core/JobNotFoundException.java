package com.umitunal.cronlite.core;

public class JobNotFoundException extends SchedulerException {
    private final String jobId;

    public JobNotFoundException(String jobId) {
        super("Job with id " + jobId + " not found");
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
