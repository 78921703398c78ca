package com.umitunal.cronlite.handler;

import com.umitunal.cronlite.core.JobDefinition;

/**
 * Job-type specific unit of work run when a job fires.
 */
@FunctionalInterface
public interface JobHandler {

    /**
     * Execute a job and return the result.
     *
     * @param job the definition being executed
     * @return execution result
     * @throws Exception if execution fails; recorded as an error result
     */
    HandlerResult execute(JobDefinition job) throws Exception;
}
