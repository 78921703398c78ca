package com.umitunal.cronlite.handler;

import com.umitunal.cronlite.core.JobDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Stand-in for work whose side effects live outside the scheduler (mail delivery,
 * backups, report rendering, cleanup). Occupies the handler thread for a fixed time.
 */
public class SimulatedWorkHandler implements JobHandler {
    private static final Logger log = LoggerFactory.getLogger(SimulatedWorkHandler.class);

    private final Duration workTime;
    private final String completionMessage;

    /**
     * @param workTime how long the simulated work takes
     * @param completionMessage result text, e.g. "Email notification sent"
     */
    public SimulatedWorkHandler(Duration workTime, String completionMessage) {
        this.workTime = workTime;
        this.completionMessage = completionMessage;
    }

    @Override
    public HandlerResult execute(JobDefinition job) throws InterruptedException {
        if (!workTime.isZero()) {
            Thread.sleep(workTime.toMillis());
        }
        log.info("{} for scheduler {}", completionMessage, job.getId());
        return HandlerResult.success(completionMessage);
    }

    public Duration getWorkTime() {
        return workTime;
    }
}
