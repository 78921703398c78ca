package com.umitunal.cronlite.stats;

import java.time.LocalDate;
import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;

/**
 * Point-in-time scheduler statistics, derived from job and execution-log snapshots.
 */
public class Statistics {
    private final long totalSchedulers;
    private final long activeSchedulers;
    private final long pausedSchedulers;
    private final long totalExecutions;
    private final long successfulExecutions;
    private final long failedExecutions;
    private final long runningExecutions;
    private final Map<String, Long> executionsByJobType;
    private final SortedMap<LocalDate, Long> executionsByDate;
    private final Double averageExecutionDuration;

    public Statistics(long totalSchedulers, long activeSchedulers, long pausedSchedulers,
                      long totalExecutions, long successfulExecutions, long failedExecutions,
                      long runningExecutions, Map<String, Long> executionsByJobType,
                      SortedMap<LocalDate, Long> executionsByDate, Double averageExecutionDuration) {
        this.totalSchedulers = totalSchedulers;
        this.activeSchedulers = activeSchedulers;
        this.pausedSchedulers = pausedSchedulers;
        this.totalExecutions = totalExecutions;
        this.successfulExecutions = successfulExecutions;
        this.failedExecutions = failedExecutions;
        this.runningExecutions = runningExecutions;
        this.executionsByJobType = Collections.unmodifiableMap(executionsByJobType);
        this.executionsByDate = Collections.unmodifiableSortedMap(executionsByDate);
        this.averageExecutionDuration = averageExecutionDuration;
    }

    public long getTotalSchedulers() { return totalSchedulers; }
    public long getActiveSchedulers() { return activeSchedulers; }
    public long getPausedSchedulers() { return pausedSchedulers; }
    public long getTotalExecutions() { return totalExecutions; }
    public long getSuccessfulExecutions() { return successfulExecutions; }
    public long getFailedExecutions() { return failedExecutions; }
    public long getRunningExecutions() { return runningExecutions; }

    /**
     * Execution count per job type tag.
     */
    public Map<String, Long> getExecutionsByJobType() { return executionsByJobType; }

    /**
     * Execution count per calendar date of started_at, oldest date first.
     */
    public SortedMap<LocalDate, Long> getExecutionsByDate() { return executionsByDate; }

    /**
     * Mean duration in seconds over completed executions; null if none completed.
     */
    public Double getAverageExecutionDuration() { return averageExecutionDuration; }

    @Override
    public String toString() {
        return String.format(
            "Statistics{schedulers=%d, active=%d, paused=%d, executions=%d, success=%d, failed=%d, running=%d, avgDuration=%s}",
            totalSchedulers, activeSchedulers, pausedSchedulers, totalExecutions,
            successfulExecutions, failedExecutions, runningExecutions, averageExecutionDuration
        );
    }
}
