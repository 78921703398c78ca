package com.umitunal.cronlite.core;

import java.util.List;

/**
 * Execution log with the read operations used by reporting and statistics.
 */
public interface ExecutionLogStore extends ExecutionLogSink, AutoCloseable {

    int DEFAULT_LIMIT = 100;

    /**
     * Most recent executions first.
     */
    List<ExecutionLog> recent(int limit);

    /**
     * Most recent executions of one job first.
     */
    List<ExecutionLog> recentForJob(String schedulerId, int limit);

    /**
     * Every stored record, oldest first.
     */
    List<ExecutionLog> all();

    @Override
    default void close() {
    }
}
