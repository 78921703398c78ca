package com.umitunal.cronlite.core;

/**
 * Write side of the execution log. Implementations must accept concurrent calls
 * from handlers finishing at the same time.
 */
public interface ExecutionLogSink {

    /**
     * Append a new RUNNING record.
     */
    void appendLog(ExecutionLog log);

    /**
     * Replace a RUNNING record with its terminal version (same id).
     *
     * @throws IllegalStateException if the stored record is missing or already terminal
     */
    void updateLog(ExecutionLog log);
}
