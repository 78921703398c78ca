package com.umitunal.cronlite.core;

/**
 * Trigger families a job can be scheduled with.
 */
public enum FrequencyKind {
    CRON,      // Calendar expression in a timezone
    INTERVAL,  // Fixed period
    DATE       // Single absolute instant
}
