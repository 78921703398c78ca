package com.umitunal.cronlite.core;

/**
 * Failure reading or writing durable scheduler state.
 */
public class StorageException extends SchedulerException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
