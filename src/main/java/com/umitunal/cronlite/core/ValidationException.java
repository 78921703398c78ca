package com.umitunal.cronlite.core;

/**
 * A job definition or update was rejected before it touched the live schedule.
 */
public class ValidationException extends SchedulerException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
