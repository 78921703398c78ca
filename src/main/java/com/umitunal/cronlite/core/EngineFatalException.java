package com.umitunal.cronlite.core;

/**
 * Infrastructure failure that stops the engine from dispatching new executions.
 * Schedule state is kept so dispatching can resume once the cause is fixed.
 */
public class EngineFatalException extends SchedulerException {

    public EngineFatalException(String message, Throwable cause) {
        super(message, cause);
    }
}
