package com.umitunal.cronlite.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle of one execution. RUNNING transitions exactly once to SUCCESS or ERROR.
 */
public enum ExecutionStatus {
    RUNNING,
    SUCCESS,
    ERROR;

    public boolean isTerminal() {
        return this != RUNNING;
    }

    @JsonValue
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ExecutionStatus fromTag(String tag) {
        return valueOf(tag.trim().toUpperCase(Locale.ROOT));
    }
}
