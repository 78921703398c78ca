package com.umitunal.cronlite.handler;

/**
 * Result of running a handler.
 */
public final class HandlerResult {
    private final boolean success;
    private final String message;

    private HandlerResult(boolean success, String message) {
        this.success = success;
        this.message = message;
    }

    public boolean isSuccess() { return success; }
    public String getMessage() { return message; }

    public static HandlerResult success() {
        return new HandlerResult(true, "Job completed successfully");
    }

    public static HandlerResult success(String message) {
        return new HandlerResult(true, message);
    }

    public static HandlerResult failure(String message) {
        return new HandlerResult(false, message);
    }

    @Override
    public String toString() {
        return (success ? "success" : "failure") + (message == null ? "" : ": " + message);
    }
}
