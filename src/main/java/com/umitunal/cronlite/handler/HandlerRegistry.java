package com.umitunal.cronlite.handler;

import com.umitunal.cronlite.core.HandlerExecutionException;
import com.umitunal.cronlite.core.JobDefinition;
import com.umitunal.cronlite.core.JobType;
import com.umitunal.cronlite.core.ValidationException;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed mapping from job type to handler, populated once at startup.
 * Applies the optional per-type timeout around each invocation.
 */
public class HandlerRegistry implements AutoCloseable {
    private final Map<JobType, JobHandler> handlers;
    private final Map<JobType, Duration> timeouts;
    private final ExecutorService timeoutExecutor;

    private HandlerRegistry(Builder builder) {
        this.handlers = Collections.unmodifiableMap(new EnumMap<>(builder.handlers));
        this.timeouts = Collections.unmodifiableMap(new EnumMap<>(builder.timeouts));
        this.timeoutExecutor = timeouts.isEmpty() ? null : Executors.newCachedThreadPool(new TimeoutThreadFactory());
    }

    public boolean supports(JobType type) {
        return type != null && handlers.containsKey(type);
    }

    public Set<JobType> supportedTypes() {
        return handlers.keySet();
    }

    /**
     * Reject a job type that has no handler.
     *
     * @throws ValidationException if the type is null or unsupported
     */
    public void requireSupported(JobType type) {
        if (type == null) {
            throw new ValidationException("job_type is required");
        }
        if (!supports(type)) {
            throw new ValidationException("No handler registered for job_type " + type.tag());
        }
    }

    /**
     * Run the handler for a job.
     *
     * @return the handler's own result, successful or not
     * @throws HandlerExecutionException if the handler throws or exceeds its timeout
     */
    public HandlerResult execute(JobDefinition job) {
        JobType type = job.getJobType();
        JobHandler handler = handlers.get(type);
        if (handler == null) {
            throw new HandlerExecutionException(type, "No handler registered for job_type " + type);
        }

        Duration timeout = timeouts.get(type);
        if (timeout == null) {
            return invoke(handler, job);
        }

        Future<HandlerResult> future = timeoutExecutor.submit(() -> invoke(handler, job));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new HandlerExecutionException(type,
                    "Job failed: timed out after " + formatTimeout(timeout), e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new HandlerExecutionException(type, "Job failed: interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof HandlerExecutionException) {
                throw (HandlerExecutionException) cause;
            }
            throw new HandlerExecutionException(type, "Job failed: " + describe(cause), cause);
        }
    }

    private static HandlerResult invoke(JobHandler handler, JobDefinition job) {
        try {
            HandlerResult result = handler.execute(job);
            return result == null ? HandlerResult.success() : result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HandlerExecutionException(job.getJobType(), "Job failed: interrupted", e);
        } catch (HandlerExecutionException e) {
            throw e;
        } catch (Exception | Error e) {
            throw new HandlerExecutionException(job.getJobType(), "Job failed: " + describe(e), e);
        }
    }

    // Whole seconds, or milliseconds below one second
    static String formatTimeout(Duration timeout) {
        if (timeout.compareTo(Duration.ofSeconds(1)) < 0) {
            return timeout.toMillis() + "ms";
        }
        return timeout.toSeconds() + "s";
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }

    @Override
    public void close() {
        if (timeoutExecutor != null) {
            timeoutExecutor.shutdownNow();
        }
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<JobType, JobHandler> handlers = new EnumMap<>(JobType.class);
        private final Map<JobType, Duration> timeouts = new EnumMap<>(JobType.class);

        private Builder() {
        }

        /**
         * Register (or replace) the handler for a job type.
         */
        public Builder register(JobType type, JobHandler handler) {
            handlers.put(type, handler);
            return this;
        }

        /**
         * Fail executions of a job type that run longer than {@code timeout}.
         * Default: no timeout
         */
        public Builder withTimeout(JobType type, Duration timeout) {
            if (timeout.isNegative() || timeout.isZero()) {
                throw new ValidationException("Handler timeout must be positive for " + type.tag());
            }
            timeouts.put(type, timeout);
            return this;
        }

        public Builder withTimeouts(Map<JobType, Duration> timeouts) {
            timeouts.forEach(this::withTimeout);
            return this;
        }

        public HandlerRegistry build() {
            return new HandlerRegistry(this);
        }
    }

    private static final class TimeoutThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "cronlite-handler-timeout-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
