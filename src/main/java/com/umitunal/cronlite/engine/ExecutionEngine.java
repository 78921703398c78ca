package com.umitunal.cronlite.engine;

import com.umitunal.cronlite.core.EngineFatalException;
import com.umitunal.cronlite.core.ExecutionLog;
import com.umitunal.cronlite.core.ExecutionLogSink;
import com.umitunal.cronlite.core.ExecutionStatus;
import com.umitunal.cronlite.core.HandlerExecutionException;
import com.umitunal.cronlite.core.JobDefinition;
import com.umitunal.cronlite.handler.HandlerRegistry;
import com.umitunal.cronlite.handler.HandlerResult;
import com.umitunal.cronlite.registry.Dispatch;
import com.umitunal.cronlite.registry.JobRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Dispatches due jobs to their handlers and records every execution.
 *
 * One coordinator thread waits on the {@link JobRegistry} for the earliest due job
 * and hands it to a handler thread at once. The pool keeps {@code handlerThreads}
 * threads ready and grows on demand, so a slow handler never delays another job's
 * fire time. The coordinator holds no lock while a handler runs.
 */
public class ExecutionEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ExecutionEngine.class);

    private final JobRegistry registry;
    private final HandlerRegistry handlers;
    private final ExecutionLogSink logSink;
    private final Clock clock;
    private final int handlerThreads;
    private final Duration shutdownGracePeriod;
    private final EngineListener listener;

    private final AtomicBoolean running;
    private final AtomicBoolean halted;
    private final AtomicReference<EngineFatalException> lastFatal;
    private final Object haltMonitor = new Object();
    private final AtomicLong dispatchedCount;
    private final AtomicLong succeededCount;
    private final AtomicLong failedCount;

    private Thread coordinatorThread;
    private ExecutorService handlerPool;

    private ExecutionEngine(Builder builder) {
        this.registry = builder.registry;
        this.handlers = builder.handlers;
        this.logSink = builder.logSink;
        this.clock = builder.clock;
        this.handlerThreads = builder.handlerThreads;
        this.shutdownGracePeriod = builder.shutdownGracePeriod;
        this.listener = builder.listener;
        this.running = new AtomicBoolean(false);
        this.halted = new AtomicBoolean(false);
        this.lastFatal = new AtomicReference<>();
        this.dispatchedCount = new AtomicLong(0);
        this.succeededCount = new AtomicLong(0);
        this.failedCount = new AtomicLong(0);
    }

    /**
     * Start the coordinator and the handler pool.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            // Never queues: every dispatch starts at once, on an idle thread or a new one
            handlerPool = new ThreadPoolExecutor(handlerThreads, Integer.MAX_VALUE,
                    60L, TimeUnit.SECONDS, new SynchronousQueue<>(), new HandlerThreadFactory());
            coordinatorThread = new Thread(this::run, "cronlite-coordinator");
            coordinatorThread.setDaemon(false);
            coordinatorThread.start();
            log.info("Execution engine started with {} handler threads", handlerThreads);
        }
    }

    /**
     * Stop dispatching and give in-flight handlers the grace period to finish and log.
     * Disarms every job in the registry; stored definitions are kept.
     */
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        registry.close();
        synchronized (haltMonitor) {
            haltMonitor.notifyAll();
        }

        if (coordinatorThread != null) {
            coordinatorThread.interrupt();
            try {
                coordinatorThread.join(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        if (handlerPool != null) {
            handlerPool.shutdown();
            try {
                if (!handlerPool.awaitTermination(shutdownGracePeriod.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Handlers still running after {}s, interrupting", shutdownGracePeriod.toSeconds());
                    handlerPool.shutdownNow();
                }
            } catch (InterruptedException e) {
                handlerPool.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("Execution engine stopped: dispatched={}, succeeded={}, failed={}",
                dispatchedCount.get(), succeededCount.get(), failedCount.get());
    }

    /**
     * Run one dispatched job on the calling thread: log it as running, invoke its
     * handler, advance its schedule and record the outcome.
     *
     * @return the terminal log record, or null if the engine halted before the
     *         execution could be recorded
     */
    public ExecutionLog execute(Dispatch dispatch) {
        JobDefinition job = dispatch.getJob();
        Instant startedAt = clock.instant();
        ExecutionLog started = ExecutionLog.started(UUID.randomUUID().toString(), job, startedAt);

        try {
            logSink.appendLog(started);
        } catch (RuntimeException e) {
            halt(new EngineFatalException("Failed to record start of job " + job.getId(), e));
            registry.release(dispatch);
            return null;
        }
        dispatchedCount.incrementAndGet();
        log.debug("Dispatched job {} ({}) scheduled at {}", job.getId(), job.getJobType(), dispatch.getScheduledAt());

        ExecutionStatus status;
        String message;
        try {
            HandlerResult result = handlers.execute(job);
            status = result.isSuccess() ? ExecutionStatus.SUCCESS : ExecutionStatus.ERROR;
            message = result.getMessage();
        } catch (HandlerExecutionException e) {
            status = ExecutionStatus.ERROR;
            message = e.getMessage();
        } catch (RuntimeException | Error e) {
            status = ExecutionStatus.ERROR;
            message = "Job failed: " + (e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
        Instant completedAt = clock.instant();

        try {
            registry.complete(dispatch, startedAt);
        } catch (RuntimeException e) {
            halt(new EngineFatalException("Failed to advance schedule of job " + job.getId(), e));
        }

        ExecutionLog finished = started.complete(status, message, completedAt);
        try {
            logSink.updateLog(finished);
        } catch (RuntimeException e) {
            halt(new EngineFatalException("Failed to record completion of job " + job.getId(), e));
            return null;
        }

        if (status == ExecutionStatus.SUCCESS) {
            succeededCount.incrementAndGet();
            log.info("Job {} ({}) succeeded in {}s: {}", job.getId(), job.getName(), finished.getDuration(), message);
        } else {
            failedCount.incrementAndGet();
            log.warn("Job {} ({}) failed in {}s: {}", job.getId(), job.getName(), finished.getDuration(), message);
        }
        listener.onExecutionCompleted(finished);
        return finished;
    }

    /**
     * Stop dispatching new executions. Schedule state is kept.
     */
    public void halt(EngineFatalException error) {
        lastFatal.set(error);
        if (halted.compareAndSet(false, true)) {
            log.error("Execution engine halted: {}", error.getMessage(), error);
            listener.onFatal(error);
        }
    }

    /**
     * Resume dispatching after a halt. Jobs that became due meanwhile fire immediately.
     */
    public void resumeDispatch() {
        if (halted.compareAndSet(true, false)) {
            lastFatal.set(null);
            synchronized (haltMonitor) {
                haltMonitor.notifyAll();
            }
            log.info("Execution engine resumed dispatching");
        }
    }

    private void run() {
        while (running.get()) {
            try {
                awaitNotHalted();
                if (!running.get()) {
                    break;
                }

                Dispatch dispatch = registry.awaitDue();
                if (dispatch == null) {
                    break;
                }
                if (halted.get()) {
                    registry.release(dispatch);
                    continue;
                }
                submit(dispatch);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                log.error("Coordinator error: {}", e.getMessage(), e);
            }
        }
        log.debug("Coordinator exited");
    }

    private void submit(Dispatch dispatch) {
        try {
            handlerPool.execute(() -> execute(dispatch));
        } catch (RejectedExecutionException e) {
            log.debug("Handler pool closed, releasing {}", dispatch);
            registry.release(dispatch);
        }
    }

    private void awaitNotHalted() throws InterruptedException {
        synchronized (haltMonitor) {
            while (halted.get() && running.get()) {
                haltMonitor.wait();
            }
        }
    }

    public boolean isRunning() { return running.get(); }
    public boolean isHalted() { return halted.get(); }
    public EngineFatalException getLastFatal() { return lastFatal.get(); }
    public long getDispatchedCount() { return dispatchedCount.get(); }
    public long getSucceededCount() { return succeededCount.get(); }
    public long getFailedCount() { return failedCount.get(); }

    @Override
    public void close() {
        stop();
    }

    public static Builder builder(JobRegistry registry, HandlerRegistry handlers, ExecutionLogSink logSink) {
        return new Builder(registry, handlers, logSink);
    }

    public static class Builder {
        private final JobRegistry registry;
        private final HandlerRegistry handlers;
        private final ExecutionLogSink logSink;
        private Clock clock = Clock.systemUTC();
        private int handlerThreads = 8;
        private Duration shutdownGracePeriod = Duration.ofSeconds(5);
        private EngineListener listener = EngineListener.NONE;

        private Builder(JobRegistry registry, HandlerRegistry handlers, ExecutionLogSink logSink) {
            this.registry = registry;
            this.handlers = handlers;
            this.logSink = logSink;
        }

        public Builder withClock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withHandlerThreads(int threads) {
            if (threads < 1) {
                throw new IllegalArgumentException("handlerThreads must be at least 1");
            }
            this.handlerThreads = threads;
            return this;
        }

        public Builder withShutdownGracePeriod(Duration grace) {
            this.shutdownGracePeriod = grace;
            return this;
        }

        public Builder withListener(EngineListener listener) {
            this.listener = listener;
            return this;
        }

        public ExecutionEngine build() {
            return new ExecutionEngine(this);
        }
    }

    private static final class HandlerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "cronlite-handler-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
