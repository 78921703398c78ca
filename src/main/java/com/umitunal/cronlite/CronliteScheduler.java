package com.umitunal.cronlite;

import com.umitunal.cronlite.config.SchedulerConfig;
import com.umitunal.cronlite.core.DefinitionStore;
import com.umitunal.cronlite.core.ExecutionLog;
import com.umitunal.cronlite.core.ExecutionLogStore;
import com.umitunal.cronlite.core.JobDefinition;
import com.umitunal.cronlite.core.JobUpdate;
import com.umitunal.cronlite.engine.EngineListener;
import com.umitunal.cronlite.engine.ExecutionEngine;
import com.umitunal.cronlite.handler.DefaultHandlers;
import com.umitunal.cronlite.handler.HandlerRegistry;
import com.umitunal.cronlite.registry.JobRegistry;
import com.umitunal.cronlite.stats.Statistics;
import com.umitunal.cronlite.stats.StatisticsAggregator;
import com.umitunal.cronlite.storage.InMemoryDefinitionStore;
import com.umitunal.cronlite.storage.InMemoryExecutionLogStore;
import com.umitunal.cronlite.storage.RocksDefinitionStore;
import com.umitunal.cronlite.storage.RocksExecutionLogStore;
import com.umitunal.cronlite.trigger.TriggerResolver;
import org.rocksdb.RocksDBException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Embedded scheduler: job registry, execution engine, stores and statistics wired
 * together behind one entry point.
 *
 * <pre>{@code
 * try (CronliteScheduler scheduler = CronliteScheduler.newBuilder(SchedulerConfig.load()).build()) {
 *     scheduler.start();
 *     scheduler.createJob(JobDefinition.newBuilder("nightly backup", JobType.DATA_BACKUP,
 *             CronFrequency.of("0 2 * * *")).build());
 * }
 * }</pre>
 */
public class CronliteScheduler implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CronliteScheduler.class);

    private static final Comparator<JobDefinition> NEWEST_FIRST = Comparator
            .comparing(JobDefinition::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(JobDefinition::getId);

    private final DefinitionStore definitionStore;
    private final ExecutionLogStore logStore;
    private final HandlerRegistry handlers;
    private final JobRegistry registry;
    private final ExecutionEngine engine;
    private final StatisticsAggregator aggregator;
    private boolean started;
    private boolean closed;

    private CronliteScheduler(Builder builder) throws RocksDBException {
        SchedulerConfig config = builder.config;
        if (builder.definitionStore != null) {
            this.definitionStore = builder.definitionStore;
        } else if (config.isInMemory()) {
            this.definitionStore = new InMemoryDefinitionStore();
        } else {
            this.definitionStore = new RocksDefinitionStore(config.getStorage());
        }
        if (builder.logStore != null) {
            this.logStore = builder.logStore;
        } else if (config.isInMemory()) {
            this.logStore = new InMemoryExecutionLogStore();
        } else {
            try {
                this.logStore = new RocksExecutionLogStore(config.getStorage());
            } catch (RocksDBException | RuntimeException e) {
                closeQuietly(definitionStore);
                throw e;
            }
        }

        this.handlers = builder.handlers != null ? builder.handlers : DefaultHandlers.create(config).build();
        this.registry = new JobRegistry(new TriggerResolver(config.getDefaultTimezone()),
                definitionStore, handlers, builder.clock);
        this.engine = ExecutionEngine.builder(registry, handlers, logStore)
                .withClock(builder.clock)
                .withHandlerThreads(config.getHandlerThreads())
                .withShutdownGracePeriod(config.getShutdownGracePeriod())
                .withListener(builder.listener)
                .build();
        this.aggregator = new StatisticsAggregator(config.getStatisticsZone());
    }

    /**
     * Restore stored jobs and start dispatching.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("Scheduler is closed");
        }
        if (started) {
            return;
        }
        registry.rehydrate();
        engine.start();
        started = true;
        log.info("Scheduler started with {} jobs", registry.size());
    }

    public JobDefinition createJob(JobDefinition definition) {
        return registry.register(definition);
    }

    /**
     * Create a job, storing a date job whose run_date has passed as inert
     * instead of rejecting it when {@code acceptElapsedRunDate} is set.
     */
    public JobDefinition createJob(JobDefinition definition, boolean acceptElapsedRunDate) {
        return registry.register(definition, acceptElapsedRunDate);
    }

    public JobDefinition updateJob(String id, JobUpdate update) {
        return registry.update(id, update);
    }

    public JobDefinition pauseJob(String id) {
        return registry.pause(id);
    }

    public JobDefinition resumeJob(String id) {
        return registry.resume(id);
    }

    public void deleteJob(String id) {
        registry.delete(id);
    }

    public JobDefinition getJob(String id) {
        return registry.get(id);
    }

    /**
     * All jobs, most recently created first.
     */
    public List<JobDefinition> listJobs() {
        return registry.snapshot().stream()
                .sorted(NEWEST_FIRST)
                .collect(Collectors.toList());
    }

    public List<ExecutionLog> logs() {
        return logStore.recent(ExecutionLogStore.DEFAULT_LIMIT);
    }

    /**
     * Most recent executions first.
     */
    public List<ExecutionLog> logs(int limit) {
        return logStore.recent(limit);
    }

    /**
     * Most recent executions of one job first.
     *
     * @throws com.umitunal.cronlite.core.JobNotFoundException if the job does not exist
     */
    public List<ExecutionLog> jobLogs(String id, int limit) {
        registry.get(id);
        return logStore.recentForJob(id, limit);
    }

    public Statistics statistics() {
        return aggregator.aggregate(registry.snapshot(), logStore.all());
    }

    public boolean isHalted() {
        return engine.isHalted();
    }

    public void resumeDispatch() {
        engine.resumeDispatch();
    }

    public JobRegistry getRegistry() {
        return registry;
    }

    public ExecutionEngine getEngine() {
        return engine;
    }

    /**
     * Stop the engine, letting in-flight handlers finish, then release the stores.
     */
    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        engine.close();
        registry.close();
        handlers.close();
        closeQuietly(logStore);
        closeQuietly(definitionStore);
        log.info("Scheduler closed");
    }

    private static void closeQuietly(AutoCloseable resource) {
        try {
            resource.close();
        } catch (Exception e) {
            log.warn("Failed to close {}: {}", resource.getClass().getSimpleName(), e.getMessage(), e);
        }
    }

    public static Builder newBuilder(SchedulerConfig config) {
        return new Builder(config);
    }

    public static class Builder {
        private final SchedulerConfig config;
        private HandlerRegistry handlers;
        private DefinitionStore definitionStore;
        private ExecutionLogStore logStore;
        private Clock clock = Clock.systemUTC();
        private EngineListener listener = EngineListener.NONE;

        private Builder(SchedulerConfig config) {
            this.config = config;
        }

        /**
         * Replace the built-in handlers.
         */
        public Builder withHandlers(HandlerRegistry handlers) {
            this.handlers = handlers;
            return this;
        }

        public Builder withDefinitionStore(DefinitionStore store) {
            this.definitionStore = store;
            return this;
        }

        public Builder withLogStore(ExecutionLogStore store) {
            this.logStore = store;
            return this;
        }

        public Builder withClock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder withListener(EngineListener listener) {
            this.listener = listener;
            return this;
        }

        public CronliteScheduler build() throws RocksDBException {
            return new CronliteScheduler(this);
        }
    }
}
