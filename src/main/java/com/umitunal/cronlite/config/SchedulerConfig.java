package com.umitunal.cronlite.config;

import com.umitunal.cronlite.core.JobType;
import com.umitunal.cronlite.core.ValidationException;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Properties;

/**
 * Top-level scheduler settings. A null storage config keeps all state in memory.
 */
public class SchedulerConfig {
    public static final String PROPERTIES_RESOURCE = "cronlite.properties";

    private static final String PREFIX = "cronlite.";

    private final StorageConfig storage;
    private final int handlerThreads;
    private final ZoneId defaultTimezone;
    private final ZoneId statisticsZone;
    private final Map<JobType, Duration> handlerTimeouts;
    private final Map<JobType, Duration> workDurations;
    private final URI apiCallUrl;
    private final Duration apiCallTimeout;
    private final Duration shutdownGracePeriod;

    private SchedulerConfig(Builder builder) {
        this.storage = builder.storage;
        this.handlerThreads = builder.handlerThreads;
        this.defaultTimezone = builder.defaultTimezone;
        this.statisticsZone = builder.statisticsZone;
        this.handlerTimeouts = Collections.unmodifiableMap(new EnumMap<>(builder.handlerTimeouts));
        this.workDurations = Collections.unmodifiableMap(new EnumMap<>(builder.workDurations));
        this.apiCallUrl = builder.apiCallUrl;
        this.apiCallTimeout = builder.apiCallTimeout;
        this.shutdownGracePeriod = builder.shutdownGracePeriod;
    }

    public StorageConfig getStorage() { return storage; }
    public boolean isInMemory() { return storage == null; }
    public int getHandlerThreads() { return handlerThreads; }
    public ZoneId getDefaultTimezone() { return defaultTimezone; }
    public ZoneId getStatisticsZone() { return statisticsZone; }
    public Map<JobType, Duration> getHandlerTimeouts() { return handlerTimeouts; }
    public URI getApiCallUrl() { return apiCallUrl; }
    public Duration getApiCallTimeout() { return apiCallTimeout; }
    public Duration getShutdownGracePeriod() { return shutdownGracePeriod; }

    /**
     * Simulated work time of a built-in handler.
     */
    public Duration getWorkDuration(JobType type) {
        return workDurations.getOrDefault(type, Duration.ZERO);
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    /**
     * Load settings from {@value #PROPERTIES_RESOURCE} on the classpath, or defaults if absent.
     */
    public static SchedulerConfig load() {
        Properties props = new Properties();
        try (InputStream in = SchedulerConfig.class.getClassLoader().getResourceAsStream(PROPERTIES_RESOURCE)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException e) {
            throw new ValidationException("Cannot read " + PROPERTIES_RESOURCE, e);
        }
        return fromProperties(props);
    }

    /**
     * Build a config from {@code cronlite.*} keys. Missing keys keep their defaults.
     *
     * @throws ValidationException on a malformed value
     */
    public static SchedulerConfig fromProperties(Properties props) {
        Builder builder = newBuilder();
        try {
            String dataDir = props.getProperty(PREFIX + "data-dir");
            if (dataDir != null && !dataDir.isBlank()) {
                builder.withStorage(StorageConfig.newBuilder(dataDir.trim())
                        .withDurableWrites(Boolean.parseBoolean(props.getProperty(PREFIX + "durable-writes", "false")))
                        .build());
            }
            String threads = props.getProperty(PREFIX + "handler-threads");
            if (threads != null) {
                builder.withHandlerThreads(Integer.parseInt(threads.trim()));
            }
            String tz = props.getProperty(PREFIX + "default-timezone");
            if (tz != null) {
                builder.withDefaultTimezone(ZoneId.of(tz.trim()));
            }
            String statsZone = props.getProperty(PREFIX + "stats-zone");
            if (statsZone != null) {
                builder.withStatisticsZone(ZoneId.of(statsZone.trim()));
            }
            String url = props.getProperty(PREFIX + "api-call.url");
            if (url != null) {
                builder.withApiCallUrl(URI.create(url.trim()));
            }
            String apiTimeout = props.getProperty(PREFIX + "api-call.timeout-seconds");
            if (apiTimeout != null) {
                builder.withApiCallTimeout(Duration.ofSeconds(Long.parseLong(apiTimeout.trim())));
            }
            for (JobType type : JobType.values()) {
                String timeout = props.getProperty(PREFIX + "timeout." + type.tag());
                if (timeout != null) {
                    builder.withHandlerTimeout(type, Duration.ofSeconds(Long.parseLong(timeout.trim())));
                }
                String work = props.getProperty(PREFIX + "work." + type.tag());
                if (work != null) {
                    builder.withWorkDuration(type, Duration.ofMillis(Long.parseLong(work.trim())));
                }
            }
        } catch (NumberFormatException | DateTimeException e) {
            throw new ValidationException("Invalid scheduler configuration: " + e.getMessage(), e);
        }
        return builder.build();
    }

    public static class Builder {
        private StorageConfig storage;
        private int handlerThreads = 8;
        private ZoneId defaultTimezone = ZoneOffset.UTC;
        private ZoneId statisticsZone = ZoneOffset.UTC;
        private final Map<JobType, Duration> handlerTimeouts = new EnumMap<>(JobType.class);
        private final Map<JobType, Duration> workDurations = new EnumMap<>(JobType.class);
        private URI apiCallUrl = URI.create("https://httpbin.org/uuid");
        private Duration apiCallTimeout = Duration.ofSeconds(30);
        private Duration shutdownGracePeriod = Duration.ofSeconds(5);

        private Builder() {
            workDurations.put(JobType.EMAIL_NOTIFICATION, Duration.ofSeconds(2));
            workDurations.put(JobType.DATA_BACKUP, Duration.ofSeconds(5));
            workDurations.put(JobType.REPORT_GENERATION, Duration.ofSeconds(10));
            workDurations.put(JobType.FILE_CLEANUP, Duration.ofSeconds(3));
            workDurations.put(JobType.CUSTOM, Duration.ofSeconds(1));
        }

        /**
         * Persist definitions and logs in RocksDB.
         * Default: in-memory only
         */
        public Builder withStorage(StorageConfig storage) {
            this.storage = storage;
            return this;
        }

        /**
         * Handler threads kept ready between executions. More are started when
         * more jobs run at once.
         * Default: 8
         */
        public Builder withHandlerThreads(int threads) {
            if (threads < 1) {
                throw new ValidationException("handler-threads must be at least 1");
            }
            this.handlerThreads = threads;
            return this;
        }

        /**
         * Zone used for cron jobs that name no timezone.
         * Default: UTC
         */
        public Builder withDefaultTimezone(ZoneId zone) {
            this.defaultTimezone = zone;
            return this;
        }

        /**
         * Zone whose calendar dates group executions in statistics.
         * Default: UTC
         */
        public Builder withStatisticsZone(ZoneId zone) {
            this.statisticsZone = zone;
            return this;
        }

        /**
         * Fail executions of this job type that run longer than the timeout.
         * Default: no timeout
         */
        public Builder withHandlerTimeout(JobType type, Duration timeout) {
            this.handlerTimeouts.put(type, timeout);
            return this;
        }

        /**
         * Simulated work time of the built-in handler for a job type.
         */
        public Builder withWorkDuration(JobType type, Duration duration) {
            this.workDurations.put(type, duration);
            return this;
        }

        /**
         * Endpoint requested by api_call jobs.
         * Default: https://httpbin.org/uuid
         */
        public Builder withApiCallUrl(URI url) {
            this.apiCallUrl = url;
            return this;
        }

        /**
         * Default: 30 seconds
         */
        public Builder withApiCallTimeout(Duration timeout) {
            this.apiCallTimeout = timeout;
            return this;
        }

        /**
         * How long shutdown waits for in-flight handlers.
         * Default: 5 seconds
         */
        public Builder withShutdownGracePeriod(Duration grace) {
            this.shutdownGracePeriod = grace;
            return this;
        }

        public SchedulerConfig build() {
            return new SchedulerConfig(this);
        }
    }
}
