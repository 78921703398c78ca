package com.umitunal.cronlite.trigger;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import com.umitunal.cronlite.core.CronFrequency;
import com.umitunal.cronlite.core.DateFrequency;
import com.umitunal.cronlite.core.FrequencyConfig;
import com.umitunal.cronlite.core.IntervalFrequency;
import com.umitunal.cronlite.core.ValidationException;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Computes fire times for cron, interval and date triggers.
 *
 * Pure apart from a cache of parsed cron expressions; safe for concurrent use.
 */
public class TriggerResolver {
    // Upper bound on candidates skipped for DST gaps before giving up
    private static final int MAX_CRON_CANDIDATES = 1000;

    private final ZoneId defaultZone;
    private final CronParser unixParser;
    private final CronParser secondsParser;
    private final Map<String, ExecutionTime> cronCache = new ConcurrentHashMap<>();

    public TriggerResolver() {
        this(ZoneOffset.UTC);
    }

    public TriggerResolver(ZoneId defaultZone) {
        this.defaultZone = defaultZone;
        this.unixParser = new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));
        this.secondsParser = new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.SPRING));
    }

    /**
     * Check that a trigger config is well formed and can fire at least once after
     * {@code reference}.
     *
     * @throws ValidationException if the config can never be scheduled
     */
    public void validate(FrequencyConfig config, Instant reference) {
        if (config == null) {
            throw new ValidationException("frequency_config is required");
        }
        if (config instanceof CronFrequency) {
            CronFrequency cron = (CronFrequency) config;
            ExecutionTime executionTime = executionTime(cron.getCronExpression());
            ZoneId zone = zoneOf(cron);
            if (executionTime.nextExecution(reference.atZone(zone)).isEmpty()) {
                throw new ValidationException("cron_expression never fires: " + cron.getCronExpression());
            }
        } else if (config instanceof IntervalFrequency) {
            IntervalFrequency interval = (IntervalFrequency) config;
            if (interval.getSeconds() < 0 || interval.getMinutes() < 0
                    || interval.getHours() < 0 || interval.getDays() < 0) {
                throw new ValidationException("Interval units must not be negative: " + interval);
            }
            try {
                Duration duration = interval.toDuration();
                if (duration.isZero()) {
                    throw new ValidationException(
                            "At least one interval (seconds, minutes, hours, days) must be greater than zero");
                }
                reference.plus(duration);
            } catch (ArithmeticException | DateTimeException e) {
                throw new ValidationException("Interval is too large: " + interval, e);
            }
        } else if (config instanceof DateFrequency) {
            if (((DateFrequency) config).getRunDate() == null) {
                throw new ValidationException("run_date is required for date frequency");
            }
        } else {
            throw new ValidationException("Unsupported frequency config: " + config.getClass().getName());
        }
    }

    /**
     * Earliest fire instant strictly after {@code from}.
     *
     * @param config a trigger config
     * @param from reference instant
     * @return the next fire time, or empty if the trigger will never fire again
     * @throws ValidationException if the config is malformed or its next fire time is out of range
     */
    public Optional<Instant> nextFireTime(FrequencyConfig config, Instant from) {
        validate(config, from);
        return switch (config.kind()) {
            case CRON -> nextCron((CronFrequency) config, from);
            case INTERVAL -> Optional.of(from.plus(((IntervalFrequency) config).toDuration()));
            case DATE -> {
                Instant runDate = ((DateFrequency) config).getRunDate();
                yield runDate.isAfter(from) ? Optional.of(runDate) : Optional.empty();
            }
        };
    }

    /**
     * Zone a cron config is evaluated in.
     */
    public ZoneId zoneOf(CronFrequency cron) {
        String tz = cron.getTimezone();
        if (tz == null || tz.isBlank()) {
            return defaultZone;
        }
        try {
            return ZoneId.of(tz.trim());
        } catch (DateTimeException e) {
            throw new ValidationException("Unknown timezone: " + tz, e);
        }
    }

    private Optional<Instant> nextCron(CronFrequency cron, Instant from) {
        ExecutionTime executionTime = executionTime(cron.getCronExpression());
        ZoneId zone = zoneOf(cron);

        ZonedDateTime cursor = from.atZone(zone);
        for (int i = 0; i < MAX_CRON_CANDIDATES; i++) {
            Optional<ZonedDateTime> next = executionTime.nextExecution(cursor);
            if (next.isEmpty()) {
                return Optional.empty();
            }
            ZonedDateTime candidate = next.get();
            if (!candidate.toInstant().isAfter(cursor.toInstant())) {
                // No forward progress; step past the candidate and search again
                cursor = cursor.plusSeconds(1);
                continue;
            }
            if (candidate.toInstant().isAfter(from) && matchesWallTime(executionTime, candidate)) {
                return Optional.of(candidate.toInstant());
            }
            cursor = candidate;
        }
        return Optional.empty();
    }

    // A wall time shifted forward out of a DST gap no longer matches the fields.
    // UTC has no gaps, so the local date-time is checked there.
    private static boolean matchesWallTime(ExecutionTime executionTime, ZonedDateTime candidate) {
        return executionTime.isMatch(candidate.toLocalDateTime().atZone(ZoneOffset.UTC));
    }

    private ExecutionTime executionTime(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ValidationException("cron_expression is required for cron frequency");
        }
        String normalized = expression.trim().replaceAll("\\s+", " ");
        return cronCache.computeIfAbsent(normalized, this::parse);
    }

    private ExecutionTime parse(String expression) {
        int fields = expression.split(" ").length;
        CronParser parser;
        if (fields == 5) {
            parser = unixParser;
        } else if (fields == 6) {
            parser = secondsParser;
        } else {
            throw new ValidationException(
                    "cron_expression must have 5 or 6 fields, got " + fields + ": " + expression);
        }
        try {
            Cron cron = parser.parse(expression);
            cron.validate();
            return ExecutionTime.forCron(cron);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid cron_expression '" + expression + "': " + e.getMessage(), e);
        }
    }
}
