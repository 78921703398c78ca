package com.umitunal.cronlite.registry;

import com.umitunal.cronlite.core.DateFrequency;
import com.umitunal.cronlite.core.DefinitionStore;
import com.umitunal.cronlite.core.FrequencyKind;
import com.umitunal.cronlite.core.JobDefinition;
import com.umitunal.cronlite.core.JobNotFoundException;
import com.umitunal.cronlite.core.JobUpdate;
import com.umitunal.cronlite.core.SchedulerException;
import com.umitunal.cronlite.core.ValidationException;
import com.umitunal.cronlite.handler.HandlerRegistry;
import com.umitunal.cronlite.trigger.TriggerResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Authoritative in-memory schedule: job id to definition plus armed state.
 *
 * All reads and writes go through one lock. Armed jobs sit on a timeline ordered
 * by next fire time; every mutation signals the condition the engine waits on so
 * a changed schedule takes effect immediately. Each mutation is written through
 * to the {@link DefinitionStore} before it becomes visible.
 */
public class JobRegistry implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(JobRegistry.class);

    public static final int MAX_NAME_LENGTH = 200;
    public static final int MAX_DESCRIPTION_LENGTH = 1000;

    private static final Comparator<JobDefinition> NEXT_RUN_ORDER = Comparator
            .comparing(JobDefinition::getNextRun, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(JobDefinition::getId);

    private final TriggerResolver triggers;
    private final DefinitionStore store;
    private final HandlerRegistry handlers;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition scheduleChanged = lock.newCondition();
    private final Map<String, Entry> entries = new HashMap<>();
    private final TreeMap<ScheduleKey, Entry> timeline = new TreeMap<>();
    private boolean closed;

    public JobRegistry(TriggerResolver triggers, DefinitionStore store, HandlerRegistry handlers, Clock clock) {
        this.triggers = triggers;
        this.store = store;
        this.handlers = handlers;
        this.clock = clock;
    }

    /**
     * Load every stored definition and arm the active ones, with next_run
     * recomputed from now. Definitions that no longer validate are kept but not armed.
     *
     * @return number of jobs armed
     */
    public int rehydrate() {
        List<JobDefinition> stored = store.loadAllDefinitions();
        Instant now = clock.instant();
        int armed = 0;

        lock.lock();
        try {
            ensureOpen();
            for (JobDefinition definition : stored) {
                if (entries.containsKey(definition.getId())) {
                    continue;
                }
                Entry entry = new Entry(definition);
                entries.put(definition.getId(), entry);

                try {
                    validate(definition);
                } catch (ValidationException e) {
                    log.warn("Job {} ({}) restored without schedule: {}",
                            definition.getId(), definition.getName(), e.getMessage());
                    continue;
                }
                if (!definition.isActive()) {
                    continue;
                }

                Instant next = triggers.nextFireTime(definition.getFrequency(), now).orElse(null);
                entry.definition = definition.toBuilder().withNextRun(next).build();
                store.saveDefinition(entry.definition);
                if (next == null) {
                    log.info("Job {} ({}) has no remaining fire time", definition.getId(), definition.getName());
                    continue;
                }
                arm(entry);
                armed++;
            }
            scheduleChanged.signalAll();
        } finally {
            lock.unlock();
        }

        log.info("Restored {} job definitions, {} armed", stored.size(), armed);
        return armed;
    }

    /**
     * Register a new job. Its next_run is computed from now.
     *
     * @throws ValidationException on a bad definition or a run_date that already elapsed
     */
    public JobDefinition register(JobDefinition definition) {
        return register(definition, false);
    }

    /**
     * Register a new job.
     *
     * @param acceptElapsedRunDate store a date job whose run_date has passed as an
     *                             inert entry instead of rejecting it
     * @throws ValidationException on a bad definition
     */
    public JobDefinition register(JobDefinition definition, boolean acceptElapsedRunDate) {
        validate(definition);

        lock.lock();
        try {
            ensureOpen();
            Instant now = clock.instant();
            String id = definition.getId() != null ? definition.getId() : UUID.randomUUID().toString();
            if (entries.containsKey(id)) {
                throw new ValidationException("Job with id " + id + " already exists");
            }

            Instant next = triggers.nextFireTime(definition.getFrequency(), now).orElse(null);
            if (next == null && !acceptElapsedRunDate) {
                throw new ValidationException("run_date " + runDateOf(definition) + " has already elapsed");
            }

            JobDefinition registered = definition.toBuilder()
                    .withId(id)
                    .withCreatedAt(now)
                    .withUpdatedAt(now)
                    .withLastRun(null)
                    .withNextRun(next)
                    .build();

            store.saveDefinition(registered);
            Entry entry = new Entry(registered);
            entries.put(id, entry);
            if (registered.isActive() && next != null) {
                arm(entry);
            }
            scheduleChanged.signalAll();

            log.info("Registered job {} ({}, {}), next run {}",
                    id, registered.getName(), registered.getJobType(), next);
            return registered;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Apply a partial update atomically. Nothing changes if validation fails.
     * An active job is re-armed with next_run recomputed from now; a paused job
     * stays paused unless the update activates it.
     *
     * @throws JobNotFoundException if the job does not exist
     * @throws ValidationException if the merged definition is invalid
     */
    public JobDefinition update(String id, JobUpdate update) {
        lock.lock();
        try {
            ensureOpen();
            Entry entry = require(id);
            Instant now = clock.instant();

            JobDefinition merged = update.applyTo(entry.definition)
                    .withUpdatedAt(now)
                    .build();
            validate(merged);

            Instant next = triggers.nextFireTime(merged.getFrequency(), now).orElse(null);
            if (merged.isActive() && next == null) {
                throw new ValidationException("run_date " + runDateOf(merged) + " has already elapsed");
            }
            JobDefinition updated = merged.toBuilder().withNextRun(next).build();

            store.saveDefinition(updated);
            disarm(entry);
            entry.definition = updated;
            entry.generation++;
            if (updated.isActive() && next != null) {
                arm(entry);
            }
            scheduleChanged.signalAll();

            log.info("Updated job {} ({}), next run {}", id, updated.getName(), next);
            return updated;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Disarm a job and mark it inactive. next_run keeps the value it would have
     * fired at. Idempotent.
     *
     * @throws JobNotFoundException if the job does not exist
     */
    public JobDefinition pause(String id) {
        lock.lock();
        try {
            ensureOpen();
            Entry entry = require(id);
            if (!entry.definition.isActive() && !entry.isArmed()) {
                return entry.definition;
            }

            JobDefinition paused = entry.definition.toBuilder()
                    .withActive(false)
                    .withUpdatedAt(clock.instant())
                    .build();
            store.saveDefinition(paused);
            disarm(entry);
            entry.definition = paused;
            entry.generation++;
            scheduleChanged.signalAll();

            log.info("Paused job {} ({})", id, paused.getName());
            return paused;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Re-arm a job with next_run recomputed from now and mark it active.
     *
     * @throws JobNotFoundException if the job does not exist
     * @throws ValidationException if the trigger has no remaining fire time
     */
    public JobDefinition resume(String id) {
        lock.lock();
        try {
            ensureOpen();
            Entry entry = require(id);
            Instant now = clock.instant();

            Instant next = triggers.nextFireTime(entry.definition.getFrequency(), now)
                    .orElseThrow(() -> new ValidationException(
                            "Job " + id + " has no remaining fire time and cannot be resumed"));

            JobDefinition resumed = entry.definition.toBuilder()
                    .withActive(true)
                    .withNextRun(next)
                    .withUpdatedAt(now)
                    .build();
            store.saveDefinition(resumed);
            disarm(entry);
            entry.definition = resumed;
            entry.generation++;
            arm(entry);
            scheduleChanged.signalAll();

            log.info("Resumed job {} ({}), next run {}", id, resumed.getName(), next);
            return resumed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Disarm and remove a job. An execution already dispatched may finish; no new
     * one starts once this returns.
     *
     * @throws JobNotFoundException if the job does not exist
     */
    public void delete(String id) {
        lock.lock();
        try {
            ensureOpen();
            Entry entry = require(id);
            store.deleteDefinition(id);
            disarm(entry);
            entries.remove(id);
            scheduleChanged.signalAll();

            log.info("Deleted job {} ({})", id, entry.definition.getName());
        } finally {
            lock.unlock();
        }
    }

    /**
     * @throws JobNotFoundException if the job does not exist
     */
    public JobDefinition get(String id) {
        lock.lock();
        try {
            return require(id).definition;
        } finally {
            lock.unlock();
        }
    }

    public Optional<JobDefinition> find(String id) {
        lock.lock();
        try {
            Entry entry = entries.get(id);
            return entry == null ? Optional.empty() : Optional.of(entry.definition);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Whether a job currently holds a pending fire time.
     */
    public boolean isArmed(String id) {
        lock.lock();
        try {
            Entry entry = entries.get(id);
            return entry != null && entry.isArmed();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Copy of every definition, soonest next_run first, unscheduled jobs last.
     */
    public List<JobDefinition> snapshot() {
        List<JobDefinition> copy;
        lock.lock();
        try {
            copy = new ArrayList<>(entries.size());
            for (Entry entry : entries.values()) {
                copy.add(entry.definition);
            }
        } finally {
            lock.unlock();
        }
        copy.sort(NEXT_RUN_ORDER);
        return copy;
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Claim the earliest armed job that is due now and not already executing.
     */
    public Optional<Dispatch> tryAcquireDue() {
        lock.lock();
        try {
            return Optional.ofNullable(acquireDueLocked(clock.instant()));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Block until an armed job is due and claim it. Wakes early whenever the
     * schedule changes.
     *
     * @return the claimed job, or null once the registry is closed
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public Dispatch awaitDue() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (!closed) {
                Instant now = clock.instant();
                Dispatch dispatch = acquireDueLocked(now);
                if (dispatch != null) {
                    return dispatch;
                }

                Instant wakeAt = earliestPendingLocked();
                if (wakeAt == null) {
                    scheduleChanged.await();
                } else {
                    long nanos = Duration.between(now, wakeAt).toNanos();
                    if (nanos > 0) {
                        scheduleChanged.awaitNanos(nanos);
                    }
                }
            }
            return null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Wait until the schedule changes or the timeout passes.
     *
     * @return false if the timeout elapsed without a change
     */
    public boolean awaitChange(long timeout, TimeUnit unit) throws InterruptedException {
        lock.lockInterruptibly();
        try {
            return scheduleChanged.await(timeout, unit);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Record a finished execution: set last_run and advance the schedule.
     *
     * The following fire time is computed from the dispatch's scheduled time, not
     * from the completion time. A date job becomes inactive with no next_run. If the
     * job was deleted meanwhile nothing happens; if it was updated, paused or resumed
     * meanwhile only last_run is recorded.
     *
     * @return the job's definition after completion, or empty if it was deleted
     * @throws SchedulerException if the definition store rejects the write; the
     *                            in-memory schedule has already advanced
     */
    public Optional<JobDefinition> complete(Dispatch dispatch, Instant startedAt) {
        lock.lock();
        try {
            Entry entry = entries.get(dispatch.getJobId());
            if (entry == null || entry != dispatch.entry) {
                log.debug("Job {} was deleted during execution", dispatch.getJobId());
                return Optional.empty();
            }
            entry.inFlight = false;

            JobDefinition.Builder builder = entry.definition.toBuilder().withLastRun(startedAt);
            boolean rearm = false;
            if (entry.generation == dispatch.getGeneration() && entry.definition.isActive()) {
                disarm(entry);
                if (entry.definition.getFrequencyKind() == FrequencyKind.DATE) {
                    builder.withActive(false).withNextRun(null);
                } else {
                    Instant next = triggers.nextFireTime(entry.definition.getFrequency(), dispatch.getScheduledAt())
                            .orElse(null);
                    builder.withNextRun(next);
                    rearm = next != null;
                }
            }

            entry.definition = builder.build();
            if (rearm) {
                arm(entry);
            }
            scheduleChanged.signalAll();

            store.saveDefinition(entry.definition);
            return Optional.of(entry.definition);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Hand back a claimed job without running it. Its next_run is unchanged, so it
     * is due again immediately.
     */
    public void release(Dispatch dispatch) {
        lock.lock();
        try {
            Entry entry = entries.get(dispatch.getJobId());
            if (entry != null && entry == dispatch.entry) {
                entry.inFlight = false;
            }
            scheduleChanged.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Whether a job has an execution in progress.
     */
    public boolean isExecuting(String id) {
        lock.lock();
        try {
            Entry entry = entries.get(id);
            return entry != null && entry.inFlight;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Disarm every job and wake waiting threads. Stored definitions are untouched.
     */
    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            for (Entry entry : entries.values()) {
                entry.key = null;
            }
            timeline.clear();
            scheduleChanged.signalAll();
        } finally {
            lock.unlock();
        }
        log.info("Job registry closed");
    }

    private Dispatch acquireDueLocked(Instant now) {
        for (Map.Entry<ScheduleKey, Entry> slot : timeline.entrySet()) {
            ScheduleKey key = slot.getKey();
            if (key.fireAt().isAfter(now)) {
                return null;
            }
            Entry entry = slot.getValue();
            if (entry.inFlight) {
                // Deferred until the running execution completes
                continue;
            }
            entry.inFlight = true;
            return new Dispatch(entry.definition, key.fireAt(), entry.generation, entry);
        }
        return null;
    }

    private Instant earliestPendingLocked() {
        for (Map.Entry<ScheduleKey, Entry> slot : timeline.entrySet()) {
            if (!slot.getValue().inFlight) {
                return slot.getKey().fireAt();
            }
        }
        return null;
    }

    private void arm(Entry entry) {
        disarm(entry);
        if (closed) {
            return;
        }
        ScheduleKey key = new ScheduleKey(entry.definition.getNextRun(), entry.definition.getId());
        timeline.put(key, entry);
        entry.key = key;
    }

    private void disarm(Entry entry) {
        if (entry.key != null) {
            timeline.remove(entry.key);
            entry.key = null;
        }
    }

    private Entry require(String id) {
        Entry entry = id == null ? null : entries.get(id);
        if (entry == null) {
            throw new JobNotFoundException(id);
        }
        return entry;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Job registry is closed");
        }
    }

    private void validate(JobDefinition definition) {
        String name = definition.getName();
        if (name == null || name.isBlank()) {
            throw new ValidationException("name is required");
        }
        if (name.length() > MAX_NAME_LENGTH) {
            throw new ValidationException("name must be at most " + MAX_NAME_LENGTH + " characters");
        }
        String description = definition.getDescription();
        if (description != null && description.length() > MAX_DESCRIPTION_LENGTH) {
            throw new ValidationException("description must be at most " + MAX_DESCRIPTION_LENGTH + " characters");
        }
        handlers.requireSupported(definition.getJobType());
        triggers.validate(definition.getFrequency(), clock.instant());
    }

    private static Object runDateOf(JobDefinition definition) {
        return definition.getFrequency() instanceof DateFrequency
                ? ((DateFrequency) definition.getFrequency()).getRunDate()
                : definition.getFrequency();
    }

    static final class Entry {
        JobDefinition definition;
        ScheduleKey key;       // non-null while armed
        boolean inFlight;      // an execution is running
        long generation;       // bumped by update/pause/resume

        Entry(JobDefinition definition) {
            this.definition = definition;
        }

        boolean isArmed() {
            return key != null;
        }
    }
}
