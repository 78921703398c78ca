package com.umitunal.cronlite.stats;

import com.umitunal.cronlite.core.ExecutionLog;
import com.umitunal.cronlite.core.ExecutionStatus;
import com.umitunal.cronlite.core.JobDefinition;

import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Computes {@link Statistics} from snapshots. Holds no counters of its own, so the
 * result is always reproducible from the inputs.
 */
public class StatisticsAggregator {
    private final ZoneId zone;

    public StatisticsAggregator() {
        this(ZoneOffset.UTC);
    }

    /**
     * @param zone zone whose calendar dates group executions by started_at
     */
    public StatisticsAggregator(ZoneId zone) {
        this.zone = zone;
    }

    public Statistics aggregate(Collection<JobDefinition> jobs, Collection<ExecutionLog> logs) {
        long active = 0;
        for (JobDefinition job : jobs) {
            if (job.isActive()) {
                active++;
            }
        }

        long successful = 0;
        long failed = 0;
        long running = 0;
        double durationSum = 0;
        long completed = 0;
        Map<String, Long> byJobType = new LinkedHashMap<>();
        SortedMap<LocalDate, Long> byDate = new TreeMap<>();

        for (ExecutionLog entry : logs) {
            ExecutionStatus status = entry.getStatus();
            if (status == ExecutionStatus.SUCCESS) {
                successful++;
            } else if (status == ExecutionStatus.ERROR) {
                failed++;
            } else {
                running++;
            }

            byJobType.merge(entry.getJobType().tag(), 1L, Long::sum);
            byDate.merge(entry.getStartedAt().atZone(zone).toLocalDate(), 1L, Long::sum);

            if (status.isTerminal() && entry.getDuration() != null) {
                durationSum += entry.getDuration();
                completed++;
            }
        }

        Double average = completed == 0 ? null : durationSum / completed;
        return new Statistics(jobs.size(), active, jobs.size() - active,
                logs.size(), successful, failed, running,
                byJobType, byDate, average);
    }
}
