package com.umitunal.cronlite.stats;

import com.umitunal.cronlite.core.ExecutionLog;
import com.umitunal.cronlite.core.ExecutionStatus;
import com.umitunal.cronlite.core.IntervalFrequency;
import com.umitunal.cronlite.core.JobDefinition;
import com.umitunal.cronlite.core.JobType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class StatisticsAggregatorTest {

    private static final Instant T0 = Instant.parse("2023-03-01T22:30:00Z");

    private final StatisticsAggregator aggregator = new StatisticsAggregator();

    private static JobDefinition job(String id, JobType type, boolean active) {
        return JobDefinition.newBuilder(id, type, IntervalFrequency.ofSeconds(60))
                .withId(id)
                .withActive(active)
                .build();
    }

    @Test
    @DisplayName("Should return zeros and a null average for empty input")
    void testEmpty() {
        Statistics stats = aggregator.aggregate(List.of(), List.of());

        assertThat(stats.getTotalSchedulers()).isZero();
        assertThat(stats.getTotalExecutions()).isZero();
        assertThat(stats.getExecutionsByJobType()).isEmpty();
        assertThat(stats.getExecutionsByDate()).isEmpty();
        assertThat(stats.getAverageExecutionDuration()).isNull();
    }

    @Test
    @DisplayName("Should count jobs and executions consistently")
    void testCounts() {
        // Given
        JobDefinition backup = job("backup", JobType.DATA_BACKUP, true);
        JobDefinition email = job("email", JobType.EMAIL_NOTIFICATION, false);
        JobDefinition custom = job("custom", JobType.CUSTOM, true);

        ExecutionLog ok = ExecutionLog.started("l1", backup, T0)
                .complete(ExecutionStatus.SUCCESS, "ok", T0.plusSeconds(2));
        ExecutionLog failed = ExecutionLog.started("l2", email, T0.plusSeconds(3600))
                .complete(ExecutionStatus.ERROR, "Job failed: smtp", T0.plusSeconds(3604));
        ExecutionLog running = ExecutionLog.started("l3", backup, T0.plusSeconds(7200));

        // When
        Statistics stats = aggregator.aggregate(List.of(backup, email, custom), List.of(ok, failed, running));

        // Then
        assertThat(stats.getTotalSchedulers()).isEqualTo(3);
        assertThat(stats.getActiveSchedulers()).isEqualTo(2);
        assertThat(stats.getPausedSchedulers()).isEqualTo(1);
        assertThat(stats.getActiveSchedulers() + stats.getPausedSchedulers()).isEqualTo(stats.getTotalSchedulers());

        assertThat(stats.getTotalExecutions()).isEqualTo(3);
        assertThat(stats.getSuccessfulExecutions()).isEqualTo(1);
        assertThat(stats.getFailedExecutions()).isEqualTo(1);
        assertThat(stats.getRunningExecutions()).isEqualTo(1);
        assertThat(stats.getSuccessfulExecutions() + stats.getFailedExecutions() + stats.getRunningExecutions())
                .isEqualTo(stats.getTotalExecutions());

        assertThat(stats.getExecutionsByJobType())
                .containsOnly(entry("data_backup", 2L), entry("email_notification", 1L));
        assertThat(stats.getExecutionsByDate())
                .containsExactly(entry(LocalDate.of(2023, 3, 1), 1L), entry(LocalDate.of(2023, 3, 2), 2L));
        assertThat(stats.getAverageExecutionDuration()).isEqualTo(3.0);
    }

    @Test
    @DisplayName("Should group executions by date in the configured zone")
    void testZoneGrouping() {
        JobDefinition backup = job("backup", JobType.DATA_BACKUP, true);
        ExecutionLog late = ExecutionLog.started("l1", backup, T0);

        Statistics utc = aggregator.aggregate(List.of(backup), List.of(late));
        Statistics istanbul = new StatisticsAggregator(ZoneId.of("Europe/Istanbul"))
                .aggregate(List.of(backup), List.of(late));

        assertThat(utc.getExecutionsByDate()).containsOnlyKeys(LocalDate.of(2023, 3, 1));
        assertThat(istanbul.getExecutionsByDate()).containsOnlyKeys(LocalDate.of(2023, 3, 2));
    }

    @Test
    @DisplayName("Should leave the average null while every execution is still running")
    void testOnlyRunning() {
        JobDefinition backup = job("backup", JobType.DATA_BACKUP, true);

        Statistics stats = aggregator.aggregate(List.of(backup), List.of(ExecutionLog.started("l1", backup, T0)));

        assertThat(stats.getRunningExecutions()).isEqualTo(1);
        assertThat(stats.getAverageExecutionDuration()).isNull();
    }
}
