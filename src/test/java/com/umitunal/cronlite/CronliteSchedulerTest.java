package com.umitunal.cronlite;

import com.umitunal.cronlite.config.SchedulerConfig;
import com.umitunal.cronlite.config.StorageConfig;
import com.umitunal.cronlite.core.CronFrequency;
import com.umitunal.cronlite.core.DateFrequency;
import com.umitunal.cronlite.core.ExecutionLog;
import com.umitunal.cronlite.core.ExecutionStatus;
import com.umitunal.cronlite.core.IntervalFrequency;
import com.umitunal.cronlite.core.JobDefinition;
import com.umitunal.cronlite.core.JobNotFoundException;
import com.umitunal.cronlite.core.JobType;
import com.umitunal.cronlite.core.JobUpdate;
import com.umitunal.cronlite.handler.HandlerRegistry;
import com.umitunal.cronlite.handler.HandlerResult;
import com.umitunal.cronlite.stats.Statistics;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.*;

class CronliteSchedulerTest {

    @TempDir
    Path tempDir;

    private SchedulerConfig config;
    private CronliteScheduler scheduler;

    @BeforeEach
    void setUp() throws Exception {
        config = SchedulerConfig.newBuilder()
                .withStorage(StorageConfig.newBuilder(tempDir.toString())
                        .withDurableWrites(false)
                        .build())
                .withHandlerThreads(4)
                .build();
        scheduler = open();
    }

    @AfterEach
    void tearDown() {
        if (scheduler != null) {
            scheduler.close();
        }
    }

    private CronliteScheduler open() throws Exception {
        HandlerRegistry handlers = HandlerRegistry.newBuilder()
                .register(JobType.CUSTOM, job -> HandlerResult.success("ran " + job.getName()))
                .register(JobType.DATA_BACKUP, job -> HandlerResult.success("backed up"))
                .register(JobType.EMAIL_NOTIFICATION, job -> {
                    throw new IllegalStateException("smtp down");
                })
                .build();
        CronliteScheduler opened = CronliteScheduler.newBuilder(config)
                .withHandlers(handlers)
                .build();
        opened.start();
        return opened;
    }

    @Test
    @DisplayName("Should run jobs and report their logs and statistics")
    void testEndToEnd() {
        // Given
        JobDefinition ok = scheduler.createJob(JobDefinition.newBuilder("tick", JobType.CUSTOM,
                IntervalFrequency.ofSeconds(1)).build());
        JobDefinition failing = scheduler.createJob(JobDefinition.newBuilder("mail", JobType.EMAIL_NOTIFICATION,
                DateFrequency.at(Instant.now().plusMillis(500))).build());
        scheduler.createJob(JobDefinition.newBuilder("nightly", JobType.DATA_BACKUP,
                CronFrequency.of("0 3 * * *")).withActive(false).build());

        // When
        await().atMost(6, TimeUnit.SECONDS).until(() ->
                scheduler.jobLogs(ok.getId(), 10).stream().filter(l -> l.getStatus() == ExecutionStatus.SUCCESS).count() >= 2
                        && scheduler.jobLogs(failing.getId(), 10).stream().anyMatch(l -> l.getStatus().isTerminal()));

        // Then
        ExecutionLog mailLog = scheduler.jobLogs(failing.getId(), 10).get(0);
        assertThat(mailLog.getStatus()).isEqualTo(ExecutionStatus.ERROR);
        assertThat(mailLog.getMessage()).isEqualTo("Job failed: smtp down");
        assertThat(scheduler.getJob(failing.getId()).isActive()).isFalse();

        Statistics stats = scheduler.statistics();
        assertThat(stats.getTotalSchedulers()).isEqualTo(3);
        assertThat(stats.getActiveSchedulers()).isEqualTo(1);
        assertThat(stats.getPausedSchedulers()).isEqualTo(2);
        assertThat(stats.getFailedExecutions()).isEqualTo(1);
        assertThat(stats.getSuccessfulExecutions()).isGreaterThanOrEqualTo(2);
        assertThat(stats.getSuccessfulExecutions() + stats.getFailedExecutions() + stats.getRunningExecutions())
                .isEqualTo(stats.getTotalExecutions());
        assertThat(stats.getExecutionsByJobType()).containsKeys("custom", "email_notification");
        assertThat(scheduler.logs(1)).singleElement()
                .satisfies(l -> assertThat(l.getSchedulerId()).isIn(ok.getId(), failing.getId()));
    }

    @Test
    @DisplayName("Should list jobs newest first")
    void testListJobs() throws Exception {
        JobDefinition first = scheduler.createJob(JobDefinition.newBuilder("first", JobType.CUSTOM,
                IntervalFrequency.ofHours(1)).build());
        await().pollDelay(5, TimeUnit.MILLISECONDS).until(() -> true);
        JobDefinition second = scheduler.createJob(JobDefinition.newBuilder("second", JobType.CUSTOM,
                IntervalFrequency.ofHours(1)).build());

        List<JobDefinition> jobs = scheduler.listJobs();

        assertThat(jobs).extracting(JobDefinition::getId).containsExactly(second.getId(), first.getId());
    }

    @Test
    @DisplayName("Should restore jobs after a restart with their schedule recomputed")
    void testRestart() throws Exception {
        // Given
        JobDefinition hourly = scheduler.createJob(JobDefinition.newBuilder("hourly", JobType.DATA_BACKUP,
                CronFrequency.of("0 * * * *")).build());
        JobDefinition paused = scheduler.createJob(JobDefinition.newBuilder("paused", JobType.CUSTOM,
                IntervalFrequency.ofMinutes(10)).build());
        scheduler.pauseJob(paused.getId());
        scheduler.updateJob(hourly.getId(), JobUpdate.newBuilder().withDescription("top of the hour").build());

        // When
        scheduler.close();
        scheduler = open();

        // Then
        JobDefinition restored = scheduler.getJob(hourly.getId());
        assertThat(restored.getDescription()).isEqualTo("top of the hour");
        assertThat(restored.getNextRun()).isAfter(Instant.now());
        assertThat(scheduler.getRegistry().isArmed(hourly.getId())).isTrue();
        assertThat(scheduler.getJob(paused.getId()).isActive()).isFalse();
        assertThat(scheduler.getRegistry().isArmed(paused.getId())).isFalse();
    }

    @Test
    @DisplayName("Should forget deleted jobs but keep their execution history")
    void testDelete() throws Exception {
        // Given
        JobDefinition job = scheduler.createJob(JobDefinition.newBuilder("once", JobType.CUSTOM,
                DateFrequency.at(Instant.now().plusMillis(200))).build());
        await().atMost(5, TimeUnit.SECONDS).until(() -> scheduler.logs().stream()
                .anyMatch(l -> l.getStatus() == ExecutionStatus.SUCCESS));

        // When
        scheduler.deleteJob(job.getId());

        // Then
        assertThatThrownBy(() -> scheduler.getJob(job.getId())).isInstanceOf(JobNotFoundException.class);
        assertThatThrownBy(() -> scheduler.jobLogs(job.getId(), 10)).isInstanceOf(JobNotFoundException.class);
        assertThat(scheduler.logs()).extracting(ExecutionLog::getSchedulerId).contains(job.getId());

        scheduler.close();
        scheduler = open();
        assertThat(scheduler.listJobs()).isEmpty();
        assertThat(scheduler.statistics().getTotalExecutions()).isEqualTo(1);
    }
}
