package com.umitunal.examples;

import com.umitunal.cronlite.CronliteScheduler;
import com.umitunal.cronlite.config.SchedulerConfig;
import com.umitunal.cronlite.core.CronFrequency;
import com.umitunal.cronlite.core.DateFrequency;
import com.umitunal.cronlite.core.IntervalFrequency;
import com.umitunal.cronlite.core.JobDefinition;
import com.umitunal.cronlite.core.JobType;
import com.umitunal.cronlite.core.JobUpdate;

import java.time.Duration;
import java.time.Instant;

/**
 * Trigger kinds example - cron, interval and one-shot jobs, pause and resume.
 */
public class ScheduledJobsExample {

    public static void main(String[] args) {
        System.out.println("=== Scheduled Jobs Example ===\n");

        SchedulerConfig config = SchedulerConfig.newBuilder()
                .withWorkDuration(JobType.EMAIL_NOTIFICATION, Duration.ofMillis(200))
                .withWorkDuration(JobType.FILE_CLEANUP, Duration.ofMillis(200))
                .withWorkDuration(JobType.REPORT_GENERATION, Duration.ofMillis(200))
                .build();

        try (CronliteScheduler scheduler = CronliteScheduler.newBuilder(config).build()) {
            scheduler.start();

            JobDefinition report = scheduler.createJob(JobDefinition.newBuilder(
                    "weekday report", JobType.REPORT_GENERATION,
                    CronFrequency.of("0 9 * * 1-5", "Europe/Istanbul")).build());
            JobDefinition cleanup = scheduler.createJob(JobDefinition.newBuilder(
                    "cleanup", JobType.FILE_CLEANUP, IntervalFrequency.ofSeconds(1)).build());
            JobDefinition reminder = scheduler.createJob(JobDefinition.newBuilder(
                    "reminder", JobType.EMAIL_NOTIFICATION,
                    DateFrequency.at(Instant.now().plusSeconds(2))).build());

            System.out.println("Scheduled jobs:");
            for (JobDefinition job : scheduler.listJobs()) {
                System.out.println("  " + job.getName() + " -> next run " + job.getNextRun());
            }

            System.out.println("\nWaiting 3 seconds...");
            Thread.sleep(3000);

            System.out.println("Reminder after firing: active=" + scheduler.getJob(reminder.getId()).isActive()
                    + ", nextRun=" + scheduler.getJob(reminder.getId()).getNextRun());

            scheduler.pauseJob(cleanup.getId());
            System.out.println("Paused cleanup");

            scheduler.updateJob(report.getId(), JobUpdate.newBuilder()
                    .withFrequency(CronFrequency.of("30 18 * * *"))
                    .build());
            System.out.println("Report moved to " + scheduler.getJob(report.getId()).getNextRun());

            scheduler.resumeJob(cleanup.getId());
            System.out.println("Resumed cleanup, next run " + scheduler.getJob(cleanup.getId()).getNextRun());

            System.out.println("\n" + scheduler.statistics());

        } catch (Exception e) {
            e.printStackTrace();
        }
    }
}
