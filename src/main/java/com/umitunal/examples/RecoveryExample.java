package com.umitunal.examples;

import com.umitunal.cronlite.CronliteScheduler;
import com.umitunal.cronlite.config.SchedulerConfig;
import com.umitunal.cronlite.config.StorageConfig;
import com.umitunal.cronlite.core.CronFrequency;
import com.umitunal.cronlite.core.JobDefinition;
import com.umitunal.cronlite.core.JobType;

/**
 * Restart example - jobs stored in RocksDB are restored and re-armed on startup.
 */
public class RecoveryExample {

    public static void main(String[] args) {
        System.out.println("=== Job Recovery Example ===\n");

        SchedulerConfig config = SchedulerConfig.newBuilder()
                .withStorage(StorageConfig.newBuilder("/tmp/cronlite-recovery")
                        .withDurableWrites(true)
                        .build())
                .build();

        String jobId;
        try (CronliteScheduler scheduler = CronliteScheduler.newBuilder(config).build()) {
            scheduler.start();
            JobDefinition job = scheduler.createJob(JobDefinition.newBuilder(
                    "hourly backup", JobType.DATA_BACKUP, CronFrequency.of("0 * * * *")).build());
            jobId = job.getId();
            System.out.println("Created " + job.getName() + ", next run " + job.getNextRun());
        } catch (Exception e) {
            e.printStackTrace();
            return;
        }

        System.out.println("\nScheduler stopped, starting again...");

        try (CronliteScheduler scheduler = CronliteScheduler.newBuilder(config).build()) {
            scheduler.start();
            JobDefinition restored = scheduler.getJob(jobId);
            System.out.println("Restored " + restored.getName() + ", next run " + restored.getNextRun()
                    + ", armed=" + scheduler.getRegistry().isArmed(jobId));

            scheduler.deleteJob(jobId);
            System.out.println("Deleted " + jobId);
            System.out.println(scheduler.statistics());
        } catch (Exception e) {
            e.printStackTrace();
        }
    }
}
