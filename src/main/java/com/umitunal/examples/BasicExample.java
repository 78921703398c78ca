package com.umitunal.examples;

import com.umitunal.cronlite.CronliteScheduler;
import com.umitunal.cronlite.config.SchedulerConfig;
import com.umitunal.cronlite.core.ExecutionLog;
import com.umitunal.cronlite.core.IntervalFrequency;
import com.umitunal.cronlite.core.JobDefinition;
import com.umitunal.cronlite.core.JobType;
import com.umitunal.cronlite.handler.HandlerRegistry;
import com.umitunal.cronlite.handler.HandlerResult;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Basic scheduling example - an interval job with a custom handler.
 */
public class BasicExample {

    public static void main(String[] args) {
        System.out.println("=== Basic Scheduling Example ===\n");

        SchedulerConfig config = SchedulerConfig.newBuilder()
                .withHandlerThreads(2)
                .build();

        AtomicInteger runs = new AtomicInteger();
        HandlerRegistry handlers = HandlerRegistry.newBuilder()
                .register(JobType.CUSTOM, job -> HandlerResult.success("Run #" + runs.incrementAndGet() + " of " + job.getName()))
                .build();

        try (CronliteScheduler scheduler = CronliteScheduler.newBuilder(config)
                .withHandlers(handlers)
                .build()) {
            scheduler.start();

            JobDefinition job = scheduler.createJob(JobDefinition.newBuilder(
                    "heartbeat", JobType.CUSTOM, IntervalFrequency.ofSeconds(1)).build());
            System.out.println("Created: " + job);

            // Let it fire a few times
            Thread.sleep(3500);

            System.out.println("\nExecution log:");
            for (ExecutionLog entry : scheduler.jobLogs(job.getId(), 10)) {
                System.out.println("  " + entry);
            }
            System.out.println("\n" + scheduler.statistics());

        } catch (Exception e) {
            e.printStackTrace();
        }
    }
}
