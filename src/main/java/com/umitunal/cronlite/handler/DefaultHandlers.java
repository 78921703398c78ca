package com.umitunal.cronlite.handler;

import com.umitunal.cronlite.config.SchedulerConfig;
import com.umitunal.cronlite.core.JobType;

/**
 * Built-in handler set covering every job type.
 */
public final class DefaultHandlers {

    private DefaultHandlers() {
    }

    /**
     * Builder pre-populated with one handler per job type and the configured
     * timeouts. Callers may replace any entry before {@code build()}.
     */
    public static HandlerRegistry.Builder create(SchedulerConfig config) {
        return HandlerRegistry.newBuilder()
                .register(JobType.EMAIL_NOTIFICATION, new SimulatedWorkHandler(
                        config.getWorkDuration(JobType.EMAIL_NOTIFICATION), "Email notification sent"))
                .register(JobType.DATA_BACKUP, new SimulatedWorkHandler(
                        config.getWorkDuration(JobType.DATA_BACKUP), "Data backup completed"))
                .register(JobType.REPORT_GENERATION, new SimulatedWorkHandler(
                        config.getWorkDuration(JobType.REPORT_GENERATION), "Report generated"))
                .register(JobType.FILE_CLEANUP, new SimulatedWorkHandler(
                        config.getWorkDuration(JobType.FILE_CLEANUP), "File cleanup completed"))
                .register(JobType.CUSTOM, new SimulatedWorkHandler(
                        config.getWorkDuration(JobType.CUSTOM), "Custom job executed"))
                .register(JobType.API_CALL, new ApiCallHandler(
                        config.getApiCallUrl(), config.getApiCallTimeout()))
                .withTimeouts(config.getHandlerTimeouts());
    }
}
