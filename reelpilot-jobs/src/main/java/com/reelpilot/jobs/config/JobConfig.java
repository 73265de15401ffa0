package com.reelpilot.jobs.config;

import com.reelpilot.publisher.service.UploadWorker;
import com.reelpilot.publisher.service.VideoLifecycleService;
import jakarta.annotation.PostConstruct;
import org.jobrunr.scheduling.JobScheduler;
import org.jobrunr.scheduling.cron.Cron;
import org.springframework.context.annotation.Configuration;

@Configuration
public class JobConfig {

    static final String UPLOAD_POLL_JOB = "upload-poll";
    static final String LIFECYCLE_CLEANUP_JOB = "lifecycle-cleanup";

    private final JobScheduler jobScheduler;
    private final UploadWorker uploadWorker;
    private final VideoLifecycleService videoLifecycleService;

    public JobConfig(JobScheduler jobScheduler,
                     UploadWorker uploadWorker,
                     VideoLifecycleService videoLifecycleService) {
        this.jobScheduler = jobScheduler;
        this.uploadWorker = uploadWorker;
        this.videoLifecycleService = videoLifecycleService;
    }

    @PostConstruct
    public void scheduleRecurrently() {
        jobScheduler.scheduleRecurrently(UPLOAD_POLL_JOB, Cron.minutely(), uploadWorker::runScheduledCycle);
        jobScheduler.scheduleRecurrently(LIFECYCLE_CLEANUP_JOB, Cron.hourly(), videoLifecycleService::runScheduledCleanup);
    }
}
