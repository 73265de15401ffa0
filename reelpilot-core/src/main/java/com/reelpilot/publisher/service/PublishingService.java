package com.reelpilot.publisher.service;

import com.reelpilot.publisher.config.PublisherProperties;
import com.reelpilot.publisher.dto.QuotaUsage;
import com.reelpilot.publisher.dto.ScheduledPublication;
import com.reelpilot.publisher.dto.UploadCycleSummary;
import com.reelpilot.publisher.model.CheckpointRecord;
import com.reelpilot.publisher.model.SeoMetadata;
import com.reelpilot.publisher.util.VideoTypes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point for the content pipeline and the daemon: registration, queueing, polling,
 * cleanup and checkpoints behind one service.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PublishingService {

    private final VideoLifecycleService lifecycle;
    private final UploadQueueService uploadQueue;
    private final UploadWorker uploadWorker;
    private final CheckpointService checkpoints;
    private final QuotaLedgerService quotaLedger;
    private final PublishScheduler scheduler;
    private final PublisherProperties properties;

    public String registerVideo(String filePath, String videoType, String topic, String scheduledTime,
                                Map<String, Object> metadata) {
        return lifecycle.register(filePath, videoType, topic, scheduledTime, metadata);
    }

    public boolean enqueueForUpload(String filePath, String videoType, String topic, String scheduledTime,
                                    SeoMetadata seo, String thumbnailPath, Map<String, Object> metadata) {
        return uploadQueue.enqueue(filePath, videoType, topic, scheduledTime, seo, thumbnailPath, metadata);
    }

    /**
     * Picks the next weekday slot for the video, then registers and enqueues it.
     */
    public ScheduledPublication schedule(String filePath, String thumbnailPath, String videoType, String topic,
                                         SeoMetadata seo, Map<String, Object> metadata) {
        PublishScheduler.ContentType contentType = VideoTypes.isLong(videoType)
                ? PublishScheduler.ContentType.LONG
                : PublishScheduler.ContentType.SHORT;
        Instant publishAt = scheduler.nextSlot(contentType);
        return registerAndEnqueue(filePath, thumbnailPath, videoType, topic, seo, metadata, publishAt);
    }

    /**
     * Schedules the {@code index}-th short cut from a long video on the rotating slot table,
     * {@code index + 1} days after the long video goes live. The short is marked to be linked
     * to the long video once that one is uploaded.
     */
    public ScheduledPublication scheduleShort(int index, Instant longPublishAt, String filePath, String thumbnailPath,
                                              String topic, SeoMetadata seo, Map<String, Object> metadata) {
        Instant publishAt = scheduler.nextRotationSlot(index, longPublishAt);
        Map<String, Object> shortMetadata = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
        shortMetadata.putIfAbsent(UploadQueueService.METADATA_LINKED_LONG_VIDEO, UploadQueueService.LINK_PENDING);
        return registerAndEnqueue(filePath, thumbnailPath, VideoTypes.shortAt(index + 1), topic, seo,
                shortMetadata, publishAt);
    }

    public UploadCycleSummary pollOnce() {
        return uploadWorker.pollOnce();
    }

    public int cleanupUploaded(int maxAgeHours) {
        return lifecycle.cleanupUploaded(maxAgeHours);
    }

    public int cleanupUploaded() {
        return cleanupUploaded(properties.getLifecycle().getMaxAgeHours());
    }

    public boolean saveCheckpoint(String step, Map<String, Object> data) {
        return checkpoints.save(step, data);
    }

    public boolean shouldResume() {
        return checkpoints.shouldResume();
    }

    public Optional<CheckpointRecord> loadCheckpoint() {
        return checkpoints.load();
    }

    public boolean clearCheckpoint() {
        return checkpoints.clear();
    }

    public QuotaUsage quotaUsage() {
        return quotaLedger.currentUsage(properties.getQuota().getDailyLimit());
    }

    private ScheduledPublication registerAndEnqueue(String filePath, String thumbnailPath, String videoType,
                                                    String topic, SeoMetadata seo, Map<String, Object> metadata,
                                                    Instant publishAt) {
        String scheduledTime = publishAt.toString();
        Map<String, Object> recordMetadata = metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>();
        if (thumbnailPath != null) {
            recordMetadata.put(VideoLifecycleService.METADATA_THUMBNAIL_PATH, thumbnailPath);
        }
        String videoId = lifecycle.register(filePath, videoType, topic, scheduledTime, recordMetadata);
        boolean enqueued = uploadQueue.enqueue(filePath, videoType, topic, scheduledTime, seo, thumbnailPath, metadata);
        log.info("Scheduled {} for {}", videoId, scheduledTime);
        return new ScheduledPublication(videoId, publishAt, enqueued);
    }
}
