package com.reelpilot.publisher.service;

import com.reelpilot.publisher.config.PublisherProperties;
import com.reelpilot.publisher.dto.StorageStats;
import com.reelpilot.publisher.exception.IllegalStatusTransitionException;
import com.reelpilot.publisher.model.LifecycleDocument;
import com.reelpilot.publisher.model.VideoRecord;
import com.reelpilot.publisher.model.VideoStatus;
import com.reelpilot.publisher.store.PersistentStateStore;
import com.reelpilot.publisher.util.FilePaths;
import com.reelpilot.publisher.util.TimeUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Registry of every rendered video, from render time until its file is removed.
 * <p>
 * Files are only ever removed by {@link #cleanupUploaded(int)}, and only for records that are
 * {@code uploaded}, carry an external video id, and whose scheduled publish time lies in the past
 * by at least the requested number of hours. A record scheduled in the future is never touched.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VideoLifecycleService {

    static final String REGISTRY_KEY = "video_lifecycle";
    public static final String METADATA_THUMBNAIL_PATH = "thumbnail_path";

    private static final DateTimeFormatter ID_FORMAT =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

    private final PersistentStateStore stateStore;
    private final Clock clock;
    private final PublisherProperties properties;

    public String register(String filePath, String videoType, String topic, String scheduledTime,
                           Map<String, Object> metadata) {
        Instant now = clock.instant();
        String path = FilePaths.normalize(filePath);
        String id = stateStore.update(REGISTRY_KEY, LifecycleDocument.class, LifecycleDocument::new, db -> {
            String candidate = videoType + "_" + ID_FORMAT.format(now);
            String unique = candidate;
            int suffix = 2;
            while (findById(db, unique).isPresent()) {
                unique = candidate + "_" + suffix++;
            }

            VideoRecord video = new VideoRecord();
            video.setId(unique);
            video.setFilePath(path);
            video.setVideoType(videoType);
            video.setTopic(topic);
            video.setScheduledTime(scheduledTime);
            video.setCreatedAt(now);
            video.setStatus(VideoStatus.CREATED);
            video.setMetadata(metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>());
            Object thumbnail = video.getMetadata().get(METADATA_THUMBNAIL_PATH);
            video.setThumbnailPath(thumbnail != null ? thumbnail.toString() : null);
            db.getVideos().add(video);
            return unique;
        });
        log.info("Registered {} as {} (publishes {})", FilePaths.fileName(path), id, scheduledTime);
        return id;
    }

    public boolean markUploadStarted(String videoId) {
        Instant now = clock.instant();
        Optional<VideoRecord> updated = stateStore.update(REGISTRY_KEY, LifecycleDocument.class, LifecycleDocument::new,
                db -> findById(db, videoId).map(video -> {
                    transition(video, VideoStatus.UPLOADING);
                    video.setUploadAttempts(video.getUploadAttempts() + 1);
                    video.setLastAttempt(now);
                    return video;
                }));
        if (updated.isEmpty()) {
            log.warn("Video not found: {}", videoId);
            return false;
        }
        log.info("Upload started: {} (attempt {})", videoId, updated.get().getUploadAttempts());
        return true;
    }

    /**
     * Confirms an upload by file path. Repeating the call with the same external id is a no-op.
     */
    public boolean markUploadSuccess(String filePath, String externalVideoId) {
        Instant now = clock.instant();
        String path = FilePaths.normalize(filePath);
        Optional<VideoRecord> updated = stateStore.update(REGISTRY_KEY, LifecycleDocument.class, LifecycleDocument::new,
                db -> findByPath(db, path).map(video -> {
                    if (video.getStatus() == VideoStatus.UPLOADED && externalVideoId.equals(video.getExternalVideoId())) {
                        return video;
                    }
                    transition(video, VideoStatus.UPLOADED);
                    video.setExternalVideoId(externalVideoId);
                    video.setUploadedAt(now);
                    video.setLastError(null);
                    return video;
                }));
        if (updated.isEmpty()) {
            log.warn("Video not tracked: {}", path);
            return false;
        }
        log.info("Upload confirmed: {} -> {}", FilePaths.fileName(path), externalVideoId);
        return true;
    }

    public boolean markUploadFailed(String videoId, String error) {
        Optional<VideoRecord> updated = stateStore.update(REGISTRY_KEY, LifecycleDocument.class, LifecycleDocument::new,
                db -> findById(db, videoId).map(video -> {
                    transition(video, VideoStatus.UPLOAD_FAILED);
                    video.setLastError(error);
                    return video;
                }));
        if (updated.isEmpty()) {
            log.warn("Video not found: {}", videoId);
            return false;
        }
        log.warn("Upload failed: {} (attempt {}) - {}", videoId, updated.get().getUploadAttempts(), error);
        return true;
    }

    /**
     * Removes the files of published videos and marks their records {@code deleted}.
     *
     * @param maxAgeHours minimum time since the scheduled publish time
     * @return number of records whose video file was removed by this sweep
     */
    public int cleanupUploaded(int maxAgeHours) {
        Duration minAge = Duration.ofHours(Math.max(0, maxAgeHours));
        int deleted = stateStore.update(REGISTRY_KEY, LifecycleDocument.class, LifecycleDocument::new, db -> {
            Instant now = clock.instant();
            int count = 0;
            for (VideoRecord video : db.getVideos()) {
                try {
                    if (isEligibleForDeletion(video, now, minAge) && deleteFiles(video, now)) {
                        count++;
                    }
                } catch (RuntimeException e) {
                    log.error("Cleanup skipped malformed record {}", video.getId(), e);
                }
            }
            db.setLastCleanup(now);
            return count;
        });
        if (deleted > 0) {
            log.info("Cleanup removed {} published video(s)", deleted);
        }
        return deleted;
    }

    public void runScheduledCleanup() {
        cleanupUploaded(properties.getLifecycle().getMaxAgeHours());
    }

    public Optional<VideoRecord> findByFilePath(String filePath) {
        return findByPath(loadRegistry(), FilePaths.normalize(filePath));
    }

    public Optional<VideoRecord> findById(String videoId) {
        return findById(loadRegistry(), videoId);
    }

    public List<VideoRecord> pendingUpload() {
        return loadRegistry().getVideos().stream()
                .filter(video -> video.getStatus() != null && video.getStatus().isAwaitingUpload())
                .collect(Collectors.toList());
    }

    public StorageStats storageStats() {
        LifecycleDocument db = loadRegistry();
        Map<VideoStatus, Integer> byStatus = new EnumMap<>(VideoStatus.class);
        long totalBytes = 0;
        for (VideoRecord video : db.getVideos()) {
            if (video.getStatus() != null) {
                byStatus.merge(video.getStatus(), 1, Integer::sum);
            }
            if (isBlank(video.getFilePath())) {
                continue;
            }
            try {
                Path file = Paths.get(video.getFilePath());
                if (Files.exists(file)) {
                    totalBytes += Files.size(file);
                }
            } catch (IOException | InvalidPathException e) {
                log.debug("Could not size {}", video.getFilePath(), e);
            }
        }
        int pending = byStatus.getOrDefault(VideoStatus.CREATED, 0) + byStatus.getOrDefault(VideoStatus.UPLOAD_FAILED, 0);
        return new StorageStats(db.getVideos().size(), byStatus, totalBytes, pending, db.getLastCleanup());
    }

    private boolean isEligibleForDeletion(VideoRecord video, Instant now, Duration minAge) {
        if (video.getStatus() != VideoStatus.UPLOADED || isBlank(video.getExternalVideoId())) {
            return false;
        }
        Optional<Instant> scheduled = TimeUtils.parseInstant(video.getScheduledTime());
        Instant reference;
        if (scheduled.isPresent()) {
            if (!scheduled.get().isBefore(now)) {
                log.debug("Keeping future-scheduled video {} (publishes {})", video.getId(), scheduled.get());
                return false;
            }
            reference = scheduled.get();
        } else if (properties.getLifecycle().isUploadedAtFallback() && video.getUploadedAt() != null) {
            log.warn("Unparseable scheduled_time '{}' on {}, using upload time", video.getScheduledTime(), video.getId());
            reference = video.getUploadedAt();
        } else {
            log.warn("Unparseable scheduled_time '{}' on {}, keeping file", video.getScheduledTime(), video.getId());
            return false;
        }
        if (Duration.between(reference, now).compareTo(minAge) < 0) {
            log.debug("Keeping recent video {} (reference {})", video.getId(), reference);
            return false;
        }
        return true;
    }

    private boolean deleteFiles(VideoRecord video, Instant now) {
        Path file = Paths.get(video.getFilePath());
        boolean removed;
        try {
            removed = Files.deleteIfExists(file);
        } catch (IOException | SecurityException e) {
            log.error("Failed to delete {} for {}", file, video.getId(), e);
            return false;
        }
        if (removed) {
            log.info("Deleted video: {}", FilePaths.fileName(video.getFilePath()));
        } else {
            log.warn("Video file already missing: {}", file);
        }

        if (!isBlank(video.getThumbnailPath())) {
            Path thumbnail = Paths.get(video.getThumbnailPath());
            try {
                if (Files.deleteIfExists(thumbnail)) {
                    log.info("Deleted thumbnail: {}", FilePaths.fileName(video.getThumbnailPath()));
                }
            } catch (IOException | SecurityException e) {
                log.warn("Failed to delete thumbnail {} for {}", thumbnail, video.getId(), e);
            }
        }

        transition(video, VideoStatus.DELETED);
        video.setDeletedAt(now);
        return removed;
    }

    private void transition(VideoRecord video, VideoStatus target) {
        if (!video.getStatus().canTransitionTo(target)) {
            throw new IllegalStatusTransitionException(video.getId(), video.getStatus(), target);
        }
        video.setStatus(target);
    }

    private LifecycleDocument loadRegistry() {
        return stateStore.load(REGISTRY_KEY, LifecycleDocument.class, LifecycleDocument::new);
    }

    private static Optional<VideoRecord> findById(LifecycleDocument db, String videoId) {
        return db.getVideos().stream().filter(video -> videoId.equals(video.getId())).findFirst();
    }

    // the newest live record wins when a path has been registered more than once
    private static Optional<VideoRecord> findByPath(LifecycleDocument db, String path) {
        List<VideoRecord> videos = db.getVideos();
        for (int i = videos.size() - 1; i >= 0; i--) {
            VideoRecord video = videos.get(i);
            if (path.equals(video.getFilePath()) && video.getStatus() != VideoStatus.DELETED) {
                return Optional.of(video);
            }
        }
        return Optional.empty();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
