package com.reelpilot.publisher.service;

import com.reelpilot.publisher.model.PendingUploadItem;
import com.reelpilot.publisher.model.SeoMetadata;
import com.reelpilot.publisher.model.UploadQueueDocument;
import com.reelpilot.publisher.model.UploadedItem;
import com.reelpilot.publisher.store.PersistentStateStore;
import com.reelpilot.publisher.util.FilePaths;
import com.reelpilot.publisher.util.VideoTypes;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable queue of files waiting to be published. Items leave the pending list only through
 * {@link #dequeueOnSuccess(String, String)}; failed items stay pending with their attempt count,
 * the cap on attempts is enforced by the worker.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UploadQueueService {

    static final String QUEUE_KEY = "upload_status";
    public static final String METADATA_LINKED_LONG_VIDEO = "linked_long_video";
    public static final String LINK_PENDING = "pending";
    public static final int DEFAULT_BUFFER_HOURS = 1;

    private final PersistentStateStore stateStore;
    private final Clock clock;

    /**
     * @return false when the file is already waiting in the queue
     */
    public boolean enqueue(String filePath, String videoType, String topic, String scheduledTime,
                           SeoMetadata seo, String thumbnailPath, Map<String, Object> metadata) {
        String path = FilePaths.normalize(filePath);
        Instant now = clock.instant();
        boolean added = stateStore.update(QUEUE_KEY, UploadQueueDocument.class, UploadQueueDocument::new, queue -> {
            if (findPending(queue, path).isPresent()) {
                return false;
            }
            PendingUploadItem item = new PendingUploadItem();
            item.setFilePath(path);
            item.setType(videoType);
            item.setTopic(topic);
            item.setScheduledTime(scheduledTime);
            item.setCreatedAt(now);
            item.setAttempts(0);
            item.setSeo(seo);
            item.setThumbnailPath(thumbnailPath);
            item.setMetadata(metadata != null ? new LinkedHashMap<>(metadata) : new LinkedHashMap<>());
            queue.getPendingUploads().add(item);
            return true;
        });
        if (added) {
            log.info("Tracked pending upload: {} (publishes {})", FilePaths.fileName(path), scheduledTime);
        } else {
            log.warn("Already pending, not enqueued again: {}", path);
        }
        return added;
    }

    /**
     * Moves the item from pending to uploaded. Calling it again for the same file changes nothing.
     */
    public boolean dequeueOnSuccess(String filePath, String externalVideoId) {
        String path = FilePaths.normalize(filePath);
        Instant now = clock.instant();
        boolean changed = stateStore.update(QUEUE_KEY, UploadQueueDocument.class, UploadQueueDocument::new, queue -> {
            PendingUploadItem removed = null;
            Iterator<PendingUploadItem> it = queue.getPendingUploads().iterator();
            while (it.hasNext()) {
                PendingUploadItem item = it.next();
                if (path.equals(item.getFilePath())) {
                    removed = item;
                    it.remove();
                }
            }
            boolean alreadyUploaded = queue.getUploaded().stream().anyMatch(u -> path.equals(u.getFilePath()));
            if (!alreadyUploaded) {
                queue.getUploaded().add(new UploadedItem(path,
                        removed != null ? removed.getType() : null,
                        removed != null ? removed.getTopic() : null,
                        externalVideoId, now, true));
            }
            return removed != null || !alreadyUploaded;
        });
        if (changed) {
            log.info("Marked uploaded: {} -> {}", FilePaths.fileName(path), externalVideoId);
        }
        return changed;
    }

    public List<PendingUploadItem> listPending() {
        return loadQueue().getPendingUploads();
    }

    public List<UploadedItem> listUploaded() {
        return loadQueue().getUploaded();
    }

    public boolean isPending(String filePath) {
        return findPending(loadQueue(), FilePaths.normalize(filePath)).isPresent();
    }

    public Optional<PendingUploadItem> recordFailure(String filePath, String error) {
        String path = FilePaths.normalize(filePath);
        Instant now = clock.instant();
        Optional<PendingUploadItem> updated = stateStore.update(QUEUE_KEY, UploadQueueDocument.class, UploadQueueDocument::new,
                queue -> findPending(queue, path).map(item -> {
                    item.setAttempts(item.getAttempts() + 1);
                    item.setLastError(error);
                    item.setLastAttempt(now);
                    return item;
                }));
        if (updated.isEmpty()) {
            log.warn("Failure reported for a file that is not pending: {}", path);
        }
        return updated;
    }

    /**
     * Holds the item back until {@code until}, when the worker picks it up again regardless of its
     * original upload window. Consumes no attempt.
     */
    public boolean deferUntil(String filePath, Instant until) {
        String path = FilePaths.normalize(filePath);
        boolean updated = stateStore.update(QUEUE_KEY, UploadQueueDocument.class, UploadQueueDocument::new,
                queue -> findPending(queue, path).map(item -> {
                    item.setDeferredUntil(until);
                    return true;
                }).orElse(false));
        if (updated) {
            log.info("Deferred {} until {}", FilePaths.fileName(path), until);
        }
        return updated;
    }

    /**
     * Fills in the long video id on pending shorts of the same topic that are still waiting for it.
     *
     * @return number of shorts updated
     */
    public int linkShortsToLongVideo(String topic, String longVideoId) {
        if (topic == null || longVideoId == null) {
            return 0;
        }
        int updated = stateStore.update(QUEUE_KEY, UploadQueueDocument.class, UploadQueueDocument::new, queue -> {
            int count = 0;
            for (PendingUploadItem item : queue.getPendingUploads()) {
                if (VideoTypes.isShort(item.getType()) && topic.equals(item.getTopic())
                        && LINK_PENDING.equals(item.getMetadata().get(METADATA_LINKED_LONG_VIDEO))) {
                    item.getMetadata().put(METADATA_LINKED_LONG_VIDEO, longVideoId);
                    count++;
                }
            }
            return count;
        });
        if (updated > 0) {
            log.info("Linked {} short(s) to long video {}", updated, longVideoId);
        }
        return updated;
    }

    /**
     * Latest instant the upload may start so the platform has {@code bufferHours} to process
     * the video before it goes live.
     */
    public static Instant computeUploadWindow(Instant scheduledTime, int bufferHours) {
        return scheduledTime.minus(Duration.ofHours(bufferHours));
    }

    public static Instant computeUploadWindow(Instant scheduledTime) {
        return computeUploadWindow(scheduledTime, DEFAULT_BUFFER_HOURS);
    }

    private UploadQueueDocument loadQueue() {
        return stateStore.load(QUEUE_KEY, UploadQueueDocument.class, UploadQueueDocument::new);
    }

    private static Optional<PendingUploadItem> findPending(UploadQueueDocument queue, String path) {
        return queue.getPendingUploads().stream().filter(item -> path.equals(item.getFilePath())).findFirst();
    }
}
