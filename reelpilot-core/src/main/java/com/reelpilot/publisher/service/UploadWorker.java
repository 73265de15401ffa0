package com.reelpilot.publisher.service;

import com.reelpilot.publisher.config.PublisherProperties;
import com.reelpilot.publisher.dto.UploadCycleSummary;
import com.reelpilot.publisher.exception.QuotaExceededException;
import com.reelpilot.publisher.exception.UploadValidationException;
import com.reelpilot.publisher.model.PendingUploadItem;
import com.reelpilot.publisher.model.QuotaOperation;
import com.reelpilot.publisher.model.SeoMetadata;
import com.reelpilot.publisher.model.VideoRecord;
import com.reelpilot.publisher.model.VideoStatus;
import com.reelpilot.publisher.store.FileLocks;
import com.reelpilot.publisher.util.FilePaths;
import com.reelpilot.publisher.util.TimeUtils;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jobrunr.jobs.annotations.Job;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drains the upload queue: every item whose upload window has opened is published,
 * one at a time, and the queue, the lifecycle registry and the quota ledger are updated.
 * <p>
 * An item held back by quota waits until the quota period resets and is then uploaded even if
 * its window has closed. An item whose window closed for any other reason stays queued and is
 * reported as missed on every cycle.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UploadWorker {

    enum Outcome { UPLOADED, FAILED, DEFERRED, MISSED, SKIPPED }

    private final UploadQueueService uploadQueue;
    private final VideoLifecycleService lifecycle;
    private final QuotaLedgerService quotaLedger;
    private final VideoUploader uploader;
    private final UploadLockService uploadLocks;
    private final UploadValidator validator;
    private final List<PostUploadHook> hooks;
    private final PublisherProperties properties;
    private final Clock clock;

    private final AtomicBoolean stopRequested = new AtomicBoolean(false);

    @Job(name = "Upload poll", retries = 0)
    public void runScheduledCycle() {
        pollOnce();
    }

    public UploadCycleSummary pollOnce() {
        List<PendingUploadItem> pending = uploadQueue.listPending();
        if (pending.isEmpty()) {
            log.debug("No pending uploads");
            return UploadCycleSummary.empty();
        }

        int uploaded = 0;
        int failed = 0;
        int deferred = 0;
        int missed = 0;
        for (PendingUploadItem item : pending) {
            if (stopRequested.get()) {
                log.info("Stop requested, ending upload cycle early");
                break;
            }
            Outcome outcome;
            try {
                outcome = process(item);
            } catch (RuntimeException e) {
                log.error("Unexpected error while processing {}", FilePaths.fileName(item.getFilePath()), e);
                outcome = Outcome.FAILED;
            }
            switch (outcome) {
                case UPLOADED:
                    uploaded++;
                    break;
                case FAILED:
                    failed++;
                    break;
                case DEFERRED:
                    deferred++;
                    break;
                case MISSED:
                    missed++;
                    break;
                default:
                    break;
            }
        }

        UploadCycleSummary summary = new UploadCycleSummary(uploaded, failed, deferred, missed,
                uploadQueue.listPending().size());
        if (uploaded > 0 || failed > 0 || deferred > 0 || missed > 0) {
            log.info("Upload cycle: {} uploaded, {} failed, {} deferred, {} missed, {} pending",
                    summary.getUploaded(), summary.getFailed(), summary.getDeferred(), summary.getMissed(),
                    summary.getPending());
        }
        return summary;
    }

    /**
     * Makes the running cycle stop before its next item. Items already started finish normally.
     */
    @PreDestroy
    public void requestStop() {
        stopRequested.set(true);
    }

    public boolean isStopRequested() {
        return stopRequested.get();
    }

    Outcome process(PendingUploadItem item) {
        String path = item.getFilePath();
        String name = FilePaths.fileName(path);
        int maxAttempts = properties.getUpload().getMaxAttempts();

        if (item.getAttempts() >= maxAttempts) {
            log.warn("Skipping {}: {} attempts used, needs manual attention (last error: {})",
                    name, item.getAttempts(), item.getLastError());
            return Outcome.FAILED;
        }
        if (!Files.exists(Paths.get(path))) {
            log.error("Video file missing, cannot upload: {}", path);
            return Outcome.FAILED;
        }
        if (resolveDuplicate(path)) {
            return Outcome.UPLOADED;
        }

        Optional<Instant> scheduled = TimeUtils.parseInstant(item.getScheduledTime());
        if (scheduled.isEmpty()) {
            log.warn("Unparseable scheduled time '{}' for {}, not uploading", item.getScheduledTime(), name);
            return Outcome.SKIPPED;
        }
        if (item.getDeferredUntil() != null) {
            if (clock.instant().isBefore(item.getDeferredUntil())) {
                return Outcome.SKIPPED;
            }
        } else if (isMissed(scheduled.get())) {
            log.warn("Upload window for {} closed at {}, not uploading, needs manual attention", name,
                    windowClose(scheduled.get()));
            return Outcome.MISSED;
        } else if (!isDue(scheduled.get())) {
            return Outcome.SKIPPED;
        }

        SeoMetadata seo;
        try {
            seo = validator.validate(path, item.getThumbnailPath(), item.getSeo());
        } catch (UploadValidationException e) {
            int attempts = uploadQueue.recordFailure(path, e.getMessage())
                    .map(PendingUploadItem::getAttempts)
                    .orElse(item.getAttempts() + 1);
            log.error("Not uploading {} (attempt {}/{}): {}", name, attempts, maxAttempts, e.getMessage());
            return Outcome.FAILED;
        }

        try {
            quotaLedger.checkAvailable(QuotaOperation.UPLOAD.key(), properties.getQuota().getDailyLimit());
        } catch (QuotaExceededException e) {
            log.warn("Deferring {}: {}", name, e.getMessage());
            defer(path, e);
            return Outcome.DEFERRED;
        }

        Optional<FileLocks.Handle> lock = uploadLocks.tryLock(path);
        if (lock.isEmpty()) {
            log.info("{} is being uploaded by another process, skipping", name);
            return Outcome.SKIPPED;
        }
        try (FileLocks.Handle ignored = lock.get()) {
            return uploadLocked(item, scheduled.get(), seo);
        }
    }

    private Outcome uploadLocked(PendingUploadItem item, Instant publishAt, SeoMetadata seo) {
        String path = item.getFilePath();
        String name = FilePaths.fileName(path);

        // state may have moved while we waited for the lock
        if (!uploadQueue.isPending(path)) {
            log.info("{} left the queue before its upload started", name);
            return Outcome.SKIPPED;
        }
        if (resolveDuplicate(path)) {
            return Outcome.UPLOADED;
        }

        Optional<VideoRecord> tracked = lifecycle.findByFilePath(path);
        tracked.ifPresent(this::startAttempt);

        String videoId;
        try {
            videoId = uploader.upload(path, seo, publishAt, item.getThumbnailPath());
        } catch (QuotaExceededException e) {
            log.warn("Platform refused {} on quota, deferring: {}", name, e.getMessage());
            tracked.ifPresent(video -> lifecycle.markUploadFailed(video.getId(), e.getMessage()));
            defer(path, e);
            return Outcome.DEFERRED;
        } catch (RuntimeException e) {
            String error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            int attempts = uploadQueue.recordFailure(path, error)
                    .map(PendingUploadItem::getAttempts)
                    .orElse(item.getAttempts() + 1);
            tracked.ifPresent(video -> lifecycle.markUploadFailed(video.getId(), error));
            log.error("Upload failed for {} (attempt {}/{})", name, attempts,
                    properties.getUpload().getMaxAttempts(), e);
            return Outcome.FAILED;
        }

        completeUpload(item, tracked.isPresent(), videoId);
        return Outcome.UPLOADED;
    }

    /**
     * Records a finished upload. Each step runs even if an earlier one fails, so a single
     * state write error cannot make the next cycle publish the file again.
     */
    private void completeUpload(PendingUploadItem item, boolean tracked, String videoId) {
        String path = item.getFilePath();
        String name = FilePaths.fileName(path);
        log.info("Uploaded {} -> {}", name, videoId);

        try {
            uploadQueue.dequeueOnSuccess(path, videoId);
        } catch (RuntimeException e) {
            log.error("Uploaded {} as {} but could not update the queue", name, videoId, e);
        }
        if (tracked) {
            try {
                lifecycle.markUploadSuccess(path, videoId);
            } catch (RuntimeException e) {
                log.error("Uploaded {} as {} but could not update the registry", name, videoId, e);
            }
        }
        try {
            quotaLedger.record(QuotaOperation.UPLOAD, name);
        } catch (RuntimeException e) {
            log.error("Could not record quota for upload of {}", name, e);
        }

        for (PostUploadHook hook : hooks) {
            try {
                hook.afterUpload(item, videoId);
            } catch (Exception e) {
                log.warn("{} failed for {}: {}", hook.getClass().getSimpleName(), name, e.getMessage());
            }
        }
    }

    /**
     * @return true when the registry shows the file already published, in which case the queue
     * entry is retired with the known id
     */
    private boolean resolveDuplicate(String path) {
        Optional<VideoRecord> tracked = lifecycle.findByFilePath(path);
        if (tracked.isEmpty() || tracked.get().getStatus() != VideoStatus.UPLOADED
                || tracked.get().getExternalVideoId() == null) {
            return false;
        }
        String videoId = tracked.get().getExternalVideoId();
        log.warn("{} already uploaded as {}, removing it from the queue", FilePaths.fileName(path), videoId);
        uploadQueue.dequeueOnSuccess(path, videoId);
        return true;
    }

    private void defer(String path, QuotaExceededException e) {
        Instant resetAt = e.getResetAt() != null ? e.getResetAt() : quotaLedger.resetBoundary();
        uploadQueue.deferUntil(path, resetAt);
    }

    private void startAttempt(VideoRecord video) {
        if (video.getStatus() == VideoStatus.UPLOADING) {
            // left behind by an attempt that never finished
            lifecycle.markUploadFailed(video.getId(), "Previous upload attempt was interrupted");
        }
        lifecycle.markUploadStarted(video.getId());
    }

    /**
     * Due when now lies within {@code window-minutes} either side of the upload instant.
     */
    boolean isDue(Instant scheduledTime) {
        Instant uploadAt = UploadQueueService.computeUploadWindow(scheduledTime, properties.getUpload().getBufferHours());
        Duration window = Duration.ofMinutes(properties.getUpload().getWindowMinutes());
        Instant now = clock.instant();
        return !now.isBefore(uploadAt.minus(window)) && !now.isAfter(uploadAt.plus(window));
    }

    boolean isMissed(Instant scheduledTime) {
        return clock.instant().isAfter(windowClose(scheduledTime));
    }

    private Instant windowClose(Instant scheduledTime) {
        return UploadQueueService.computeUploadWindow(scheduledTime, properties.getUpload().getBufferHours())
                .plus(Duration.ofMinutes(properties.getUpload().getWindowMinutes()));
    }
}
