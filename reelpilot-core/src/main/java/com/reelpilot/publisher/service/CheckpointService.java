package com.reelpilot.publisher.service;

import com.reelpilot.publisher.model.CheckpointRecord;
import com.reelpilot.publisher.store.PersistentStateStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Keeps the last completed pipeline step so a crashed run can pick up where it stopped.
 * Only one checkpoint exists at a time and it is only resumable for 24 hours.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CheckpointService {

    static final String CHECKPOINT_KEY = "pipeline_checkpoint";
    static final Duration MAX_AGE = Duration.ofHours(24);

    private final PersistentStateStore stateStore;
    private final Clock clock;

    public boolean save(String step, Map<String, Object> data) {
        CheckpointRecord checkpoint = new CheckpointRecord(step, clock.instant(),
                data != null ? new LinkedHashMap<>(data) : new LinkedHashMap<>());
        boolean saved = stateStore.save(CHECKPOINT_KEY, checkpoint);
        if (saved) {
            log.info("Saved checkpoint: {}", step);
        } else {
            log.error("Failed to save checkpoint: {}", step);
        }
        return saved;
    }

    public Optional<CheckpointRecord> load() {
        CheckpointRecord checkpoint = stateStore.load(CHECKPOINT_KEY, CheckpointRecord.class, () -> null);
        if (checkpoint != null) {
            log.info("Loaded checkpoint: {}", checkpoint.getStep());
        }
        return Optional.ofNullable(checkpoint);
    }

    public boolean shouldResume() {
        Optional<CheckpointRecord> checkpoint = load();
        if (checkpoint.isEmpty()) {
            return false;
        }
        Instant savedAt = checkpoint.get().getTimestamp();
        if (savedAt == null) {
            log.warn("Checkpoint {} has no timestamp, not resuming", checkpoint.get().getStep());
            return false;
        }
        Duration age = Duration.between(savedAt, clock.instant());
        if (age.compareTo(MAX_AGE) >= 0) {
            log.warn("Checkpoint {} is too old ({}h), clearing", checkpoint.get().getStep(), age.toHours());
            clear();
            return false;
        }
        log.info("Found recent checkpoint {} ({} min old), can resume", checkpoint.get().getStep(), age.toMinutes());
        return true;
    }

    public boolean clear() {
        boolean removed = stateStore.delete(CHECKPOINT_KEY);
        if (removed) {
            log.info("Cleared checkpoint");
        }
        return removed || !stateStore.exists(CHECKPOINT_KEY);
    }
}
