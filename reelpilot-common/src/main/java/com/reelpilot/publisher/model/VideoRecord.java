package com.reelpilot.publisher.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One rendered artifact tracked from render time until its file is removed.
 * {@code scheduledTime} is kept as the raw ISO-8601 string so that a bad value
 * never makes the whole registry document unreadable.
 */
@Data
@NoArgsConstructor
public class VideoRecord {
    private String id;
    private String filePath;
    private String thumbnailPath;
    private String videoType;
    private String topic;
    private String scheduledTime;
    private Instant createdAt;
    private VideoStatus status = VideoStatus.CREATED;
    private String externalVideoId;
    private int uploadAttempts;
    private Instant lastAttempt;
    private String lastError;
    private Instant uploadedAt;
    private Instant deletedAt;
    private Map<String, Object> metadata = new LinkedHashMap<>();
}
