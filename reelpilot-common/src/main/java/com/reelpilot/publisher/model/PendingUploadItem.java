package com.reelpilot.publisher.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
@NoArgsConstructor
public class PendingUploadItem {
    private String filePath;
    private String type;
    private String topic;
    private String scheduledTime;
    private Instant createdAt;
    private int attempts;
    private String lastError;
    private Instant lastAttempt;
    // set when quota ran out, the item is due again from this instant
    private Instant deferredUntil;
    private String thumbnailPath;
    private SeoMetadata seo;
    private Map<String, Object> metadata = new LinkedHashMap<>();
}
