package com.reelpilot.publisher.dto;

import com.reelpilot.publisher.model.VideoStatus;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class StorageStats {
    private int totalVideos;
    private Map<VideoStatus, Integer> byStatus;
    private long totalBytes;
    private int pendingUpload;
    private Instant lastCleanup;
}
