package com.reelpilot.publisher.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UploadedItem {
    private String filePath;
    private String type;
    private String topic;
    private String videoId;
    private Instant uploadedAt;
    private boolean safeToDelete;
}
