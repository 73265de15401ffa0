package com.reelpilot.publisher.model;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
public class LifecycleDocument {
    private List<VideoRecord> videos = new ArrayList<>();
    private Instant lastCleanup;
}
