package com.reelpilot.publisher.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CheckpointRecord {
    private String step;
    private Instant timestamp;
    private Map<String, Object> data = new LinkedHashMap<>();
}
