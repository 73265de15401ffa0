package com.reelpilot.publisher.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ScheduledPublication {
    private String videoId;
    private Instant publishAt;
    // false when the file was already in the upload queue
    private boolean enqueued;
}
