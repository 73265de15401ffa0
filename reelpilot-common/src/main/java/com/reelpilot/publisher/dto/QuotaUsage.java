package com.reelpilot.publisher.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class QuotaUsage {
    private long used;
    private long remaining;
    private long limit;
    private Instant resetAt;
    private double percentage;
}
