package com.reelpilot.publisher.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of one upload poll. {@code deferred} counts items held back by quota,
 * {@code missed} counts items whose upload window closed before they were uploaded,
 * {@code pending} is the queue length once the poll finished.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UploadCycleSummary {
    private int uploaded;
    private int failed;
    private int deferred;
    private int missed;
    private int pending;

    public static UploadCycleSummary empty() {
        return new UploadCycleSummary(0, 0, 0, 0, 0);
    }
}
