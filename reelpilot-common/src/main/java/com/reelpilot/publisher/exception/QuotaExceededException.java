package com.reelpilot.publisher.exception;

import java.time.Instant;

/**
 * The platform quota for the current period cannot cover the operation.
 * Callers defer the work until {@link #getResetAt()}; it is never a failed attempt.
 */
public class QuotaExceededException extends RuntimeException {

    private final Instant resetAt;

    public QuotaExceededException(String message, Instant resetAt) {
        super(message);
        this.resetAt = resetAt;
    }

    public QuotaExceededException(String message) {
        super(message);
        this.resetAt = null;
    }

    public QuotaExceededException(String message, Throwable cause) {
        super(message, cause);
        this.resetAt = null;
    }

    public Instant getResetAt() {
        return resetAt;
    }
}
