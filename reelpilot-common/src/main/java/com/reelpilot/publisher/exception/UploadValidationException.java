package com.reelpilot.publisher.exception;

import java.util.List;

/**
 * Raised before an upload is attempted when the video, its thumbnail or its metadata
 * would be rejected by the platform.
 */
public class UploadValidationException extends RuntimeException {

    private final List<String> issues;

    public UploadValidationException(List<String> issues) {
        super("Upload validation failed: " + String.join(", ", issues));
        this.issues = List.copyOf(issues);
    }

    public List<String> getIssues() {
        return issues;
    }
}
