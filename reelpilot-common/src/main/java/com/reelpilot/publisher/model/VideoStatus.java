package com.reelpilot.publisher.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Status of a rendered video artifact. The legal transitions are
 * {@code created -> uploading -> uploaded -> deleted} with the retry branch
 * {@code uploading -> upload_failed -> uploading}.
 */
public enum VideoStatus {
    CREATED,
    UPLOADING,
    UPLOADED,
    UPLOAD_FAILED,
    DELETED;

    public Set<VideoStatus> allowedTargets() {
        switch (this) {
            case CREATED:
                return EnumSet.of(UPLOADING);
            case UPLOADING:
                return EnumSet.of(UPLOADED, UPLOAD_FAILED);
            case UPLOAD_FAILED:
                return EnumSet.of(UPLOADING);
            case UPLOADED:
                return EnumSet.of(DELETED);
            default:
                return EnumSet.noneOf(VideoStatus.class);
        }
    }

    public boolean canTransitionTo(VideoStatus target) {
        return allowedTargets().contains(target);
    }

    public boolean isAwaitingUpload() {
        return this == CREATED || this == UPLOAD_FAILED;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static VideoStatus fromWireName(String value) {
        return VideoStatus.valueOf(value.toUpperCase(Locale.ROOT));
    }
}
