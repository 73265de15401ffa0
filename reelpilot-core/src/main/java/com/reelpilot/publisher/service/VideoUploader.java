package com.reelpilot.publisher.service;

import com.reelpilot.publisher.model.SeoMetadata;

import java.time.Instant;

/**
 * Publishes a local video file to the hosting platform.
 */
public interface VideoUploader {

    /**
     * Uploads the file and schedules it for {@code publishAt}.
     *
     * @return the platform's id for the new video
     * @throws com.reelpilot.publisher.exception.QuotaExceededException when the platform refuses on quota
     * @throws com.reelpilot.publisher.exception.UploadFailedException on any other failure
     */
    String upload(String filePath, SeoMetadata seo, Instant publishAt, String thumbnailPath);
}
