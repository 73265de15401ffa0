package com.reelpilot.publisher.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.reelpilot.publisher.config.PublisherProperties;
import com.reelpilot.publisher.model.PendingUploadItem;
import com.reelpilot.publisher.util.FilePaths;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Keeps the script, SEO data and thumbnail of every published video under
 * {@code archive/<date>/<video type>/}, since the rendered file itself is deleted later.
 */
@Service
@Order(20)
@Slf4j
public class ContentArchiveService implements PostUploadHook {

    public static final String METADATA_SCRIPT = "script";

    private final PublisherProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ContentArchiveService(PublisherProperties properties, ObjectMapper objectMapper, Clock clock) {
        this.properties = properties;
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        this.clock = clock;
    }

    @Override
    public void afterUpload(PendingUploadItem item, String externalVideoId) throws IOException {
        Path dir = archive(item, externalVideoId);
        log.info("Archived {} ({}) to {}", item.getType(), externalVideoId, dir);
    }

    public Path archive(PendingUploadItem item, String externalVideoId) throws IOException {
        String videoType = item.getType() != null ? item.getType() : "unknown";
        Path dir = Paths.get(properties.getArchive().getDir(), LocalDate.now(clock).toString(), videoType);
        Files.createDirectories(dir);

        Object script = item.getMetadata() != null ? item.getMetadata().get(METADATA_SCRIPT) : null;
        if (script != null) {
            objectMapper.writeValue(dir.resolve("script.json").toFile(), script);
        }
        if (item.getSeo() != null) {
            objectMapper.writeValue(dir.resolve("seo.json").toFile(), item.getSeo());
        }
        copyThumbnail(item.getThumbnailPath(), dir);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("topic", item.getTopic());
        metadata.put("video_id", externalVideoId);
        metadata.put("video_type", videoType);
        metadata.put("file_name", FilePaths.fileName(item.getFilePath()));
        metadata.put("scheduled_time", item.getScheduledTime());
        metadata.put("archived_at", Instant.now(clock).toString());
        objectMapper.writeValue(dir.resolve("metadata.json").toFile(), metadata);
        return dir;
    }

    private void copyThumbnail(String thumbnailPath, Path dir) throws IOException {
        if (thumbnailPath == null) {
            return;
        }
        Path source = Paths.get(thumbnailPath);
        if (!Files.exists(source)) {
            log.debug("Thumbnail {} no longer exists, not archived", thumbnailPath);
            return;
        }
        Files.copy(source, dir.resolve("thumbnail" + FilePaths.extension(thumbnailPath)), StandardCopyOption.REPLACE_EXISTING,
                StandardCopyOption.COPY_ATTRIBUTES);
    }
}
