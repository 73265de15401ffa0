package com.reelpilot.publisher.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.reelpilot.publisher.config.PublisherProperties;
import com.reelpilot.publisher.model.PendingUploadItem;
import com.reelpilot.publisher.model.SeoMetadata;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ContentArchiveServiceTest {

    @TempDir
    Path workDir;

    private ContentArchiveService archiver;
    private final ObjectMapper mapper = new ObjectMapper();

    @BeforeEach
    void setUp() {
        PublisherProperties properties = new PublisherProperties();
        properties.getArchive().setDir(workDir.resolve("archive").toString());
        archiver = new ContentArchiveService(properties, mapper,
                Clock.fixed(Instant.parse("2026-03-10T11:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void archivesScriptSeoThumbnailAndMetadata() throws Exception {
        Path thumbnail = Files.writeString(workDir.resolve("long_thumb.jpg"), "jpeg");
        SeoMetadata seo = new SeoMetadata();
        seo.setTitle("Why the tides turn");
        seo.setTags(List.of("ocean"));

        PendingUploadItem item = new PendingUploadItem();
        item.setFilePath(workDir.resolve("long.mp4").toString());
        item.setType("long");
        item.setTopic("tides");
        item.setScheduledTime("2026-03-10T14:30:00Z");
        item.setSeo(seo);
        item.setThumbnailPath(thumbnail.toString());
        item.getMetadata().put(ContentArchiveService.METADATA_SCRIPT, Map.of("hook", "The moon pulls harder than you think"));

        Path dir = archiver.archive(item, "yt_abc");

        assertEquals(workDir.resolve("archive/2026-03-10/long"), dir);
        assertTrue(Files.exists(dir.resolve("thumbnail.jpg")));
        assertEquals("Why the tides turn", mapper.readTree(dir.resolve("seo.json").toFile()).get("title").asText());
        assertEquals("The moon pulls harder than you think",
                mapper.readTree(dir.resolve("script.json").toFile()).get("hook").asText());

        JsonNode metadata = mapper.readTree(dir.resolve("metadata.json").toFile());
        assertEquals("yt_abc", metadata.get("video_id").asText());
        assertEquals("tides", metadata.get("topic").asText());
        assertEquals("long.mp4", metadata.get("file_name").asText());
    }

    @Test
    void itemWithoutExtrasStillGetsMetadata() throws Exception {
        PendingUploadItem item = new PendingUploadItem();
        item.setFilePath(workDir.resolve("short_1.mp4").toString());
        item.setType("short_1");
        item.setThumbnailPath(workDir.resolve("gone.jpg").toString());

        archiver.afterUpload(item, "yt_s1");

        Path dir = workDir.resolve("archive/2026-03-10/short_1");
        assertTrue(Files.exists(dir.resolve("metadata.json")));
        assertFalse(Files.exists(dir.resolve("seo.json")));
        assertFalse(Files.exists(dir.resolve("script.json")));
    }
}
