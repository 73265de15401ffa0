package com.reelpilot.publisher.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.reelpilot.publisher.model.LifecycleDocument;
import com.reelpilot.publisher.model.VideoRecord;
import com.reelpilot.publisher.model.VideoStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class PersistentStateStoreTest {

    private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");

    @TempDir
    Path stateDir;

    private PersistentStateStore store;

    @BeforeEach
    void setUp() {
        store = new PersistentStateStore(stateDir, new ObjectMapper(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void missingDocumentReturnsDefault() {
        LifecycleDocument doc = store.load("video_lifecycle", LifecycleDocument.class, LifecycleDocument::new);

        assertNotNull(doc);
        assertTrue(doc.getVideos().isEmpty());
        assertFalse(store.exists("video_lifecycle"));
    }

    @Test
    void savedDocumentIsReadBackWithSnakeCaseFields() throws IOException {
        LifecycleDocument doc = new LifecycleDocument();
        VideoRecord video = new VideoRecord();
        video.setId("long_20260310_120000");
        video.setFilePath("/videos/a.mp4");
        video.setStatus(VideoStatus.UPLOAD_FAILED);
        video.setScheduledTime("2026-03-11T14:00:00Z");
        video.setCreatedAt(NOW);
        doc.getVideos().add(video);

        assertTrue(store.save("video_lifecycle", doc));

        String json = Files.readString(store.pathFor("video_lifecycle"), StandardCharsets.UTF_8);
        assertThat(json).contains("\"file_path\"", "\"upload_failed\"", "\"2026-03-10T12:00:00Z\"");

        LifecycleDocument loaded = store.load("video_lifecycle", LifecycleDocument.class, LifecycleDocument::new);
        assertEquals(1, loaded.getVideos().size());
        assertEquals(VideoStatus.UPLOAD_FAILED, loaded.getVideos().get(0).getStatus());
        assertEquals(NOW, loaded.getVideos().get(0).getCreatedAt());
    }

    @Test
    void corruptedDocumentIsBackedUpAndDefaultReturned() throws IOException {
        Path file = store.pathFor("upload_status");
        Files.writeString(file, "{ \"pending_uploads\": [ {", StandardCharsets.UTF_8);
        Files.setLastModifiedTime(file, FileTime.from(NOW));

        LifecycleDocument doc = store.load("upload_status", LifecycleDocument.class, LifecycleDocument::new);

        assertTrue(doc.getVideos().isEmpty());
        Path backup = stateDir.resolve("upload_status.json.corrupted." + NOW.toEpochMilli());
        assertTrue(Files.exists(backup));
        assertEquals("{ \"pending_uploads\": [ {", Files.readString(backup, StandardCharsets.UTF_8));
    }

    @Test
    void corruptedDocumentIsBackedUpOnlyOnceAcrossRepeatedLoads() throws IOException {
        Path file = store.pathFor("upload_status");
        Files.writeString(file, "not json", StandardCharsets.UTF_8);

        for (int i = 0; i < 5; i++) {
            PersistentStateStore later = new PersistentStateStore(stateDir, new ObjectMapper(),
                    Clock.fixed(NOW.plusSeconds(60L * i), ZoneOffset.UTC));
            later.load("upload_status", LifecycleDocument.class, LifecycleDocument::new);
        }

        try (Stream<Path> files = Files.list(stateDir)) {
            assertThat(files.filter(p -> p.getFileName().toString().startsWith("upload_status.json.corrupted.")))
                    .hasSize(1);
        }
    }

    @Test
    void updateLeavesNoTempFilesBehind() throws IOException {
        store.update("video_lifecycle", LifecycleDocument.class, LifecycleDocument::new, doc -> {
            doc.setLastCleanup(NOW);
            return null;
        });

        try (Stream<Path> files = Files.list(stateDir)) {
            List<String> names = files.map(p -> p.getFileName().toString()).collect(Collectors.toList());
            assertThat(names).contains("video_lifecycle.json");
            assertThat(names).noneMatch(name -> name.endsWith(".tmp"));
        }
        assertEquals(NOW, store.load("video_lifecycle", LifecycleDocument.class, LifecycleDocument::new).getLastCleanup());
    }

    @Test
    void concurrentUpdatesAreSerialized() throws Exception {
        int writers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < writers; i++) {
                int n = i;
                futures.add(pool.submit(() -> store.update("video_lifecycle", LifecycleDocument.class, LifecycleDocument::new, doc -> {
                    VideoRecord video = new VideoRecord();
                    video.setId("video_" + n);
                    doc.getVideos().add(video);
                    return null;
                })));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            pool.shutdownNow();
        }

        LifecycleDocument doc = store.load("video_lifecycle", LifecycleDocument.class, LifecycleDocument::new);
        assertEquals(writers, doc.getVideos().size());
    }

    @Test
    void deleteRemovesDocument() {
        store.save("pipeline_checkpoint", new LifecycleDocument());

        assertTrue(store.delete("pipeline_checkpoint"));
        assertFalse(store.exists("pipeline_checkpoint"));
        assertFalse(store.delete("pipeline_checkpoint"));
    }
}
