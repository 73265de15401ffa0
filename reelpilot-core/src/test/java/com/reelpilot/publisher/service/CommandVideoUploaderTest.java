package com.reelpilot.publisher.service;

import com.reelpilot.publisher.config.PublisherProperties;
import com.reelpilot.publisher.exception.QuotaExceededException;
import com.reelpilot.publisher.exception.UploadFailedException;
import com.reelpilot.publisher.model.SeoMetadata;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

class CommandVideoUploaderTest {

    private static final Instant PUBLISH_AT = Instant.parse("2026-03-13T14:30:00Z");

    private PublisherProperties properties;
    private CommandVideoUploader uploader;
    private SeoMetadata seo;

    @BeforeEach
    void setUp() {
        properties = new PublisherProperties();
        properties.getUploader().setCommand(List.of("upload-video", "--file", "{file}", "--title", "{title}",
                "--tags", "{tags}", "--publish-at", "{publishAt}", "--thumbnail={thumbnail}"));

        // Use spy to override executeCommand
        uploader = spy(new CommandVideoUploader(properties));

        seo = new SeoMetadata();
        seo.setTitle("Why the tides turn");
        seo.setDescription("Moon, sun and a lot of water");
        seo.setTags(List.of("ocean", "science"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void lastOutputLineIsTheVideoId() throws Exception {
        doReturn(new CommandVideoUploader.CommandResult(0, List.of("Uploading 100%", "  yt_9xQ2  ", "")))
                .when(uploader).executeCommand(anyList());

        String videoId = uploader.upload("/videos/long.mp4", seo, PUBLISH_AT, null);

        assertEquals("yt_9xQ2", videoId);
        ArgumentCaptor<List<String>> captor = ArgumentCaptor.forClass(List.class);
        verify(uploader).executeCommand(captor.capture());
        assertEquals(List.of("upload-video", "--file", "/videos/long.mp4", "--title", "Why the tides turn",
                "--tags", "ocean,science", "--publish-at", "2026-03-13T14:30:00Z", "--thumbnail="), captor.getValue());
    }

    @Test
    void quotaExitCodeBecomesQuotaExceeded() throws Exception {
        doReturn(new CommandVideoUploader.CommandResult(75, List.of("quotaExceeded")))
                .when(uploader).executeCommand(anyList());

        assertThrows(QuotaExceededException.class, () -> uploader.upload("/videos/long.mp4", seo, PUBLISH_AT, null));
    }

    @Test
    void otherNonZeroExitIsAnUploadFailure() throws Exception {
        doReturn(new CommandVideoUploader.CommandResult(1, List.of("HTTP 503 backendError")))
                .when(uploader).executeCommand(anyList());

        UploadFailedException e = assertThrows(UploadFailedException.class,
                () -> uploader.upload("/videos/long.mp4", seo, PUBLISH_AT, null));
        assertTrue(e.getMessage().contains("HTTP 503 backendError"));
    }

    @Test
    void silentSuccessIsAnUploadFailure() throws Exception {
        doReturn(new CommandVideoUploader.CommandResult(0, List.of()))
                .when(uploader).executeCommand(anyList());

        assertThrows(UploadFailedException.class, () -> uploader.upload("/videos/long.mp4", seo, PUBLISH_AT, null));
    }

    @Test
    void processStartErrorIsAnUploadFailure() throws Exception {
        doThrow(new IOException("No such file or directory")).when(uploader).executeCommand(anyList());

        assertThrows(UploadFailedException.class, () -> uploader.upload("/videos/long.mp4", seo, PUBLISH_AT, null));
    }

    @Test
    void timedOutCommandIsAnUploadFailure() throws Exception {
        doReturn(CommandVideoUploader.CommandResult.timedOut(List.of("Uploading 40%")))
                .when(uploader).executeCommand(anyList());

        UploadFailedException e = assertThrows(UploadFailedException.class,
                () -> uploader.upload("/videos/long.mp4", seo, PUBLISH_AT, null));
        assertTrue(e.getMessage().contains("timed out"));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void hungCommandIsKilledAfterTheTimeout() throws Exception {
        properties.getUploader().setTimeoutSeconds(1);
        CommandVideoUploader real = new CommandVideoUploader(properties);

        long started = System.nanoTime();
        CommandVideoUploader.CommandResult result = real.executeCommand(List.of("sleep", "30"));

        assertTrue(result.isTimedOut());
        assertTrue(Duration.ofNanos(System.nanoTime() - started).getSeconds() < 20);
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void finishedCommandOutputIsCollected() throws Exception {
        CommandVideoUploader real = new CommandVideoUploader(properties);

        CommandVideoUploader.CommandResult result = real.executeCommand(List.of("sh", "-c", "echo progress; echo yt_abc"));

        assertFalse(result.isTimedOut());
        assertEquals(0, result.getExitCode());
        assertEquals(List.of("progress", "yt_abc"), result.getOutput());
    }

    @Test
    void missingCommandIsRejected() throws Exception {
        properties.getUploader().setCommand(List.of());

        assertThrows(UploadFailedException.class, () -> uploader.upload("/videos/long.mp4", seo, PUBLISH_AT, null));
        verify(uploader, never()).executeCommand(anyList());
    }
}
