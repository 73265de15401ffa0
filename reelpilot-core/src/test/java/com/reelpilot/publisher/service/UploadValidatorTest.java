package com.reelpilot.publisher.service;

import com.reelpilot.publisher.exception.UploadValidationException;
import com.reelpilot.publisher.model.SeoMetadata;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class UploadValidatorTest {

    @TempDir
    Path dir;

    private UploadValidator validator;
    private SeoMetadata seo;

    @BeforeEach
    void setUp() {
        validator = new UploadValidator();
        seo = new SeoMetadata("Why the tides turn twice a day", "Moon, sun and a lot of water",
                new ArrayList<>(List.of("ocean", "science", "tides")));
    }

    @Test
    void completeUploadPassesUnchanged() throws IOException {
        Path video = file("long.mp4", 4096);
        Path thumbnail = file("long.jpg", 2048);

        SeoMetadata result = validator.validate(video.toString(), thumbnail.toString(), seo);

        assertEquals(seo, result);
    }

    @Test
    void missingThumbnailIsOnlyAWarning() throws IOException {
        Path video = file("long.mp4", 4096);

        assertEquals(seo.getTitle(), validator.validate(video.toString(), null, seo).getTitle());
    }

    @Test
    void tinyVideoIsRejectedAsCorrupted() throws IOException {
        Path video = file("long.mp4", 200);

        UploadValidationException e = assertThrows(UploadValidationException.class,
                () -> validator.validate(video.toString(), null, seo));

        assertThat(e.getIssues()).containsExactly("Video too small: 200 bytes (likely corrupted)");
    }

    @Test
    void missingVideoIsRejected() {
        assertThrows(UploadValidationException.class,
                () -> validator.validate(dir.resolve("gone.mp4").toString(), null, seo));
    }

    @Test
    void thumbnailProblemsAreAllReported() throws IOException {
        Path video = file("long.mp4", 4096);
        Path thumbnail = file("long.gif", (int) UploadValidator.MAX_THUMBNAIL_BYTES + 1);

        UploadValidationException e = assertThrows(UploadValidationException.class,
                () -> validator.validate(video.toString(), thumbnail.toString(), seo));

        assertEquals(2, e.getIssues().size());
        assertThat(e.getIssues().get(0)).startsWith("Invalid thumbnail format: .gif");
        assertThat(e.getIssues().get(1)).startsWith("Thumbnail too large");
    }

    @Test
    void thumbnailPathThatDoesNotExistIsRejected() throws IOException {
        Path video = file("long.mp4", 4096);

        UploadValidationException e = assertThrows(UploadValidationException.class,
                () -> validator.validate(video.toString(), dir.resolve("missing.png").toString(), seo));

        assertThat(e.getIssues().get(0)).startsWith("Thumbnail not found");
    }

    @Test
    void emptyTitleIsRejected() throws IOException {
        Path video = file("long.mp4", 4096);
        seo.setTitle("   ");

        assertThrows(UploadValidationException.class, () -> validator.validate(video.toString(), null, seo));
        assertThrows(UploadValidationException.class, () -> validator.validate(video.toString(), null, null));
    }

    @Test
    void overLongMetadataIsShortenedToThePlatformLimits() {
        seo.setTitle("t".repeat(140));
        seo.setDescription("d".repeat(6000));
        seo.setTags(new ArrayList<>(Collections.nCopies(60, "tidalwave")));

        SeoMetadata fixed = validator.fixMetadata(seo);

        assertEquals(100, fixed.getTitle().length());
        assertTrue(fixed.getTitle().endsWith("..."));
        assertEquals(5000, fixed.getDescription().length());
        assertEquals(50, fixed.getTags().size());
        assertTrue(String.join(" ", fixed.getTags()).length() <= 500);
        assertEquals(140, seo.getTitle().length());
    }

    private Path file(String name, int bytes) throws IOException {
        return Files.write(dir.resolve(name), new byte[bytes]);
    }
}
