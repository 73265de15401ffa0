package com.reelpilot.publisher.service;

import com.reelpilot.publisher.exception.UploadValidationException;
import com.reelpilot.publisher.model.SeoMetadata;
import com.reelpilot.publisher.util.FilePaths;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Checks a queued upload against the platform's limits before any quota is spent on it.
 * Over-long metadata is shortened; missing or broken assets are rejected.
 */
@Service
@Slf4j
public class UploadValidator {

    static final long MIN_VIDEO_BYTES = 1024;
    static final long LARGE_VIDEO_BYTES = 2L * 1024 * 1024 * 1024;
    static final long MAX_THUMBNAIL_BYTES = 2L * 1024 * 1024;
    static final int MAX_TITLE_LENGTH = 100;
    static final int MAX_DESCRIPTION_LENGTH = 5000;
    static final int MAX_TAGS_LENGTH = 500;

    private static final Set<String> THUMBNAIL_EXTENSIONS = Set.of(".png", ".jpg", ".jpeg");
    private static final String ELLIPSIS = "...";

    /**
     * @return the metadata to upload with, shortened where it exceeded a limit
     * @throws UploadValidationException listing every problem found
     */
    public SeoMetadata validate(String videoPath, String thumbnailPath, SeoMetadata seo) {
        List<String> issues = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        checkVideo(videoPath, issues, warnings);
        checkThumbnail(thumbnailPath, issues, warnings);
        SeoMetadata fixed = fixMetadata(seo, issues, warnings);

        if (!issues.isEmpty()) {
            throw new UploadValidationException(issues);
        }
        if (!warnings.isEmpty()) {
            log.warn("Upload warnings for {}: {}", FilePaths.fileName(videoPath), warnings);
        }
        return fixed;
    }

    /**
     * Copy of {@code seo} cut down to the title, description and tag limits.
     */
    public SeoMetadata fixMetadata(SeoMetadata seo) {
        return fixMetadata(seo, new ArrayList<>(), new ArrayList<>());
    }

    private void checkVideo(String videoPath, List<String> issues, List<String> warnings) {
        Path video = toPath(videoPath);
        if (video == null || !Files.isRegularFile(video)) {
            issues.add("Video not found: " + videoPath);
            return;
        }
        long size = sizeOf(video);
        if (size < MIN_VIDEO_BYTES) {
            issues.add("Video too small: " + size + " bytes (likely corrupted)");
        } else if (size > LARGE_VIDEO_BYTES) {
            warnings.add(String.format("Video large: %.1fGB (slow upload)", size / (1024.0 * 1024 * 1024)));
        }
    }

    private void checkThumbnail(String thumbnailPath, List<String> issues, List<String> warnings) {
        if (thumbnailPath == null || thumbnailPath.isBlank()) {
            warnings.add("No thumbnail provided, the platform will pick a frame");
            return;
        }
        Path thumbnail = toPath(thumbnailPath);
        if (thumbnail == null || !Files.isRegularFile(thumbnail)) {
            issues.add("Thumbnail not found: " + thumbnailPath);
            return;
        }
        String extension = FilePaths.extension(thumbnailPath).toLowerCase(Locale.ROOT);
        if (!THUMBNAIL_EXTENSIONS.contains(extension)) {
            issues.add("Invalid thumbnail format: " + extension + " (use PNG/JPG)");
        }
        long size = sizeOf(thumbnail);
        if (size > MAX_THUMBNAIL_BYTES) {
            issues.add(String.format("Thumbnail too large: %.1fMB (max 2MB)", size / (1024.0 * 1024)));
        }
    }

    private SeoMetadata fixMetadata(SeoMetadata seo, List<String> issues, List<String> warnings) {
        SeoMetadata fixed = new SeoMetadata();
        String title = seo != null && seo.getTitle() != null ? seo.getTitle().trim() : "";
        String description = seo != null && seo.getDescription() != null ? seo.getDescription() : "";
        List<String> tags = seo != null && seo.getTags() != null ? seo.getTags() : List.of();

        if (title.isEmpty()) {
            issues.add("Title is empty");
        } else if (title.length() > MAX_TITLE_LENGTH) {
            warnings.add("Title truncated: " + title.length() + " -> " + MAX_TITLE_LENGTH + " chars");
            title = truncate(title, MAX_TITLE_LENGTH);
        }
        fixed.setTitle(title);

        if (description.length() > MAX_DESCRIPTION_LENGTH) {
            warnings.add("Description truncated: " + description.length() + " -> " + MAX_DESCRIPTION_LENGTH + " chars");
            description = truncate(description, MAX_DESCRIPTION_LENGTH);
        }
        fixed.setDescription(description);

        // tags are counted as if joined by single spaces
        List<String> kept = new ArrayList<>();
        int length = 0;
        for (String tag : tags) {
            if (length + tag.length() + 1 > MAX_TAGS_LENGTH) {
                break;
            }
            kept.add(tag);
            length += tag.length() + 1;
        }
        if (kept.size() < tags.size()) {
            warnings.add("Tags trimmed: " + tags.size() + " -> " + kept.size() + " tags");
        }
        fixed.setTags(kept);
        return fixed;
    }

    private static String truncate(String value, int maxLength) {
        return value.substring(0, maxLength - ELLIPSIS.length()) + ELLIPSIS;
    }

    private static Path toPath(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Paths.get(value);
        } catch (InvalidPathException e) {
            return null;
        }
    }

    private static long sizeOf(Path file) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            log.debug("Could not size {}", file, e);
            return 0L;
        }
    }
}
