package com.reelpilot.publisher.service;

import com.reelpilot.publisher.config.PublisherProperties;
import com.reelpilot.publisher.exception.QuotaExceededException;
import com.reelpilot.publisher.exception.UploadFailedException;
import com.reelpilot.publisher.model.SeoMetadata;
import com.reelpilot.publisher.util.FilePaths;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Runs an external upload command built from {@code app.uploader.command}.
 * Arguments may contain {@code {file}}, {@code {title}}, {@code {description}}, {@code {tags}},
 * {@code {publishAt}} and {@code {thumbnail}}. The last non-blank line the command prints is
 * taken as the new video id. A command still running after {@code app.uploader.timeout-seconds}
 * is killed and the upload counts as failed.
 */
@Service
@ConditionalOnProperty(name = "app.uploader.type", havingValue = "command", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class CommandVideoUploader implements VideoUploader {

    private final PublisherProperties properties;

    @Override
    public String upload(String filePath, SeoMetadata seo, Instant publishAt, String thumbnailPath) {
        List<String> template = properties.getUploader().getCommand();
        if (template == null || template.isEmpty()) {
            throw new UploadFailedException("No uploader command configured (app.uploader.command)");
        }

        Map<String, String> values = placeholders(filePath, seo, publishAt, thumbnailPath);
        List<String> command = template.stream()
                .map(arg -> substitute(arg, values))
                .collect(Collectors.toList());

        String fileName = FilePaths.fileName(filePath);
        log.info("Uploading {} via {}", fileName, command.get(0));

        CommandResult result;
        try {
            result = executeCommand(command);
        } catch (IOException e) {
            throw new UploadFailedException("Could not run uploader for " + fileName, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UploadFailedException("Interrupted while uploading " + fileName, e);
        }

        if (result.isTimedOut()) {
            throw new UploadFailedException("Uploader timed out after " + properties.getUploader().getTimeoutSeconds()
                    + "s for " + fileName + ": " + lastLine(result.getOutput()));
        }
        if (result.getExitCode() == properties.getUploader().getQuotaExitCode()) {
            throw new QuotaExceededException("Uploader reported quota exhausted for " + fileName);
        }
        if (result.getExitCode() != 0) {
            throw new UploadFailedException("Uploader failed with code " + result.getExitCode()
                    + " for " + fileName + ": " + lastLine(result.getOutput()));
        }

        String videoId = lastLine(result.getOutput());
        if (videoId.isEmpty()) {
            throw new UploadFailedException("Uploader printed no video id for " + fileName);
        }
        return videoId;
    }

    // Protected method for mocking process execution in tests
    protected CommandResult executeCommand(List<String> command) throws IOException, InterruptedException {
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.redirectErrorStream(true);
        Process process = pb.start();

        List<String> output = Collections.synchronizedList(new ArrayList<>());
        Thread drain = new Thread(() -> drainOutput(process, output), "uploader-output");
        drain.setDaemon(true);
        drain.start();

        try {
            if (!process.waitFor(properties.getUploader().getTimeoutSeconds(), TimeUnit.SECONDS)) {
                log.warn("Uploader still running after {}s, killing it", properties.getUploader().getTimeoutSeconds());
                process.destroyForcibly();
                return CommandResult.timedOut(snapshot(output));
            }
            drain.join(TimeUnit.SECONDS.toMillis(5));
            return new CommandResult(process.exitValue(), snapshot(output));
        } finally {
            if (process.isAlive()) {
                process.destroyForcibly();
            }
        }
    }

    private static void drainOutput(Process process, List<String> output) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                log.debug("uploader: {}", line);
                output.add(line);
            }
        } catch (IOException e) {
            log.debug("Uploader output closed: {}", e.getMessage());
        }
    }

    private static List<String> snapshot(List<String> output) {
        synchronized (output) {
            return new ArrayList<>(output);
        }
    }

    private static Map<String, String> placeholders(String filePath, SeoMetadata seo, Instant publishAt,
                                                    String thumbnailPath) {
        Map<String, String> values = new HashMap<>();
        values.put("file", filePath);
        values.put("title", seo != null && seo.getTitle() != null ? seo.getTitle() : "");
        values.put("description", seo != null && seo.getDescription() != null ? seo.getDescription() : "");
        values.put("tags", seo != null && seo.getTags() != null ? String.join(",", seo.getTags()) : "");
        values.put("publishAt", publishAt != null ? publishAt.toString() : "");
        values.put("thumbnail", thumbnailPath != null ? thumbnailPath : "");
        return values;
    }

    private static String substitute(String arg, Map<String, String> values) {
        String result = arg;
        for (Map.Entry<String, String> entry : values.entrySet()) {
            result = result.replace("{" + entry.getKey() + "}", entry.getValue());
        }
        return result;
    }

    private static String lastLine(List<String> output) {
        for (int i = output.size() - 1; i >= 0; i--) {
            String line = output.get(i).trim();
            if (!line.isEmpty()) {
                return line;
            }
        }
        return "";
    }

    public static final class CommandResult {
        private final int exitCode;
        private final List<String> output;
        private final boolean timedOut;

        public CommandResult(int exitCode, List<String> output) {
            this(exitCode, output, false);
        }

        private CommandResult(int exitCode, List<String> output, boolean timedOut) {
            this.exitCode = exitCode;
            this.output = output;
            this.timedOut = timedOut;
        }

        public static CommandResult timedOut(List<String> output) {
            return new CommandResult(-1, output, true);
        }

        public int getExitCode() {
            return exitCode;
        }

        public List<String> getOutput() {
            return output;
        }

        public boolean isTimedOut() {
            return timedOut;
        }
    }
}
