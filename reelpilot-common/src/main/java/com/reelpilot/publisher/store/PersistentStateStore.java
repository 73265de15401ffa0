package com.reelpilot.publisher.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.reelpilot.publisher.exception.StateStoreException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Small JSON documents on local disk, one file per key.
 * <p>
 * Writes go to a temp file in the same directory followed by an atomic rename, so a reader
 * sees either the old or the new document. Read-modify-write cycles hold an exclusive lock on
 * {@code <key>.json.lock} for their whole duration, which serializes writers across processes.
 * A document that fails to parse is copied once to {@code <key>.json.corrupted.<mtimeMillis>} and
 * the caller gets the default document. Reading the same corrupt file again does not copy it again.
 */
@Slf4j
public class PersistentStateStore {

    private static final String EXTENSION = ".json";

    private final Path baseDir;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public PersistentStateStore(Path baseDir, ObjectMapper objectMapper, Clock clock) {
        this.baseDir = baseDir;
        this.objectMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.clock = clock;
    }

    public Path pathFor(String key) {
        return baseDir.resolve(key + EXTENSION);
    }

    public <T> T load(String key, Class<T> type, Supplier<T> defaultValue) {
        return read(pathFor(key), type, defaultValue);
    }

    public <T> boolean save(String key, T document) {
        Path file = pathFor(key);
        try (FileLocks.Handle ignored = FileLocks.acquire(lockPathFor(key))) {
            write(file, document);
            return true;
        } catch (IOException | RuntimeException e) {
            log.error("Failed to save state document {}", file, e);
            return false;
        }
    }

    /**
     * Loads the document, applies {@code mutation} and writes the result back while holding the
     * document lock. The mutation edits the document in place; its return value is handed back
     * to the caller.
     *
     * @throws StateStoreException if the lock cannot be taken or the document cannot be written
     */
    public <T, R> R update(String key, Class<T> type, Supplier<T> defaultValue, Function<T, R> mutation) {
        Path file = pathFor(key);
        try (FileLocks.Handle ignored = FileLocks.acquire(lockPathFor(key))) {
            T document = read(file, type, defaultValue);
            R result = mutation.apply(document);
            write(file, document);
            return result;
        } catch (IOException e) {
            throw new StateStoreException("Failed to update state document " + file, e);
        }
    }

    public boolean delete(String key) {
        Path file = pathFor(key);
        try (FileLocks.Handle ignored = FileLocks.acquire(lockPathFor(key))) {
            return Files.deleteIfExists(file);
        } catch (IOException e) {
            log.error("Failed to delete state document {}", file, e);
            return false;
        }
    }

    public boolean exists(String key) {
        return Files.exists(pathFor(key));
    }

    private Path lockPathFor(String key) {
        return baseDir.resolve(key + EXTENSION + ".lock");
    }

    private <T> T read(Path file, Class<T> type, Supplier<T> defaultValue) {
        if (!Files.exists(file)) {
            return defaultValue.get();
        }
        try {
            T document = objectMapper.readValue(file.toFile(), type);
            return document != null ? document : defaultValue.get();
        } catch (JsonProcessingException e) {
            quarantine(file, e);
            return defaultValue.get();
        } catch (IOException e) {
            log.error("Failed to read state document {}, using default", file, e);
            return defaultValue.get();
        }
    }

    private void quarantine(Path file, JsonProcessingException cause) {
        Path backup = file.resolveSibling(file.getFileName() + ".corrupted." + modifiedMillis(file));
        if (Files.exists(backup)) {
            log.debug("Corrupted state document {} already backed up to {}", file, backup);
            return;
        }
        try {
            Files.copy(file, backup, StandardCopyOption.COPY_ATTRIBUTES);
            log.warn("Corrupted state document {} backed up to {}: {}", file, backup, cause.getOriginalMessage());
        } catch (FileAlreadyExistsException e) {
            log.debug("Corrupted state document {} was backed up concurrently", file);
        } catch (IOException e) {
            log.warn("Corrupted state document {} could not be backed up: {}", file, cause.getOriginalMessage(), e);
        }
    }

    private long modifiedMillis(Path file) {
        try {
            return Files.getLastModifiedTime(file).toMillis();
        } catch (IOException e) {
            return clock.millis();
        }
    }

    private <T> void write(Path file, T document) throws IOException {
        Path dir = file.toAbsolutePath().getParent();
        Files.createDirectories(dir);
        ByteBuffer buffer = ByteBuffer.wrap(objectMapper.writeValueAsBytes(document));
        Path temp = Files.createTempFile(dir, file.getFileName() + ".", ".tmp");
        try {
            try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            try {
                Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("Atomic rename not supported for {}, falling back to plain replace", file);
                Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }
}
