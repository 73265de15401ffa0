package com.reelpilot.publisher.service;

import com.reelpilot.publisher.config.PublisherProperties;
import com.reelpilot.publisher.exception.StateStoreException;
import com.reelpilot.publisher.store.FileLocks;
import com.reelpilot.publisher.util.FilePaths;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Optional;

/**
 * Per-file upload locks under {@code <state dir>/upload_locks}, so a daemon and a manual run
 * never publish the same file twice. Locks are released by the OS if the holder dies.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UploadLockService {

    static final String LOCK_DIR = "upload_locks";

    private final PublisherProperties properties;

    /**
     * @return the held lock, or empty when another worker is already uploading this file
     */
    public Optional<FileLocks.Handle> tryLock(String filePath) {
        Path lockFile = lockFileFor(filePath);
        try {
            Optional<FileLocks.Handle> handle = FileLocks.tryAcquire(lockFile);
            if (handle.isEmpty()) {
                log.debug("Upload lock {} is held elsewhere", lockFile.getFileName());
            }
            return handle;
        } catch (IOException e) {
            throw new StateStoreException("Cannot open upload lock " + lockFile, e);
        }
    }

    Path lockFileFor(String filePath) {
        String normalized = FilePaths.normalize(filePath);
        return Paths.get(properties.getState().getDir(), LOCK_DIR, "upload_" + shortHash(normalized) + ".lock");
    }

    private static String shortHash(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(value.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, 16);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
