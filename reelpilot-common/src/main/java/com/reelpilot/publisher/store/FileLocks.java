package com.reelpilot.publisher.store;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Exclusive locks on lock files, held across both threads of this JVM and other processes.
 * The OS lock comes from {@link FileChannel#lock()}; the in-process {@link ReentrantLock}
 * guards against {@link java.nio.channels.OverlappingFileLockException} between threads.
 */
@Slf4j
public final class FileLocks {

    private static final ConcurrentHashMap<Path, ReentrantLock> LOCAL_LOCKS = new ConcurrentHashMap<>();

    private FileLocks() {
    }

    public static Handle acquire(Path lockFile) throws IOException {
        Path key = normalize(lockFile);
        ReentrantLock local = LOCAL_LOCKS.computeIfAbsent(key, k -> new ReentrantLock());
        if (local.isHeldByCurrentThread()) {
            throw new IllegalStateException("Lock already held by this thread: " + key);
        }
        local.lock();
        FileChannel channel = null;
        try {
            channel = open(key);
            FileLock fileLock = channel.lock();
            return new Handle(key, local, channel, fileLock);
        } catch (IOException | RuntimeException e) {
            closeQuietly(channel, key);
            local.unlock();
            throw e;
        }
    }

    /**
     * Returns an empty optional when another thread or process already holds the lock.
     */
    public static Optional<Handle> tryAcquire(Path lockFile) throws IOException {
        Path key = normalize(lockFile);
        ReentrantLock local = LOCAL_LOCKS.computeIfAbsent(key, k -> new ReentrantLock());
        if (local.isHeldByCurrentThread() || !local.tryLock()) {
            return Optional.empty();
        }
        FileChannel channel = null;
        try {
            channel = open(key);
            FileLock fileLock = channel.tryLock();
            if (fileLock == null) {
                closeQuietly(channel, key);
                local.unlock();
                return Optional.empty();
            }
            return Optional.of(new Handle(key, local, channel, fileLock));
        } catch (IOException | RuntimeException e) {
            closeQuietly(channel, key);
            local.unlock();
            throw e;
        }
    }

    private static FileChannel open(Path lockFile) throws IOException {
        Path parent = lockFile.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        return FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
    }

    private static Path normalize(Path lockFile) {
        return lockFile.toAbsolutePath().normalize();
    }

    private static void closeQuietly(FileChannel channel, Path lockFile) {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            log.warn("Failed to close lock channel {}", lockFile, e);
        }
    }

    public static final class Handle implements AutoCloseable {
        private final Path lockFile;
        private final ReentrantLock local;
        private final FileChannel channel;
        private final FileLock fileLock;

        private Handle(Path lockFile, ReentrantLock local, FileChannel channel, FileLock fileLock) {
            this.lockFile = lockFile;
            this.local = local;
            this.channel = channel;
            this.fileLock = fileLock;
        }

        public Path getLockFile() {
            return lockFile;
        }

        @Override
        public void close() {
            try {
                fileLock.release();
            } catch (IOException e) {
                log.warn("Failed to release lock {}", lockFile, e);
            } finally {
                closeQuietly(channel, lockFile);
                local.unlock();
            }
        }
    }
}
