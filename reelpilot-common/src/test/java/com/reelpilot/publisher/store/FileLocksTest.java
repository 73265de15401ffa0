package com.reelpilot.publisher.store;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class FileLocksTest {

    @TempDir
    Path dir;

    @Test
    void tryAcquireFailsWhileAnotherThreadHoldsTheLock() throws Exception {
        Path lockFile = dir.resolve("locks/upload_abc.lock");

        try (FileLocks.Handle held = FileLocks.acquire(lockFile)) {
            Optional<FileLocks.Handle> other = CompletableFuture.supplyAsync(() -> {
                try {
                    return FileLocks.tryAcquire(lockFile);
                } catch (Exception e) {
                    throw new IllegalStateException(e);
                }
            }).get();
            assertTrue(other.isEmpty());
        }

        Optional<FileLocks.Handle> afterRelease = FileLocks.tryAcquire(lockFile);
        assertTrue(afterRelease.isPresent());
        afterRelease.get().close();
    }

    @Test
    void reacquiringOnTheSameThreadIsRejected() throws Exception {
        Path lockFile = dir.resolve("state.json.lock");

        try (FileLocks.Handle ignored = FileLocks.acquire(lockFile)) {
            assertThrows(IllegalStateException.class, () -> FileLocks.acquire(lockFile));
            assertTrue(FileLocks.tryAcquire(lockFile).isEmpty());
        }
    }
}
