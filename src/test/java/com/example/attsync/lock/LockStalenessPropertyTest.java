package com.example.attsync.lock;

import net.jqwik.api.ForAll;
import net.jqwik.api.Label;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.IntRange;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class LockStalenessPropertyTest {
    private static final Instant NOW = Instant.parse("2025-01-10T08:00:00Z");

    @Property(tries = 50)
    @Label("a lock is stale exactly when it is older than the threshold")
    void staleIffOlderThanThreshold(@ForAll @IntRange(min = 0, max = 600) int ageSeconds,
                                    @ForAll @IntRange(min = 1, max = 300) int staleSeconds) throws IOException {
        Path dir = Files.createTempDirectory("lock-prop");
        try {
            Path lockPath = dir.resolve("access_lock");
            Files.createDirectory(lockPath);
            Files.setLastModifiedTime(lockPath, FileTime.from(NOW.minusSeconds(ageSeconds)));
            LockManager lockManager = new LockManager(new MutableClock(NOW), duration -> { },
                LockManager.DEFAULT_BACKOFF, LockManager.DEFAULT_SETTLE_DELAY);

            boolean stale = lockManager.isStale(lockPath, Duration.ofSeconds(staleSeconds));

            assertThat(stale).isEqualTo(ageSeconds > staleSeconds);
        } finally {
            Files.deleteIfExists(dir.resolve("access_lock"));
            Files.deleteIfExists(dir);
        }
    }

    @Property(tries = 20)
    @Label("a missing lock is never stale")
    void missingLockIsNeverStale(@ForAll @IntRange(min = 0, max = 300) int staleSeconds) {
        LockManager lockManager = new LockManager(new MutableClock(NOW), duration -> { },
            LockManager.DEFAULT_BACKOFF, LockManager.DEFAULT_SETTLE_DELAY);

        assertThat(lockManager.isStale(Path.of("does-not-exist", "access_lock"), Duration.ofSeconds(staleSeconds)))
            .isFalse();
    }
}
