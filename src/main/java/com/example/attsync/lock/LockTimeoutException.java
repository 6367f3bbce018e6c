package com.example.attsync.lock;

import java.nio.file.Path;
import java.time.Duration;

/**
 * The lock stayed busy for longer than the caller was willing to wait. Callers skip the
 * run; this is expected under contention and is not a failure.
 */
public class LockTimeoutException extends Exception {
    private final Path path;

    public LockTimeoutException(Path path, Duration timeout) {
        super("Could not acquire lock " + path + " within " + timeout.toMillis() + " ms");
        this.path = path;
    }

    public LockTimeoutException(Path path, String message, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
