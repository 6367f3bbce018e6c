package com.example.attsync.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;

/**
 * Directory based mutual exclusion around the Access file. A lock is held while the
 * directory exists; creating it is the atomic test-and-set shared with the PHP and Python
 * jobs that read the same file.
 *
 * <p>The lock is advisory. A process that opens the Access file without going through
 * this protocol is not stopped by it.
 *
 * <p>A holder that dies leaves the directory behind. It is reclaimed once its modification
 * time is older than the stale threshold. Two waiters that both observe the same stale
 * directory can race on reclamation; the loser notices that the directory it moved away
 * is fresh again and puts it back.
 */
public class LockManager {
    private static final Logger LOGGER = LoggerFactory.getLogger(LockManager.class);

    static final Duration DEFAULT_BACKOFF = Duration.ofMillis(200);
    static final Duration DEFAULT_SETTLE_DELAY = Duration.ofMillis(50);

    /**
     * Pause between polls. Tests replace it to avoid real waiting.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final Clock clock;
    private final Sleeper sleeper;
    private final Duration backoff;
    private final Duration settleDelay;
    private final long processId;

    public LockManager() {
        this(Clock.systemUTC(), duration -> Thread.sleep(duration.toMillis()), DEFAULT_BACKOFF, DEFAULT_SETTLE_DELAY);
    }

    public LockManager(Clock clock, Sleeper sleeper, Duration backoff, Duration settleDelay) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.backoff = Objects.requireNonNull(backoff, "backoff");
        this.settleDelay = Objects.requireNonNull(settleDelay, "settleDelay");
        this.processId = ProcessHandle.current().pid();
    }

    /**
     * Blocks until the lock directory could be created or {@code timeout} elapsed.
     *
     * @param path       lock directory, usually a sibling of the Access file
     * @param timeout    how long to keep polling a busy lock
     * @param staleAfter age after which an existing lock is considered abandoned
     * @return the handle to pass to {@link #release(LockHandle)}
     * @throws LockTimeoutException when the lock stayed busy for {@code timeout}
     * @throws IOException          when the directory cannot be created for another reason
     */
    public LockHandle acquire(Path path, Duration timeout, Duration staleAfter) throws LockTimeoutException, IOException {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(staleAfter, "staleAfter");
        Instant start = clock.instant();
        int attempts = 0;
        while (true) {
            attempts++;
            try {
                Files.createDirectory(path);
                LockStamp stamp = new LockStamp(processId, clock.instant().truncatedTo(ChronoUnit.MILLIS));
                LockHandle handle = new LockHandle(path, processId, stamp.getCreatedAt(), writeStamp(path, stamp));
                LOGGER.debug("Acquired lock {} after {} attempt(s)", path, attempts);
                return handle;
            } catch (FileAlreadyExistsException busy) {
                if (reclaimIfStale(path, staleAfter)) {
                    pause(path, settleDelay);
                    continue;
                }
            }
            Duration waited = Duration.between(start, clock.instant());
            if (waited.compareTo(timeout) > 0) {
                LOGGER.warn("Lock {} still busy after {} ms, giving up", path, waited.toMillis());
                throw new LockTimeoutException(path, timeout);
            }
            pause(path, backoff);
        }
    }

    /**
     * Removes the stamp and the lock directory, but only while the stamp still names this
     * handle. Never throws: the directory may already have been reclaimed by another process.
     *
     * <p>A directory without a readable stamp is left alone unless this handle failed to
     * write its own stamp, since a new owner creates the directory before stamping it.
     */
    public void release(LockHandle handle) {
        if (handle == null) {
            return;
        }
        Path path = handle.getPath();
        if (!Files.isDirectory(path)) {
            LOGGER.debug("Lock {} was already removed", path);
            return;
        }
        Optional<LockStamp> current = readStamp(path);
        if (current.isPresent() && !handle.matches(current.get())) {
            LOGGER.warn("Lock {} is now held by pid {} (created {}), leaving it in place",
                path, current.get().getProcessId(), current.get().getCreatedAt());
            return;
        }
        if (current.isEmpty() && handle.isStamped()) {
            LOGGER.warn("Lock {} carries no stamp of ours, another process may be taking it; leaving it in place", path);
            return;
        }
        try {
            Files.deleteIfExists(path.resolve(LockStamp.FILE_NAME));
        } catch (IOException ex) {
            LOGGER.warn("Failed to remove lock stamp in {}", path, ex);
        }
        try {
            Files.delete(path);
            LOGGER.debug("Released lock {}", path);
        } catch (NoSuchFileException ex) {
            LOGGER.debug("Lock {} was already removed", path);
        } catch (IOException ex) {
            LOGGER.warn("Failed to remove lock directory {}", path, ex);
        }
    }

    /**
     * Reads the stamp of a currently held lock, if any.
     */
    public Optional<LockStamp> readStamp(Path path) {
        Path stampFile = path.resolve(LockStamp.FILE_NAME);
        try {
            return LockStamp.parse(Files.readString(stampFile, StandardCharsets.UTF_8));
        } catch (NoSuchFileException ex) {
            return Optional.empty();
        } catch (IOException ex) {
            LOGGER.debug("Unreadable lock stamp {}", stampFile, ex);
            return Optional.empty();
        }
    }

    /**
     * Age of the lock directory based on its modification time; empty when no lock is held.
     */
    public Optional<Duration> age(Path path) {
        try {
            Instant modified = Files.getLastModifiedTime(path).toInstant();
            return Optional.of(Duration.between(modified, clock.instant()));
        } catch (IOException ex) {
            return Optional.empty();
        }
    }

    boolean isStale(Path path, Duration staleAfter) {
        return age(path).map(age -> age.compareTo(staleAfter) > 0).orElse(false);
    }

    private boolean reclaimIfStale(Path path, Duration staleAfter) {
        if (!isStale(path, staleAfter)) {
            return false;
        }
        Path tombstone = path.resolveSibling(path.getFileName() + ".stale-" + processId + "-" + System.nanoTime());
        try {
            Files.move(path, tombstone, StandardCopyOption.ATOMIC_MOVE);
        } catch (NoSuchFileException ex) {
            // another waiter got there first
            return true;
        } catch (IOException ex) {
            LOGGER.warn("Could not reclaim stale lock {}", path, ex);
            return false;
        }
        if (!isStale(tombstone, staleAfter)) {
            restore(tombstone, path);
            return false;
        }
        LOGGER.warn("Reclaimed stale lock {} (stamp {})", path, readStamp(tombstone).map(Object::toString).orElse("missing"));
        deleteTree(tombstone);
        return true;
    }

    private void restore(Path tombstone, Path path) {
        try {
            Files.move(tombstone, path, StandardCopyOption.ATOMIC_MOVE);
            LOGGER.debug("Lock {} was taken over before reclamation, restored it", path);
        } catch (IOException ex) {
            LOGGER.warn("Moved a live lock {} aside and could not restore it from {}", path, tombstone, ex);
        }
    }

    private void deleteTree(Path dir) {
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir)) {
            for (Path entry : entries) {
                try {
                    Files.deleteIfExists(entry);
                } catch (IOException ex) {
                    LOGGER.warn("Failed to delete {}", entry, ex);
                }
            }
        } catch (IOException ex) {
            LOGGER.warn("Failed to list {}", dir, ex);
        }
        try {
            Files.deleteIfExists(dir);
        } catch (DirectoryNotEmptyException ex) {
            LOGGER.warn("Stale lock leftovers remain in {}", dir);
        } catch (IOException ex) {
            LOGGER.warn("Failed to delete {}", dir, ex);
        }
    }

    private boolean writeStamp(Path path, LockStamp stamp) {
        try {
            Files.writeString(path.resolve(LockStamp.FILE_NAME), stamp.format(), StandardCharsets.UTF_8);
            return true;
        } catch (IOException ex) {
            LOGGER.warn("Acquired lock {} but could not write its stamp", path, ex);
            return false;
        }
    }

    private void pause(Path path, Duration duration) throws LockTimeoutException {
        try {
            sleeper.sleep(duration);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new LockTimeoutException(path, "Interrupted while waiting for lock " + path, ex);
        }
    }
}
