package com.example.attsync.lock;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Objects;

/**
 * Proof of ownership of a lock directory, returned by {@link LockManager#acquire}.
 */
public final class LockHandle {
    private final Path path;
    private final long ownerProcessId;
    private final Instant createdAt;
    private final boolean stamped;

    LockHandle(Path path, long ownerProcessId, Instant createdAt, boolean stamped) {
        this.path = Objects.requireNonNull(path, "path");
        this.ownerProcessId = ownerProcessId;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.stamped = stamped;
    }

    public Path getPath() {
        return path;
    }

    public long getOwnerProcessId() {
        return ownerProcessId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    /**
     * False when the stamp could not be written after the directory was created. Only such a
     * handle may remove an unstamped lock directory.
     */
    public boolean isStamped() {
        return stamped;
    }

    boolean matches(LockStamp stamp) {
        return stamp != null
            && stamp.getProcessId() == ownerProcessId
            && createdAt.equals(stamp.getCreatedAt());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LockHandle)) {
            return false;
        }
        LockHandle that = (LockHandle) o;
        return ownerProcessId == that.ownerProcessId
            && path.equals(that.path)
            && createdAt.equals(that.createdAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, ownerProcessId, createdAt);
    }

    @Override
    public String toString() {
        return "LockHandle{" +
            "path=" + path +
            ", ownerProcessId=" + ownerProcessId +
            ", createdAt=" + createdAt +
            ", stamped=" + stamped +
            '}';
    }
}
