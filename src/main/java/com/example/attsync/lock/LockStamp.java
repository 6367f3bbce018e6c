package com.example.attsync.lock;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.Optional;

/**
 * Content of the {@code lockinfo.txt} file written inside a held lock directory.
 * Operators read it to find out who holds the store; correctness only relies on the
 * directory's modification time.
 */
public final class LockStamp {
    static final String FILE_NAME = "lockinfo.txt";

    private final long processId;
    private final Instant createdAt;

    public LockStamp(long processId, Instant createdAt) {
        this.processId = processId;
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
    }

    public long getProcessId() {
        return processId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    String format() {
        return "pid=" + processId + "\ncreated=" + createdAt + "\n";
    }

    /**
     * Parses stamp content; unknown lines are ignored. Empty when either field is missing
     * or malformed, which happens for stamps written by a crashed holder.
     */
    static Optional<LockStamp> parse(String content) {
        if (content == null) {
            return Optional.empty();
        }
        Long pid = null;
        Instant created = null;
        for (String line : content.split("\\R")) {
            int eq = line.indexOf('=');
            if (eq <= 0) {
                continue;
            }
            String key = line.substring(0, eq).trim();
            String value = line.substring(eq + 1).trim();
            try {
                if ("pid".equals(key)) {
                    pid = Long.parseLong(value);
                } else if ("created".equals(key)) {
                    created = Instant.parse(value);
                }
            } catch (NumberFormatException | DateTimeParseException ex) {
                return Optional.empty();
            }
        }
        if (pid == null || created == null) {
            return Optional.empty();
        }
        return Optional.of(new LockStamp(pid, created));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LockStamp)) {
            return false;
        }
        LockStamp that = (LockStamp) o;
        return processId == that.processId && createdAt.equals(that.createdAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(processId, createdAt);
    }

    @Override
    public String toString() {
        return "LockStamp{" +
            "processId=" + processId +
            ", createdAt=" + createdAt +
            '}';
    }
}
