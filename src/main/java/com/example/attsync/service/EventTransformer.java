package com.example.attsync.service;

import com.example.attsync.model.NormalizedRecord;
import com.example.attsync.model.RawAttendanceEvent;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns a punch read from the Access store into the row the HR table expects.
 *
 * <p>The terminals run ahead of the HR clock by a fixed amount, so the punch time is moved
 * back by {@code clockSkew} before it is split into date and time. Badges longer than four
 * characters belong to visitor and test cards and are never forwarded.
 */
public final class EventTransformer {
    public static final int MAX_BADGE_LENGTH = 4;

    private final Duration clockSkew;
    private final String sourceMarker;

    public EventTransformer(Duration clockSkew, String sourceMarker) {
        this.clockSkew = Objects.requireNonNull(clockSkew, "clockSkew");
        this.sourceMarker = sourceMarker == null ? "" : sourceMarker;
    }

    /**
     * @return the normalized record, or empty when the punch is dropped by validation
     */
    public Optional<NormalizedRecord> normalize(RawAttendanceEvent raw) {
        Objects.requireNonNull(raw, "raw");
        String badge = raw.getBadgeId() == null ? "" : raw.getBadgeId().trim();
        if (!isForwardable(badge)) {
            return Optional.empty();
        }
        LocalDateTime corrected = raw.getEventTime().minus(clockSkew);
        String serial = raw.getTerminalSerial() == null ? "" : raw.getTerminalSerial().trim();
        return Optional.of(new NormalizedRecord(
            corrected.toLocalDate(),
            corrected.toLocalTime(),
            badge,
            serial,
            sourceMarker + serial,
            sourceMarker));
    }

    /**
     * Whether a badge may reach the HR table: one to {@value #MAX_BADGE_LENGTH} characters
     * after trimming.
     */
    public static boolean isForwardable(String badge) {
        if (badge == null) {
            return false;
        }
        String trimmed = badge.trim();
        return !trimmed.isEmpty() && trimmed.length() <= MAX_BADGE_LENGTH;
    }
}
