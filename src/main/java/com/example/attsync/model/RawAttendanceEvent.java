package com.example.attsync.model;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A punch as stored by the terminals in the Access file, joined with the user row that
 * resolves the badge number.
 */
public final class RawAttendanceEvent {
    private final LocalDateTime eventTime;
    private final String badgeId;
    private final String terminalSerial;
    private final Map<String, String> joinedUserFields;

    public RawAttendanceEvent(LocalDateTime eventTime,
                              String badgeId,
                              String terminalSerial,
                              Map<String, String> joinedUserFields) {
        this.eventTime = Objects.requireNonNull(eventTime, "eventTime");
        this.badgeId = badgeId;
        this.terminalSerial = terminalSerial;
        Map<String, String> copy = new LinkedHashMap<>();
        if (joinedUserFields != null) {
            copy.putAll(joinedUserFields);
        }
        this.joinedUserFields = Collections.unmodifiableMap(copy);
    }

    public LocalDateTime getEventTime() {
        return eventTime;
    }

    public String getBadgeId() {
        return badgeId;
    }

    public String getTerminalSerial() {
        return terminalSerial;
    }

    public Map<String, String> getJoinedUserFields() {
        return joinedUserFields;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RawAttendanceEvent)) {
            return false;
        }
        RawAttendanceEvent that = (RawAttendanceEvent) o;
        return eventTime.equals(that.eventTime)
            && Objects.equals(badgeId, that.badgeId)
            && Objects.equals(terminalSerial, that.terminalSerial)
            && joinedUserFields.equals(that.joinedUserFields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventTime, badgeId, terminalSerial, joinedUserFields);
    }

    @Override
    public String toString() {
        return "RawAttendanceEvent{" +
            "eventTime=" + eventTime +
            ", badgeId='" + badgeId + '\'' +
            ", terminalSerial='" + terminalSerial + '\'' +
            ", joinedUserFields=" + joinedUserFields +
            '}';
    }
}
