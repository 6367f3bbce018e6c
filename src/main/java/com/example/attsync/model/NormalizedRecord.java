package com.example.attsync.model;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Objects;

/**
 * Row shape accepted by the HR attendance table, after skew correction and tagging.
 */
public final class NormalizedRecord {
    private final LocalDate logDate;
    private final LocalTime logTime;
    private final String badgeId;
    private final String doorId;
    private final String deviceTag;
    private final String sourceTag;

    public NormalizedRecord(LocalDate logDate,
                            LocalTime logTime,
                            String badgeId,
                            String doorId,
                            String deviceTag,
                            String sourceTag) {
        this.logDate = Objects.requireNonNull(logDate, "logDate");
        this.logTime = Objects.requireNonNull(logTime, "logTime");
        this.badgeId = Objects.requireNonNull(badgeId, "badgeId");
        this.doorId = doorId == null ? "" : doorId;
        this.deviceTag = deviceTag == null ? "" : deviceTag;
        this.sourceTag = sourceTag == null ? "" : sourceTag;
    }

    public LocalDate getLogDate() {
        return logDate;
    }

    public LocalTime getLogTime() {
        return logTime;
    }

    public String getBadgeId() {
        return badgeId;
    }

    public String getDoorId() {
        return doorId;
    }

    public String getDeviceTag() {
        return deviceTag;
    }

    public String getSourceTag() {
        return sourceTag;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof NormalizedRecord)) {
            return false;
        }
        NormalizedRecord that = (NormalizedRecord) o;
        return logDate.equals(that.logDate)
            && logTime.equals(that.logTime)
            && badgeId.equals(that.badgeId)
            && doorId.equals(that.doorId)
            && deviceTag.equals(that.deviceTag)
            && sourceTag.equals(that.sourceTag);
    }

    @Override
    public int hashCode() {
        return Objects.hash(logDate, logTime, badgeId, doorId, deviceTag, sourceTag);
    }

    @Override
    public String toString() {
        return "NormalizedRecord{" +
            "logDate=" + logDate +
            ", logTime=" + logTime +
            ", badgeId='" + badgeId + '\'' +
            ", doorId='" + doorId + '\'' +
            ", deviceTag='" + deviceTag + '\'' +
            ", sourceTag='" + sourceTag + '\'' +
            '}';
    }
}
