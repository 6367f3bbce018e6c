package com.example.attsync.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Tuning of a single forwarding run: watermark window, lock timings and the
 * transformation constants.
 */
public class SyncConfig {
    static final int DEFAULT_LOOKBACK_DAYS = 10;
    static final int DEFAULT_LOCK_TIMEOUT_SECONDS = 15;
    static final int DEFAULT_STALE_LOCK_SECONDS = 60;
    static final int DEFAULT_CLOCK_SKEW_MINUTES = 10;
    static final String DEFAULT_SOURCE_MARKER = "SRC-ZKT-";

    private int lookbackDays = DEFAULT_LOOKBACK_DAYS;
    private int lockTimeoutSeconds = DEFAULT_LOCK_TIMEOUT_SECONDS;
    private int staleLockSeconds = DEFAULT_STALE_LOCK_SECONDS;
    private int clockSkewMinutes = DEFAULT_CLOCK_SKEW_MINUTES;
    private String sourceMarker = DEFAULT_SOURCE_MARKER;
    private boolean dryRun;

    public int getLookbackDays() {
        return lookbackDays;
    }

    public void setLookbackDays(int lookbackDays) {
        this.lookbackDays = lookbackDays;
    }

    public int getLockTimeoutSeconds() {
        return lockTimeoutSeconds;
    }

    public void setLockTimeoutSeconds(int lockTimeoutSeconds) {
        this.lockTimeoutSeconds = lockTimeoutSeconds;
    }

    public int getStaleLockSeconds() {
        return staleLockSeconds;
    }

    public void setStaleLockSeconds(int staleLockSeconds) {
        this.staleLockSeconds = staleLockSeconds;
    }

    public int getClockSkewMinutes() {
        return clockSkewMinutes;
    }

    public void setClockSkewMinutes(int clockSkewMinutes) {
        this.clockSkewMinutes = clockSkewMinutes;
    }

    public String getSourceMarker() {
        return sourceMarker;
    }

    public void setSourceMarker(String sourceMarker) {
        this.sourceMarker = sourceMarker;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public void setDryRun(boolean dryRun) {
        this.dryRun = dryRun;
    }

    public Duration lockTimeout() {
        return Duration.ofSeconds(lockTimeoutSeconds);
    }

    public Duration staleLockAge() {
        return Duration.ofSeconds(staleLockSeconds);
    }

    public Duration clockSkew() {
        return Duration.ofMinutes(clockSkewMinutes);
    }

    public void applyDefaults() {
        if (lookbackDays < 0) {
            lookbackDays = DEFAULT_LOOKBACK_DAYS;
        }
        if (lockTimeoutSeconds <= 0) {
            lockTimeoutSeconds = DEFAULT_LOCK_TIMEOUT_SECONDS;
        }
        if (staleLockSeconds <= 0) {
            staleLockSeconds = DEFAULT_STALE_LOCK_SECONDS;
        }
        if (clockSkewMinutes < 0) {
            clockSkewMinutes = DEFAULT_CLOCK_SKEW_MINUTES;
        }
        if (sourceMarker == null) {
            sourceMarker = DEFAULT_SOURCE_MARKER;
        }
    }

    @Override
    public String toString() {
        return "SyncConfig{" +
            "lookbackDays=" + lookbackDays +
            ", lockTimeoutSeconds=" + lockTimeoutSeconds +
            ", staleLockSeconds=" + staleLockSeconds +
            ", clockSkewMinutes=" + clockSkewMinutes +
            ", sourceMarker='" + sourceMarker + '\'' +
            ", dryRun=" + dryRun +
            '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SyncConfig)) {
            return false;
        }
        SyncConfig that = (SyncConfig) o;
        return lookbackDays == that.lookbackDays
            && lockTimeoutSeconds == that.lockTimeoutSeconds
            && staleLockSeconds == that.staleLockSeconds
            && clockSkewMinutes == that.clockSkewMinutes
            && dryRun == that.dryRun
            && Objects.equals(sourceMarker, that.sourceMarker);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lookbackDays, lockTimeoutSeconds, staleLockSeconds, clockSkewMinutes, sourceMarker, dryRun);
    }
}
