package com.example.attsync.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Counts and outcome of one run, handed to whoever triggered it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"outcome", "read", "dropped", "written", "failed", "skippedExisting",
    "dryRun", "watermark", "startedAt", "finishedAt", "errorMessage"})
public final class RunResult {
    private final RunOutcome outcome;
    private final int read;
    private final int dropped;
    private final int written;
    private final int failed;
    private final int skippedExisting;
    private final boolean dryRun;
    private final LocalDate watermark;
    private final Instant startedAt;
    private final Instant finishedAt;
    private final String errorMessage;

    private RunResult(Builder builder) {
        this.outcome = Objects.requireNonNull(builder.outcome, "outcome");
        this.read = builder.read;
        this.dropped = builder.dropped;
        this.written = builder.written;
        this.failed = builder.failed;
        this.skippedExisting = builder.skippedExisting;
        this.dryRun = builder.dryRun;
        this.watermark = builder.watermark;
        this.startedAt = builder.startedAt;
        this.finishedAt = builder.finishedAt;
        this.errorMessage = builder.errorMessage;
    }

    public static Builder builder() {
        return new Builder();
    }

    public RunOutcome getOutcome() {
        return outcome;
    }

    public int getRead() {
        return read;
    }

    public int getDropped() {
        return dropped;
    }

    public int getWritten() {
        return written;
    }

    public int getFailed() {
        return failed;
    }

    public int getSkippedExisting() {
        return skippedExisting;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public LocalDate getWatermark() {
        return watermark;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RunResult)) {
            return false;
        }
        RunResult that = (RunResult) o;
        return read == that.read
            && dropped == that.dropped
            && written == that.written
            && failed == that.failed
            && skippedExisting == that.skippedExisting
            && dryRun == that.dryRun
            && outcome == that.outcome
            && Objects.equals(watermark, that.watermark)
            && Objects.equals(startedAt, that.startedAt)
            && Objects.equals(finishedAt, that.finishedAt)
            && Objects.equals(errorMessage, that.errorMessage);
    }

    @Override
    public int hashCode() {
        return Objects.hash(outcome, read, dropped, written, failed, skippedExisting, dryRun,
            watermark, startedAt, finishedAt, errorMessage);
    }

    @Override
    public String toString() {
        return "RunResult{" +
            "outcome=" + outcome +
            ", read=" + read +
            ", dropped=" + dropped +
            ", written=" + written +
            ", failed=" + failed +
            ", skippedExisting=" + skippedExisting +
            ", dryRun=" + dryRun +
            ", watermark=" + watermark +
            (errorMessage == null ? "" : ", errorMessage='" + errorMessage + '\'') +
            '}';
    }

    public static final class Builder {
        private RunOutcome outcome;
        private int read;
        private int dropped;
        private int written;
        private int failed;
        private int skippedExisting;
        private boolean dryRun;
        private LocalDate watermark;
        private Instant startedAt;
        private Instant finishedAt;
        private String errorMessage;

        private Builder() {
        }

        public Builder outcome(RunOutcome outcome) {
            this.outcome = outcome;
            return this;
        }

        public Builder read(int read) {
            this.read = read;
            return this;
        }

        public Builder dropped(int dropped) {
            this.dropped = dropped;
            return this;
        }

        public Builder written(int written) {
            this.written = written;
            return this;
        }

        public Builder failed(int failed) {
            this.failed = failed;
            return this;
        }

        public Builder skippedExisting(int skippedExisting) {
            this.skippedExisting = skippedExisting;
            return this;
        }

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public Builder watermark(LocalDate watermark) {
            this.watermark = watermark;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder finishedAt(Instant finishedAt) {
            this.finishedAt = finishedAt;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage;
            return this;
        }

        public RunResult build() {
            return new RunResult(this);
        }
    }
}
