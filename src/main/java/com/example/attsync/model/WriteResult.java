package com.example.attsync.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of writing one {@link NormalizedRecord} into the sink.
 */
public final class WriteResult {

    public enum Outcome {
        OK,
        ERROR,
        /** An identical row was already present and nothing was inserted. */
        DUPLICATE
    }

    private final NormalizedRecord record;
    private final Outcome outcome;
    private final String errorMessage;

    private WriteResult(NormalizedRecord record, Outcome outcome, String errorMessage) {
        this.record = Objects.requireNonNull(record, "record");
        this.outcome = Objects.requireNonNull(outcome, "outcome");
        this.errorMessage = errorMessage;
    }

    public static WriteResult ok(NormalizedRecord record) {
        return new WriteResult(record, Outcome.OK, null);
    }

    public static WriteResult duplicate(NormalizedRecord record) {
        return new WriteResult(record, Outcome.DUPLICATE, null);
    }

    public static WriteResult error(NormalizedRecord record, String errorMessage) {
        return new WriteResult(record, Outcome.ERROR, errorMessage == null ? "unknown error" : errorMessage);
    }

    public NormalizedRecord getRecord() {
        return record;
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public boolean isOk() {
        return outcome == Outcome.OK;
    }

    public Optional<String> getErrorMessage() {
        return Optional.ofNullable(errorMessage);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof WriteResult)) {
            return false;
        }
        WriteResult that = (WriteResult) o;
        return record.equals(that.record)
            && outcome == that.outcome
            && Objects.equals(errorMessage, that.errorMessage);
    }

    @Override
    public int hashCode() {
        return Objects.hash(record, outcome, errorMessage);
    }

    @Override
    public String toString() {
        return "WriteResult{" +
            "record=" + record +
            ", outcome=" + outcome +
            (errorMessage == null ? "" : ", errorMessage='" + errorMessage + '\'') +
            '}';
    }
}
