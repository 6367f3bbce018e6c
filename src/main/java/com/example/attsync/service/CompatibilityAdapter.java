package com.example.attsync.service;

import com.example.attsync.model.NormalizedRecord;
import com.example.attsync.model.WriteResult;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.Objects;

/**
 * Old-style insert surface for call sites written against the PHP {@code mysql_query}
 * shim: the connection is bound once and never passed, an insert returns an affected-row
 * count, and the failure reason is fetched separately through {@link #lastError()}.
 *
 * <p>Every call is routed to the same {@link SinkWriter} the pipeline uses, so the values
 * still travel as bound parameters.
 */
public final class CompatibilityAdapter {
    /** Returned instead of a row count when the insert failed. */
    public static final int FAILED = -1;

    private final SinkWriter writer;
    private String lastError = "";

    public CompatibilityAdapter(SinkWriter writer) {
        this.writer = Objects.requireNonNull(writer, "writer");
    }

    /**
     * Inserts a row given as the text values legacy callers build.
     *
     * @return 1 when inserted, 0 when an identical row already existed, {@link #FAILED} on error
     */
    public int insert(String logDate, String badgeId, String logTime, String door, String deviceTag) {
        if (logDate == null || logTime == null || badgeId == null) {
            lastError = "Invalid row values: logDate, logTime and badgeId are required";
            return FAILED;
        }
        NormalizedRecord record;
        try {
            record = new NormalizedRecord(
                LocalDate.parse(logDate.trim()),
                LocalTime.parse(logTime.trim()),
                badgeId.trim(),
                door,
                deviceTag,
                null);
        } catch (DateTimeParseException ex) {
            lastError = "Invalid row values: " + ex.getMessage();
            return FAILED;
        }
        return insert(record);
    }

    /**
     * Inserts an already normalized record. Badges the pipeline would drop are refused here too.
     */
    public int insert(NormalizedRecord record) {
        Objects.requireNonNull(record, "record");
        if (!EventTransformer.isForwardable(record.getBadgeId())) {
            lastError = "Invalid badge '" + record.getBadgeId() + "': expected 1 to "
                + EventTransformer.MAX_BADGE_LENGTH + " characters";
            return FAILED;
        }
        WriteResult result;
        try {
            result = writer.write(record);
        } catch (SinkUnavailableException ex) {
            lastError = ex.getMessage();
            return FAILED;
        }
        switch (result.getOutcome()) {
            case OK:
                lastError = "";
                return 1;
            case DUPLICATE:
                lastError = "";
                return 0;
            default:
                lastError = result.getErrorMessage().orElse("unknown error");
                return FAILED;
        }
    }

    /**
     * Message of the most recent failed insert, empty after a successful one.
     */
    public String lastError() {
        return lastError;
    }
}
