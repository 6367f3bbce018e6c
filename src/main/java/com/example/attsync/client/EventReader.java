package com.example.attsync.client;

import com.example.attsync.model.RawAttendanceEvent;

import java.time.LocalDate;
import java.util.stream.Stream;

/**
 * Contract used by {@link com.example.attsync.service.SyncService} to read punches.
 */
public interface EventReader {

    /**
     * Punches recorded on days after {@code watermark}, oldest first. The stream is lazy and
     * single-use and must be closed; a new call queries the store again.
     *
     * @throws LegacyStoreException when the query fails, also while the stream is consumed
     */
    Stream<RawAttendanceEvent> fetchSince(LocalDate watermark);
}
