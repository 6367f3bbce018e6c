package com.example.attsync.service;

import com.example.attsync.model.NormalizedRecord;
import com.example.attsync.model.WriteResult;

/**
 * Target for the normalized records. Implementations either insert them into the HR
 * database or only preview them.
 */
public interface SinkWriter extends AutoCloseable {

    /**
     * Writes one record. A row-level failure is reported in the result, not thrown.
     *
     * @throws SinkUnavailableException when the sink connection itself is gone
     */
    WriteResult write(NormalizedRecord record);

    @Override
    default void close() {
    }
}
