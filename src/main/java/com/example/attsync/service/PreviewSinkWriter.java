package com.example.attsync.service;

import com.example.attsync.model.NormalizedRecord;
import com.example.attsync.model.WriteResult;
import com.example.attsync.util.JsonSupport;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dry-run sink: logs what would have been inserted and touches no database.
 */
public class PreviewSinkWriter implements SinkWriter {
    private static final Logger LOGGER = LoggerFactory.getLogger(PreviewSinkWriter.class);

    @Override
    public WriteResult write(NormalizedRecord record) {
        LOGGER.info("PREVIEW {}", toJson(record));
        return WriteResult.ok(record);
    }

    String toJson(NormalizedRecord record) {
        try {
            return JsonSupport.MAPPER.writeValueAsString(record);
        } catch (JsonProcessingException ex) {
            LOGGER.warn("Failed to serialise record, falling back to toString", ex);
            return record.toString();
        }
    }
}
