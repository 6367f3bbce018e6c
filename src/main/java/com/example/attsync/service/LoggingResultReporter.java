package com.example.attsync.service;

import com.example.attsync.model.RunOutcome;
import com.example.attsync.model.RunResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes the run summary to the log.
 */
public class LoggingResultReporter implements ResultReporter {
    private static final Logger LOGGER = LoggerFactory.getLogger(LoggingResultReporter.class);

    @Override
    public void report(RunResult result) {
        if (result.getOutcome() == RunOutcome.ABORTED) {
            LOGGER.error("Run aborted: {} (read={}, written={}, failed={})",
                result.getErrorMessage(), result.getRead(), result.getWritten(), result.getFailed());
            return;
        }
        LOGGER.info("Run {}: read={} dropped={} written={} failed={} skippedExisting={}{}",
            result.getOutcome(), result.getRead(), result.getDropped(), result.getWritten(),
            result.getFailed(), result.getSkippedExisting(), result.isDryRun() ? " (dry run)" : "");
    }
}
