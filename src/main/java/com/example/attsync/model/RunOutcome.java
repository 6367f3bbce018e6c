package com.example.attsync.model;

/**
 * Final state of a forwarding run as seen by the scheduler and the dashboard.
 */
public enum RunOutcome {
    /** Every fetched row was either written or dropped by validation. */
    SUCCESS,
    /** At least one row failed to insert; the rest of the batch still went through. */
    PARTIAL_FAILURE,
    /** A connection or query failure stopped the run. */
    ABORTED,
    /** Another process held the store lock for longer than the lock timeout. */
    SKIPPED_BUSY
}
