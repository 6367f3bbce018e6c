package com.example.attsync.service;

/**
 * Progress of a run through the lock protocol.
 */
public enum RunState {
    IDLE,
    LOCK_REQUESTED,
    LOCKED_READING,
    LOCKED_WRITING,
    RELEASED
}
