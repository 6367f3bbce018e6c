package com.example.attsync.service;

import com.example.attsync.model.RunResult;

/**
 * Publishes the outcome of a run to whoever monitors it.
 */
public interface ResultReporter {
    void report(RunResult result);
}
