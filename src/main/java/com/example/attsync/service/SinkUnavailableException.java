package com.example.attsync.service;

/**
 * The HR database cannot be reached. Raised before the first write when the connection
 * cannot be opened, or mid-run when the connection drops.
 */
public class SinkUnavailableException extends RuntimeException {

    public SinkUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
