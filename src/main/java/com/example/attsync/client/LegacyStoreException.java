package com.example.attsync.client;

/**
 * The Access store could not be opened or queried. Always fatal for the current run.
 */
public class LegacyStoreException extends RuntimeException {

    public enum Kind {
        CONNECTION,
        QUERY
    }

    private final Kind kind;

    public LegacyStoreException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
