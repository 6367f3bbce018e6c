package com.example.attsync.client;

import com.example.attsync.config.LegacyStoreConfig;
import com.example.attsync.util.ConnectionFactory;

import java.nio.file.Files;
import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Opens the Access file, refusing early when the file is missing so that UCanAccess does
 * not create an empty database in its place.
 */
public class AccessConnectionFactory implements ConnectionFactory {
    private final LegacyStoreConfig config;
    private final ConnectionFactory delegate;

    public AccessConnectionFactory(LegacyStoreConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.delegate = ConnectionFactory.forUrl(config.resolveUrl(), config.getUsername(), config.getPassword());
    }

    @Override
    public Connection open() throws SQLException {
        boolean explicitUrl = config.getUrl() != null && !config.getUrl().trim().isEmpty();
        if (!explicitUrl && !Files.isRegularFile(Paths.get(config.getPath().trim()))) {
            throw new SQLException("Could not find Access database file " + config.getPath(), "08001");
        }
        return delegate.open();
    }
}
