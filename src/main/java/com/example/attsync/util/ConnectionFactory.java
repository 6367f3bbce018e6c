package com.example.attsync.util;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Opens a fresh JDBC connection for one run. The caller owns and closes it.
 */
@FunctionalInterface
public interface ConnectionFactory {

    Connection open() throws SQLException;

    static ConnectionFactory forUrl(String url, String username, String password) {
        Objects.requireNonNull(url, "url");
        if (username == null) {
            return () -> DriverManager.getConnection(url);
        }
        return () -> DriverManager.getConnection(url, username, password);
    }
}
