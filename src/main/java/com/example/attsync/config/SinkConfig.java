package com.example.attsync.config;

import java.util.Objects;

/**
 * Connection settings of the HR database that receives the forwarded punches.
 */
public class SinkConfig {
    static final String DEFAULT_TABLE = "att_raw_data";

    private String url;
    private String username;
    private String password;
    private String table = DEFAULT_TABLE;
    private boolean skipExisting;

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    public String getTable() {
        return table;
    }

    public void setTable(String table) {
        this.table = table;
    }

    /**
     * When set, every insert is preceded by a lookup of an identical row and skipped if
     * one exists. Off by default: the sink table carries no unique key.
     */
    public boolean isSkipExisting() {
        return skipExisting;
    }

    public void setSkipExisting(boolean skipExisting) {
        this.skipExisting = skipExisting;
    }

    public void applyDefaults() {
        if (table == null || table.trim().isEmpty()) {
            table = DEFAULT_TABLE;
        }
    }

    @Override
    public String toString() {
        return "SinkConfig{" +
            "url='" + url + '\'' +
            ", username='" + username + '\'' +
            ", table='" + table + '\'' +
            ", skipExisting=" + skipExisting +
            '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SinkConfig)) {
            return false;
        }
        SinkConfig that = (SinkConfig) o;
        return skipExisting == that.skipExisting
            && Objects.equals(url, that.url)
            && Objects.equals(username, that.username)
            && Objects.equals(password, that.password)
            && Objects.equals(table, that.table);
    }

    @Override
    public int hashCode() {
        return Objects.hash(url, username, password, table, skipExisting);
    }
}
