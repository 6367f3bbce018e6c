package com.example.attsync.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;

/**
 * Location of the ZKTeco Access file the terminals write into. The lock directory lives
 * next to that file so every process that touches it can find the same lock.
 */
public class LegacyStoreConfig {
    static final String DEFAULT_LOCK_DIR_NAME = "access_lock";

    private String path;
    private String url;
    private String username;
    private String password;
    private String lockDirName = DEFAULT_LOCK_DIR_NAME;

    public String getPath() {
        return path;
    }

    public void setPath(String path) {
        this.path = path;
    }

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

    public String getLockDirName() {
        return lockDirName;
    }

    public void setLockDirName(String lockDirName) {
        this.lockDirName = lockDirName;
    }

    /**
     * JDBC url for the store: the explicit {@code url} when set, otherwise a UCanAccess url
     * built from {@code path}.
     */
    public String resolveUrl() {
        if (url != null && !url.trim().isEmpty()) {
            return url.trim();
        }
        if (path == null || path.trim().isEmpty()) {
            throw new IllegalStateException("legacy.path or legacy.url must be provided");
        }
        return "jdbc:ucanaccess://" + path.trim() + ";memory=false";
    }

    /**
     * Sibling directory of the store file used as the cross-process lock.
     */
    public Path resolveLockPath() {
        if (path == null || path.trim().isEmpty()) {
            throw new IllegalStateException("legacy.path must be provided to locate the lock directory");
        }
        Path store = Paths.get(path.trim()).toAbsolutePath();
        Path parent = store.getParent();
        return parent == null ? Paths.get(lockDirName) : parent.resolve(lockDirName);
    }

    public void applyDefaults() {
        if (lockDirName == null || lockDirName.trim().isEmpty()) {
            lockDirName = DEFAULT_LOCK_DIR_NAME;
        }
    }

    @Override
    public String toString() {
        return "LegacyStoreConfig{" +
            "path='" + path + '\'' +
            ", url='" + url + '\'' +
            ", username='" + username + '\'' +
            ", lockDirName='" + lockDirName + '\'' +
            '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LegacyStoreConfig)) {
            return false;
        }
        LegacyStoreConfig that = (LegacyStoreConfig) o;
        return Objects.equals(path, that.path)
            && Objects.equals(url, that.url)
            && Objects.equals(username, that.username)
            && Objects.equals(password, that.password)
            && Objects.equals(lockDirName, that.lockDirName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, url, username, password, lockDirName);
    }
}
