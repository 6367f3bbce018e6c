package com.example.attsync.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Where the outcome of a run is published for the dashboard. Disabled by default, in
 * which case the result is only logged.
 */
public class ReportConfig {
    private boolean enabled;
    private String endpoint;
    private String token;
    private String username;
    private String password;
    private Duration requestTimeout = Duration.ofSeconds(10);

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public void setEndpoint(String endpoint) {
        this.endpoint = endpoint;
    }

    public String getToken() {
        return token;
    }

    public void setToken(String token) {
        this.token = token;
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

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }

    public void applyDefaults() {
        if (requestTimeout == null || requestTimeout.isNegative() || requestTimeout.isZero()) {
            requestTimeout = Duration.ofSeconds(10);
        }
    }

    @Override
    public String toString() {
        return "ReportConfig{" +
            "enabled=" + enabled +
            ", endpoint='" + endpoint + '\'' +
            ", username='" + username + '\'' +
            ", requestTimeout=" + requestTimeout +
            '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ReportConfig)) {
            return false;
        }
        ReportConfig that = (ReportConfig) o;
        return enabled == that.enabled
            && Objects.equals(endpoint, that.endpoint)
            && Objects.equals(token, that.token)
            && Objects.equals(username, that.username)
            && Objects.equals(password, that.password)
            && Objects.equals(requestTimeout, that.requestTimeout);
    }

    @Override
    public int hashCode() {
        return Objects.hash(enabled, endpoint, token, username, password, requestTimeout);
    }
}
