package com.example.attsync.config;

import java.util.Objects;

/**
 * Root configuration object that mirrors the structure of the YAML configuration file.
 */
public class ApplicationConfig {
    private LegacyStoreConfig legacy = new LegacyStoreConfig();
    private SinkConfig sink = new SinkConfig();
    private SyncConfig sync = new SyncConfig();
    private ReportConfig report = new ReportConfig();

    public LegacyStoreConfig getLegacy() {
        if (legacy == null) {
            legacy = new LegacyStoreConfig();
        }
        return legacy;
    }

    public void setLegacy(LegacyStoreConfig legacy) {
        this.legacy = legacy;
    }

    public SinkConfig getSink() {
        if (sink == null) {
            sink = new SinkConfig();
        }
        return sink;
    }

    public void setSink(SinkConfig sink) {
        this.sink = sink;
    }

    public SyncConfig getSync() {
        if (sync == null) {
            sync = new SyncConfig();
        }
        return sync;
    }

    public void setSync(SyncConfig sync) {
        this.sync = sync;
    }

    public ReportConfig getReport() {
        if (report == null) {
            report = new ReportConfig();
        }
        return report;
    }

    public void setReport(ReportConfig report) {
        this.report = report;
    }

    /**
     * Apply default values to nested objects. This is invoked after deserialisation
     * to make sure optional sections are still initialised.
     */
    public void applyDefaults() {
        getLegacy().applyDefaults();
        getSink().applyDefaults();
        getSync().applyDefaults();
        getReport().applyDefaults();
    }

    @Override
    public String toString() {
        return "ApplicationConfig{" +
            "legacy=" + getLegacy() +
            ", sink=" + getSink() +
            ", sync=" + getSync() +
            ", report=" + getReport() +
            '}';
    }

    @Override
    public int hashCode() {
        return Objects.hash(getLegacy(), getSink(), getSync(), getReport());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ApplicationConfig)) {
            return false;
        }
        ApplicationConfig that = (ApplicationConfig) o;
        return Objects.equals(getLegacy(), that.getLegacy())
            && Objects.equals(getSink(), that.getSink())
            && Objects.equals(getSync(), that.getSync())
            && Objects.equals(getReport(), that.getReport());
    }
}
