package com.example.attsync.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Objects;

/**
 * Reads the forwarder's YAML file into {@link ApplicationConfig}. Sections and keys that
 * are absent keep their defaults; unknown keys are ignored so one file can be shared with
 * the dashboard.
 */
public class ConfigLoader {
    private static final Logger LOGGER = LoggerFactory.getLogger(ConfigLoader.class);

    /** System property naming the configuration file. */
    public static final String LOCATION_PROPERTY = "config";
    public static final String DEFAULT_LOCATION = "config/application.yaml";

    private final ObjectMapper yaml;

    public ConfigLoader() {
        this.yaml = new ObjectMapper(new YAMLFactory())
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * The file named by {@code -Dconfig}, or {@value #DEFAULT_LOCATION} relative to the
     * working directory.
     */
    public Path location() {
        String configured = System.getProperty(LOCATION_PROPERTY);
        if (configured == null || configured.trim().isEmpty()) {
            return Paths.get(DEFAULT_LOCATION);
        }
        return Paths.get(configured.trim());
    }

    /**
     * Loads {@code path}, or returns the defaults when the file does not exist. A file that
     * exists but cannot be parsed is an error, never silently replaced by defaults.
     */
    public ApplicationConfig loadOrDefaults(Path path) throws IOException {
        Objects.requireNonNull(path, "path");
        if (!Files.exists(path)) {
            LOGGER.warn("Configuration file {} not found, using defaults", path);
            return defaults();
        }
        LOGGER.info("Using configuration at {}", path.toAbsolutePath());
        return load(path);
    }

    public ApplicationConfig load(Path path) throws IOException {
        Objects.requireNonNull(path, "path");
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return withDefaults(yaml.readValue(reader, ApplicationConfig.class));
        } catch (JsonProcessingException ex) {
            throw new IOException("Invalid configuration in " + path + ": " + ex.getOriginalMessage(), ex);
        }
    }

    public ApplicationConfig load(InputStream inputStream) throws IOException {
        Objects.requireNonNull(inputStream, "inputStream");
        return withDefaults(yaml.readValue(inputStream, ApplicationConfig.class));
    }

    public ApplicationConfig defaults() {
        return withDefaults(new ApplicationConfig());
    }

    // a document holding only "~" binds to null
    private static ApplicationConfig withDefaults(ApplicationConfig config) {
        ApplicationConfig result = config == null ? new ApplicationConfig() : config;
        result.applyDefaults();
        return result;
    }
}
