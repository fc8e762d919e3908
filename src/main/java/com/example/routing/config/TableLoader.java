package com.example.routing.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * Reads a YAML table from an override path when it exists, otherwise from the
 * classpath default.
 */
public final class TableLoader {

    private static final Logger log = LoggerFactory.getLogger(TableLoader.class);
    private static final ObjectMapper yaml = new ObjectMapper(new YAMLFactory())
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private TableLoader() {}

    public static <T> T load(String overridePath, String classpathResource, Class<T> type) {
        try (InputStream stream = open(overridePath, classpathResource)) {
            return yaml.readValue(stream, type);
        } catch (IOException e) {
            String source = hasOverride(overridePath) ? overridePath : "classpath:" + classpathResource;
            throw new RuleLoadException("Failed to load table from " + source + ": " + e.getMessage(), e);
        }
    }

    private static InputStream open(String overridePath, String classpathResource) throws IOException {
        if (hasOverride(overridePath)) {
            log.info("Loading {} from {}", classpathResource, overridePath);
            return Files.newInputStream(Path.of(overridePath));
        }
        InputStream stream = TableLoader.class.getClassLoader().getResourceAsStream(classpathResource);
        if (stream == null) {
            throw new IOException("classpath resource not found: " + classpathResource);
        }
        log.info("Loading {} from classpath", classpathResource);
        return stream;
    }

    private static boolean hasOverride(String overridePath) {
        return overridePath != null && !overridePath.isBlank() && Files.exists(Path.of(overridePath));
    }
}
