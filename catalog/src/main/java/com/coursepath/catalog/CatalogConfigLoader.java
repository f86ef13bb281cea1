package com.coursepath.catalog;

import com.coursepath.common.IEnvGetter;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public interface CatalogConfigLoader {

    String DEFAULT_RESOURCE = "coursepath.json";

    /* ------------ Cached Jackson instances (thread-safe) ------------ */
    ObjectMapper JSON = base(new ObjectMapper());
    ObjectReader CONFIG_READER = JSON.readerFor(CatalogConfig.class);

    /* ---------------- Public API ---------------- */

    static CatalogConfig fromJson(InputStream in) throws IOException {
        CatalogConfig cfg = CONFIG_READER.readValue(in);
        return cfg == null ? CatalogConfig.defaults() : cfg;
    }

    static CatalogConfig fromJson(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return fromJson(in);
        }
    }

    static CatalogConfig fromJson(String json) throws IOException {
        try (InputStream in = new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8))) {
            return fromJson(in);
        }
    }

    /** {@value #DEFAULT_RESOURCE} from the classpath, or the defaults when there is none, with environment overrides applied. */
    static CatalogConfig fromClasspath() {
        return fromClasspath(DEFAULT_RESOURCE, IEnvGetter.env);
    }

    static CatalogConfig fromClasspath(String resourceName) {
        return fromClasspath(resourceName, IEnvGetter.env);
    }

    /** The environment wins over the resource: see {@link CatalogConfig#withEnvOverrides(IEnvGetter)}. */
    static CatalogConfig fromClasspath(String resourceName, IEnvGetter env) {
        Logger log = LoggerFactory.getLogger(CatalogConfigLoader.class);
        CatalogConfig cfg;
        try (InputStream in = Resources.tryOpen(resourceName)) {
            if (in == null) {
                log.info("No {} on the classpath; using default catalog configuration", resourceName);
                cfg = CatalogConfig.defaults();
            } else {
                cfg = fromJson(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load catalog configuration " + resourceName, e);
        }
        CatalogConfig effective = cfg.withEnvOverrides(env);
        log.info("Loaded catalog configuration from {}: {}", resourceName, effective);
        return effective;
    }

    /* --------------- Jackson setup (kept internal) --------------- */

    private static ObjectMapper base(ObjectMapper om) {
        return om
                // Open to extension: ignore extra fields in JSON
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)

                // Let record constructors supply defaults
                .configure(DeserializationFeature.FAIL_ON_MISSING_CREATOR_PROPERTIES, false)
                .configure(DeserializationFeature.FAIL_ON_NULL_CREATOR_PROPERTIES, false)

                // No silent coercion of single value -> array
                .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, false)

                // Keep property names case-sensitive
                .configure(MapperFeature.ACCEPT_CASE_INSENSITIVE_PROPERTIES, false)

                // Nice for human-authored JSON files
                .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS.mappedFeature())
                .enable(JsonReadFeature.ALLOW_TRAILING_COMMA.mappedFeature());
    }
}
