package com.coursepath.catalog;

import com.coursepath.common.codec.JacksonTypedJsonCodec;
import com.coursepath.common.errorsor.ErrorsOr;
import com.fasterxml.jackson.core.type.TypeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Reads the catalog scraper's JSON, {@code {faculty: {department: {course: {"prereq": ..., "coreq": ...}}}}},
 * as a {@link CatalogSource}. Corequisites are not part of the prerequisite graph and are ignored.
 * A course listed under several departments keeps each distinct text as its own line, so all of them are required.
 */
public final class ScrapedCatalogSource implements CatalogSource {
    private static final Logger log = LoggerFactory.getLogger(ScrapedCatalogSource.class);

    private static final JacksonTypedJsonCodec<Map<String, Map<String, Map<String, ScrapedCourse>>>> CODEC =
            new JacksonTypedJsonCodec<>(CatalogConfigLoader.JSON,
                    new TypeReference<Map<String, Map<String, Map<String, ScrapedCourse>>>>() {});

    private final String json;
    private final String description;

    private ScrapedCatalogSource(String json, String description) {
        this.json = Objects.requireNonNull(json, "json");
        this.description = description;
    }

    public static ScrapedCatalogSource fromJson(String json) {
        return new ScrapedCatalogSource(json, "inline JSON");
    }

    public static ScrapedCatalogSource fromPath(Path path) {
        try {
            return new ScrapedCatalogSource(Files.readString(path, StandardCharsets.UTF_8), path.toString());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read scraped catalog " + path, e);
        }
    }

    public static ScrapedCatalogSource fromResource(String resourceName) {
        try (InputStream in = Resources.open(resourceName)) {
            return new ScrapedCatalogSource(new String(in.readAllBytes(), StandardCharsets.UTF_8), resourceName);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read scraped catalog " + resourceName, e);
        }
    }

    /**
     * @throws IllegalArgumentException if the JSON does not have the scraper's shape
     */
    @Override
    public Map<String, String> load() {
        ErrorsOr<Map<String, Map<String, Map<String, ScrapedCourse>>>> decoded = CODEC.decode(json);
        Map<String, Map<String, Map<String, ScrapedCourse>>> faculties = decoded.getValue().orElseThrow(() ->
                new IllegalArgumentException("Invalid scraped catalog " + description + ": " + decoded.getErrors()));

        Map<String, String> out = new LinkedHashMap<>();
        faculties.forEach((faculty, departments) -> {
            if (departments == null) return;
            departments.forEach((department, courses) -> {
                if (courses == null) return;
                courses.forEach((course, info) -> {
                    String text = info == null || info.prereq() == null ? "" : info.prereq().trim();
                    out.merge(course.trim(), text, ScrapedCatalogSource::mergeCrossListed);
                });
            });
        });
        log.info("Read {} course(s) from {} faculties in {}", out.size(), faculties.size(), description);
        return out;
    }

    private static String mergeCrossListed(String first, String second) {
        if (second.isBlank() || first.lines().anyMatch(second::equals)) return first;
        if (first.isBlank()) return second;
        return first + "\n" + second;
    }
}
