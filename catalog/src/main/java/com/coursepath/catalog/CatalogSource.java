package com.coursepath.catalog;

import java.util.Map;

/**
 * Supplies one snapshot of a catalog: course id → raw prerequisite text ("" when the course has none).
 * Text spanning several lines means every line is required; each line is read on its own.
 * Where the text comes from (a file, a scraper's output) is up to the implementation.
 */
@FunctionalInterface
public interface CatalogSource {
    Map<String, String> load();
}
