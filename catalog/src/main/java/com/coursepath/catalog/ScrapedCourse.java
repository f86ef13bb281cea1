package com.coursepath.catalog;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** One course entry of the scraper's output. Either text may be null. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ScrapedCourse(String prereq, String coreq) {
}
