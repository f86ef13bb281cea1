package com.coursepath.catalog;

import java.util.Objects;

/** One record of a prerequisite file: {@code COURSE : prerequisite text}. */
public record CatalogLine(String courseId, String prerequisites) {
    public CatalogLine {
        Objects.requireNonNull(courseId, "courseId");
        prerequisites = prerequisites == null ? "" : prerequisites;
    }
}
