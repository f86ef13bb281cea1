package com.coursepath.dag;

import com.coursepath.prereq.MalformedPrerequisiteException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Every problem found in a catalog in one pass: prerequisite texts that could not be parsed, and course ids
 * that are referenced but not defined. Thrown only after the whole catalog has been checked.
 */
public final class CatalogValidationException extends RuntimeException {
    private final SortedMap<String, MalformedPrerequisiteException> malformedPrerequisites;
    private final SortedMap<String, SortedSet<String>> unknownCourseReferences;

    public CatalogValidationException(Map<String, MalformedPrerequisiteException> malformedPrerequisites,
                                      Map<String, ? extends SortedSet<String>> unknownCourseReferences) {
        super(summary(malformedPrerequisites, unknownCourseReferences));
        this.malformedPrerequisites = Collections.unmodifiableSortedMap(new TreeMap<>(malformedPrerequisites));
        SortedMap<String, SortedSet<String>> unknown = new TreeMap<>();
        unknownCourseReferences.forEach((id, refs) -> unknown.put(id, Collections.unmodifiableSortedSet(new TreeSet<>(refs))));
        this.unknownCourseReferences = Collections.unmodifiableSortedMap(unknown);
    }

    /** Course id → why its prerequisite text was rejected. */
    public SortedMap<String, MalformedPrerequisiteException> malformedPrerequisites() {
        return malformedPrerequisites;
    }

    /** Undefined course id → the courses whose requirement names it. */
    public SortedMap<String, SortedSet<String>> unknownCourseReferences() {
        return unknownCourseReferences;
    }

    public SortedSet<String> unknownCourseIds() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(unknownCourseReferences.keySet()));
    }

    /** One line per problem, malformed texts first. */
    public List<String> messages() {
        return messages(malformedPrerequisites, unknownCourseReferences);
    }

    private static List<String> messages(Map<String, MalformedPrerequisiteException> malformed,
                                         Map<String, ? extends SortedSet<String>> unknown) {
        List<String> out = new ArrayList<>();
        new TreeMap<>(malformed).forEach((course, e) -> out.add("Malformed prerequisite for " + course + ": " + e.getMessage()));
        new TreeMap<>(unknown).forEach((id, refs) -> out.add("Unknown course reference " + id + " (required by " + String.join(", ", refs) + ")"));
        return out;
    }

    private static String summary(Map<String, MalformedPrerequisiteException> malformed,
                                  Map<String, ? extends SortedSet<String>> unknown) {
        return "Catalog has " + malformed.size() + " malformed prerequisite(s) and "
                + unknown.size() + " unknown course reference(s)\n" + String.join("\n", messages(malformed, unknown));
    }
}
