package com.coursepath.prereq;

import java.util.Locale;
import java.util.regex.Pattern;

/** Course identifier shape and normalisation. */
public final class CourseIds {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    // "CS201", "A", "MATH-101" or a subject followed by a number, "BIOCH 200"
    private static final Pattern SHAPE =
            Pattern.compile("[A-Za-z0-9]+(?:-[A-Za-z0-9]+)?|[A-Za-z]+ [0-9][A-Za-z0-9]*");

    private CourseIds() {}

    /** Trims and collapses internal whitespace; optionally upper-cases. Returns "" for null. */
    public static String normalize(String raw, boolean upperCase) {
        if (raw == null) return "";
        String id = WHITESPACE.matcher(raw.trim()).replaceAll(" ");
        return upperCase ? id.toUpperCase(Locale.ROOT) : id;
    }

    public static boolean isCourseId(String candidate) {
        return candidate != null && SHAPE.matcher(candidate).matches();
    }
}
