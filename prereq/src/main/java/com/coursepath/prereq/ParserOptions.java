package com.coursepath.prereq;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Tuning for {@link PrerequisiteParser}.
 *
 * @param upperCaseIds  upper-case every course id (catalog keys included)
 * @param cutoffPhrases phrases such as "consent of" that end a line; offered as an alternative they satisfy that
 *                      conjunct, otherwise they waive the whole line
 * @param fillerWords   words dropped before a fragment is read as a course id; matched case-insensitively
 */
public record ParserOptions(boolean upperCaseIds, List<String> cutoffPhrases, Set<String> fillerWords) {

    public static final Set<String> DEFAULT_FILLER_WORDS = Set.of("the", "course", "courses", "either", "both");

    public static final ParserOptions DEFAULT = new ParserOptions(false, List.of(), DEFAULT_FILLER_WORDS);

    public ParserOptions {
        cutoffPhrases = cutoffPhrases == null ? List.of() : cutoffPhrases.stream()
                .filter(p -> p != null && !p.isBlank())
                .map(String::trim)
                .toList();
        fillerWords = fillerWords == null ? DEFAULT_FILLER_WORDS : fillerWords.stream()
                .map(w -> w.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    public ParserOptions withUpperCaseIds(boolean upperCase) {
        return new ParserOptions(upperCase, cutoffPhrases, fillerWords);
    }

    public ParserOptions withCutoffPhrases(List<String> phrases) {
        return new ParserOptions(upperCaseIds, phrases, fillerWords);
    }

    public String normalizeId(String raw) {
        return CourseIds.normalize(raw, upperCaseIds);
    }
}
