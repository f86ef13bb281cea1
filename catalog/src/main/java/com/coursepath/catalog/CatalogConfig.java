package com.coursepath.catalog;

import com.coursepath.common.IEnvGetter;
import com.coursepath.prereq.ParserOptions;

import java.util.List;
import java.util.Set;

/**
 * How catalog text is read. Missing fields take the defaults of {@link ParserOptions#DEFAULT}.
 *
 * @param upperCaseIds  upper-case all course ids
 * @param cutoffPhrases phrases after which prerequisite text is ignored, e.g. "consent of"
 * @param fillerWords   words dropped around course ids
 */
public record CatalogConfig(Boolean upperCaseIds, List<String> cutoffPhrases, Set<String> fillerWords) {

    public static final String UPPERCASE_IDS_ENV = "COURSEPATH_UPPERCASE_IDS";
    public static final String CUTOFF_PHRASES_ENV = "COURSEPATH_CUTOFF_PHRASES";

    public CatalogConfig {
        upperCaseIds = upperCaseIds != null && upperCaseIds;
        cutoffPhrases = cutoffPhrases == null ? List.of() : List.copyOf(cutoffPhrases);
        fillerWords = fillerWords == null ? ParserOptions.DEFAULT_FILLER_WORDS : Set.copyOf(fillerWords);
    }

    public static CatalogConfig defaults() {
        return new CatalogConfig(false, List.of(), null);
    }

    /** Environment values, when set, replace the configured ones. */
    public CatalogConfig withEnvOverrides(IEnvGetter env) {
        return new CatalogConfig(
                IEnvGetter.getBooleanOr(env, UPPERCASE_IDS_ENV, upperCaseIds),
                IEnvGetter.getListOr(env, CUTOFF_PHRASES_ENV, cutoffPhrases),
                fillerWords);
    }

    public ParserOptions toParserOptions() {
        return new ParserOptions(upperCaseIds, cutoffPhrases, fillerWords);
    }
}
