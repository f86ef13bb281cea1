package com.coursepath.common;

import java.util.Arrays;
import java.util.List;

/**
 * Abstraction for reading environment variables.
 * <p>
 * Used to avoid direct calls to {@link System#getenv(String)} in code,
 * so that unit tests can provide their own environment source.
 */
@FunctionalInterface
public interface IEnvGetter {
    /**
     * Default implementation backed by {@link System#getenv(String)}.
     */
    IEnvGetter env = System::getenv;

    /**
     * Returns the value of the given environment variable, or {@code null} if unset.
     */
    String get(String name);

    /**
     * Only the case-insensitive string "true" is considered true; everything else is false.
     */
    static boolean getBooleanOr(IEnvGetter env, String name, boolean defaultValue) {
        String value = env.get(name);
        return (value != null && !value.isBlank()) ? Boolean.parseBoolean(value.trim()) : defaultValue;
    }

    /** Comma separated list; entries are trimmed and empty entries dropped. */
    static List<String> getListOr(IEnvGetter env, String name, List<String> defaultValue) {
        String value = env.get(name);
        if (value == null || value.isBlank()) return defaultValue;
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
