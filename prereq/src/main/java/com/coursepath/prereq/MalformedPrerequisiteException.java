package com.coursepath.prereq;

/** Prerequisite text that the and / one-of / or grammar cannot read. Names the offending fragment. */
public final class MalformedPrerequisiteException extends RuntimeException {
    private final String fragment;
    private final String reason;

    public MalformedPrerequisiteException(String fragment, String reason) {
        super(reason + ": '" + fragment + "'");
        this.fragment = fragment;
        this.reason = reason;
    }

    public String fragment() { return fragment; }

    public String reason() { return reason; }
}
