package com.coursepath.prereq;

import java.util.Objects;

/** A single required course. */
public record Leaf(String courseId) implements RequirementExpression {
    public Leaf {
        Objects.requireNonNull(courseId, "courseId");
        if (courseId.isBlank()) throw new IllegalArgumentException("courseId must not be blank");
    }

    @Override
    public <R> R accept(RequirementVisitor<R> visitor) {
        return visitor.onLeaf(this);
    }
}
