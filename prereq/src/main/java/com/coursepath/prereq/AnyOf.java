package com.coursepath.prereq;

import java.util.List;

/**
 * Disjunction. The parser never produces one without children; an empty AnyOf is rejected when evaluated.
 */
public record AnyOf(List<RequirementExpression> children) implements RequirementExpression {
    public AnyOf {
        children = children == null ? List.of() : List.copyOf(children);
    }

    public static AnyOf of(RequirementExpression... children) {
        return new AnyOf(List.of(children));
    }

    @Override
    public <R> R accept(RequirementVisitor<R> visitor) {
        return visitor.onAnyOf(this);
    }
}
