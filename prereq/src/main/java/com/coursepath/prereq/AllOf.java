package com.coursepath.prereq;

import java.util.List;

/** Conjunction. With no children it is trivially satisfied. */
public record AllOf(List<RequirementExpression> children) implements RequirementExpression {
    private static final AllOf NONE = new AllOf(List.of());

    public AllOf {
        children = children == null ? List.of() : List.copyOf(children);
    }

    /** The "no prerequisites" requirement. */
    public static AllOf none() {
        return NONE;
    }

    public static AllOf of(RequirementExpression... children) {
        return new AllOf(List.of(children));
    }

    @Override
    public <R> R accept(RequirementVisitor<R> visitor) {
        return visitor.onAllOf(this);
    }
}
