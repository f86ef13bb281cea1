package com.coursepath.prereq;

/** One hook per kind of {@link RequirementExpression}. Children are not visited automatically. */
public interface RequirementVisitor<R> {
    R onLeaf(Leaf leaf);

    R onAllOf(AllOf allOf);

    R onAnyOf(AnyOf anyOf);
}
