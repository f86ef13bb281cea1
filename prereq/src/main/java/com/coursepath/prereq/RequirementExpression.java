package com.coursepath.prereq;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Boolean requirement tree for one course: a single course, all of a list, or any of a list.
 * <p>
 * Instances are immutable. An {@link AllOf} without children means "no prerequisites".
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Leaf.class, name = "leaf"),
        @JsonSubTypes.Type(value = AllOf.class, name = "allOf"),
        @JsonSubTypes.Type(value = AnyOf.class, name = "anyOf"),
})
public sealed interface RequirementExpression permits Leaf, AllOf, AnyOf {

    <R> R accept(RequirementVisitor<R> visitor);

    /** Course ids referenced anywhere in the tree, in first-seen order. */
    default Set<String> leaves() {
        Set<String> out = new LinkedHashSet<>();
        accept(new RequirementVisitor<Void>() {
            @Override public Void onLeaf(Leaf leaf) { out.add(leaf.courseId()); return null; }
            @Override public Void onAllOf(AllOf allOf) { allOf.children().forEach(c -> c.accept(this)); return null; }
            @Override public Void onAnyOf(AnyOf anyOf) { anyOf.children().forEach(c -> c.accept(this)); return null; }
        });
        return out;
    }

    /**
     * Flattens same-kind nesting, removes duplicate children and unwraps single-child groups.
     * An empty AllOf stays empty; an empty AnyOf is left for the evaluator to reject.
     */
    default RequirementExpression normalize() {
        return accept(new RequirementVisitor<RequirementExpression>() {
            @Override public RequirementExpression onLeaf(Leaf leaf) { return leaf; }

            @Override public RequirementExpression onAllOf(AllOf allOf) {
                List<RequirementExpression> children = flatten(allOf.children(), AllOf.class, this);
                return children.size() == 1 ? children.get(0) : new AllOf(children);
            }

            @Override public RequirementExpression onAnyOf(AnyOf anyOf) {
                List<RequirementExpression> children = flatten(anyOf.children(), AnyOf.class, this);
                return children.size() == 1 ? children.get(0) : new AnyOf(children);
            }
        });
    }

    /** Human readable form, e.g. {@code CS201 and one of (CS301 or CS302)}. */
    default String describe() {
        return accept(new RequirementVisitor<String>() {
            @Override public String onLeaf(Leaf leaf) { return leaf.courseId(); }

            @Override public String onAllOf(AllOf allOf) {
                if (allOf.children().isEmpty()) return "none";
                List<String> parts = new ArrayList<>();
                for (RequirementExpression c : allOf.children()) {
                    String d = c.accept(this);
                    parts.add(c instanceof AllOf && allOf.children().size() > 1 ? "(" + d + ")" : d);
                }
                return String.join(" and ", parts);
            }

            @Override public String onAnyOf(AnyOf anyOf) {
                List<String> parts = new ArrayList<>();
                for (RequirementExpression c : anyOf.children()) {
                    String d = c.accept(this);
                    parts.add(c instanceof Leaf ? d : "(" + d + ")");
                }
                return "one of (" + String.join(" or ", parts) + ")";
            }
        });
    }

    private static List<RequirementExpression> flatten(List<RequirementExpression> children,
                                                       Class<? extends RequirementExpression> sameKind,
                                                       RequirementVisitor<RequirementExpression> normalizer) {
        Set<RequirementExpression> out = new LinkedHashSet<>();
        for (RequirementExpression child : children) {
            RequirementExpression n = child.accept(normalizer);
            if (sameKind.isInstance(n)) out.addAll(childrenOf(n));
            else out.add(n);
        }
        return List.copyOf(out);
    }

    private static List<RequirementExpression> childrenOf(RequirementExpression group) {
        if (group instanceof AllOf a) return a.children();
        if (group instanceof AnyOf a) return a.children();
        return List.of(group);
    }
}
