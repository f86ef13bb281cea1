package com.coursepath.dag;

import com.coursepath.prereq.AllOf;
import com.coursepath.prereq.AnyOf;
import com.coursepath.prereq.Leaf;
import com.coursepath.prereq.RequirementExpression;
import com.coursepath.prereq.RequirementVisitor;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Decides which courses a student may take next. Pure: neither the graph nor the completed set is modified.
 * Completed ids that are not in the graph (transfer credit) are simply never matched.
 */
public final class EligibilityEvaluator {

    private EligibilityEvaluator() {}

    /** Courses not yet completed whose requirement holds, ascending. */
    public static SortedSet<String> eligibleCourses(DependencyGraph graph, Set<String> completed) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(completed, "completed");
        SortedSet<String> out = new TreeSet<>();
        for (CourseNode node : graph.nodes().values()) {
            if (completed.contains(node.id())) continue;
            if (evaluate(node.requirement(), completed)) out.add(node.id());
        }
        return Collections.unmodifiableSortedSet(out);
    }

    /**
     * @throws InvalidExpressionException when an empty one-of is reached
     */
    public static boolean evaluate(RequirementExpression requirement, Set<String> completed) {
        return requirement.accept(new Satisfied(completed));
    }

    /**
     * @throws IllegalArgumentException if the course is not in the graph
     */
    public static Eligibility explain(DependencyGraph graph, String courseId, Set<String> completed) {
        CourseNode node = graph.node(courseId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown course " + courseId));
        RequirementExpression requirement = node.requirement();
        List<RequirementExpression> parts = requirement instanceof AllOf all ? all.children() : List.of(requirement);
        List<RequirementExpression> unmet = parts.stream().filter(p -> !evaluate(p, completed)).toList();
        boolean done = completed.contains(courseId);
        return new Eligibility(courseId, !done && unmet.isEmpty(), done, unmet);
    }

    private record Satisfied(Set<String> completed) implements RequirementVisitor<Boolean> {
        @Override
        public Boolean onLeaf(Leaf leaf) {
            return completed.contains(leaf.courseId());
        }

        @Override
        public Boolean onAllOf(AllOf allOf) {
            for (RequirementExpression c : allOf.children()) if (!c.accept(this)) return false;
            return true;
        }

        @Override
        public Boolean onAnyOf(AnyOf anyOf) {
            if (anyOf.children().isEmpty()) throw new InvalidExpressionException("one-of requirement has no alternatives");
            for (RequirementExpression c : anyOf.children()) if (c.accept(this)) return true;
            return false;
        }
    }
}
