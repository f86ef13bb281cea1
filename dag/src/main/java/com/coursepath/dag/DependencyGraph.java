package com.coursepath.dag;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Immutable dependency graph: courses keyed by id plus the (course → prerequisite) edges derived from their
 * requirements. Every course a requirement names is a node, and {@code edges} is exactly one edge per distinct
 * referenced course. Safe to share between threads.
 */
public record DependencyGraph(SortedMap<String, CourseNode> nodes, Set<Edge> edges) {
    public DependencyGraph {
        nodes = Collections.unmodifiableSortedMap(new TreeMap<>(nodes));
        edges = Collections.unmodifiableSet(new LinkedHashSet<>(edges));
        for (Map.Entry<String, CourseNode> e : nodes.entrySet()) {
            if (!e.getKey().equals(e.getValue().id())) {
                throw new IllegalArgumentException("Node keyed " + e.getKey() + " has id " + e.getValue().id());
            }
        }
        Set<Edge> derived = derivedEdges(nodes);
        if (!derived.equals(edges)) {
            throw new IllegalArgumentException("Edges " + edges + " do not match the course requirements " + derived);
        }
    }

    /** Builds the graph, deriving one edge per distinct course referenced by each requirement. */
    public static DependencyGraph of(Collection<CourseNode> courses) {
        SortedMap<String, CourseNode> byId = new TreeMap<>();
        for (CourseNode c : courses) {
            if (byId.putIfAbsent(c.id(), c) != null) {
                throw new IllegalArgumentException("Duplicate course " + c.id());
            }
        }
        return new DependencyGraph(byId, derivedEdges(byId));
    }

    private static Set<Edge> derivedEdges(Map<String, CourseNode> nodes) {
        Set<Edge> out = new LinkedHashSet<>();
        for (CourseNode c : nodes.values()) {
            for (String prerequisite : c.requirement().leaves()) {
                if (!nodes.containsKey(prerequisite)) {
                    throw new IllegalArgumentException("Course " + c.id() + " requires " + prerequisite
                            + ", which is not in the graph");
                }
                out.add(new Edge(c.id(), prerequisite));
            }
        }
        return out;
    }

    public int size() {
        return nodes.size();
    }

    public boolean contains(String courseId) {
        return nodes.containsKey(courseId);
    }

    public Optional<CourseNode> node(String courseId) {
        return Optional.ofNullable(nodes.get(courseId));
    }

    public Set<String> courseIds() {
        return nodes.keySet();
    }

    /** Courses named in the requirement of {@code courseId}, ascending. */
    public SortedSet<String> dependenciesOf(String courseId) {
        CourseNode n = nodes.get(courseId);
        if (n == null) throw new IllegalArgumentException("Unknown course " + courseId);
        return Collections.unmodifiableSortedSet(new TreeSet<>(n.requirement().leaves()));
    }

    /** Courses whose requirement mentions {@code courseId}, ascending. */
    public SortedSet<String> dependentsOf(String courseId) {
        if (!nodes.containsKey(courseId)) throw new IllegalArgumentException("Unknown course " + courseId);
        SortedSet<String> out = new TreeSet<>();
        for (Edge e : edges) if (e.to().equals(courseId)) out.add(e.from());
        return Collections.unmodifiableSortedSet(out);
    }
}
