package com.coursepath.catalog;

import com.coursepath.dag.DependencyGraph;
import com.coursepath.dag.DependencyGraphBuilder;
import com.coursepath.dag.Eligibility;
import com.coursepath.dag.EligibilityEvaluator;
import com.coursepath.dag.Topo;
import com.coursepath.prereq.ParserOptions;
import com.coursepath.prereq.PrerequisiteParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;

/**
 * A loaded catalog snapshot and the queries over it. Course ids passed in are normalised with the same options
 * as the catalog itself, so "cs 201 " finds "CS 201" when ids are upper-cased.
 * <p>
 * Immutable; queries may run concurrently.
 */
public final class CourseCatalog {
    private static final Logger log = LoggerFactory.getLogger(CourseCatalog.class);

    private final ParserOptions options;
    private final DependencyGraph graph;

    private CourseCatalog(ParserOptions options, DependencyGraph graph) {
        this.options = options;
        this.graph = graph;
    }

    /**
     * @throws com.coursepath.dag.CatalogValidationException if any entry is malformed or refers to an unknown course
     */
    public static CourseCatalog load(CatalogSource source, CatalogConfig config) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(config, "config");
        return of(source.load(), config.toParserOptions());
    }

    public static CourseCatalog of(Map<String, String> entries, ParserOptions options) {
        DependencyGraph graph = new DependencyGraphBuilder(new PrerequisiteParser(options)).build(entries);
        return new CourseCatalog(options, graph);
    }

    public DependencyGraph graph() {
        return graph;
    }

    /** @throws com.coursepath.dag.CycleDetectedException if the catalog is circular */
    public List<String> topologicalOrder() {
        return Topo.topologicalOrder(graph);
    }

    /** @throws com.coursepath.dag.CycleDetectedException if the catalog is circular */
    public List<SortedSet<String>> semesters() {
        return Topo.generations(graph);
    }

    public SortedSet<String> eligibleCourses(Collection<String> completed) {
        Set<String> done = normalize(completed);
        SortedSet<String> eligible = EligibilityEvaluator.eligibleCourses(graph, done);
        log.debug("{} completed course(s) make {} course(s) eligible", done.size(), eligible.size());
        return eligible;
    }

    /** @throws IllegalArgumentException if the course is not in the catalog */
    public Eligibility explain(String courseId, Collection<String> completed) {
        return EligibilityEvaluator.explain(graph, options.normalizeId(courseId), normalize(completed));
    }

    private Set<String> normalize(Collection<String> ids) {
        Set<String> out = new LinkedHashSet<>();
        for (String id : ids) {
            String n = options.normalizeId(id);
            if (!n.isEmpty()) out.add(n);
        }
        return out;
    }
}
