package com.coursepath.dag;

import com.coursepath.common.errorsor.ErrorsOr;
import com.coursepath.prereq.CourseIds;
import com.coursepath.prereq.MalformedPrerequisiteException;
import com.coursepath.prereq.PrerequisiteParser;
import com.coursepath.prereq.RequirementExpression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/** Parses a whole catalog snapshot (course id → raw prerequisite text) into a {@link DependencyGraph}. */
public final class DependencyGraphBuilder {
    private static final Logger log = LoggerFactory.getLogger(DependencyGraphBuilder.class);

    private final PrerequisiteParser parser;

    public DependencyGraphBuilder() {
        this(new PrerequisiteParser());
    }

    public DependencyGraphBuilder(PrerequisiteParser parser) {
        this.parser = Objects.requireNonNull(parser, "parser");
    }

    /**
     * @throws CatalogValidationException listing every malformed entry and every unknown course reference
     */
    public DependencyGraph build(Map<String, String> entries) {
        Objects.requireNonNull(entries, "entries");

        // normalised id -> raw keys; several raw keys may collapse onto one id
        SortedMap<String, List<String>> rawKeys = new TreeMap<>();
        for (String key : entries.keySet()) {
            rawKeys.computeIfAbsent(parser.options().normalizeId(key), k -> new ArrayList<>()).add(key);
        }

        SortedMap<String, RequirementExpression> parsed = new TreeMap<>();
        SortedMap<String, MalformedPrerequisiteException> malformed = new TreeMap<>();
        for (Map.Entry<String, List<String>> e : rawKeys.entrySet()) {
            String id = e.getKey();
            List<String> keys = e.getValue();
            if (id.isEmpty()) {
                malformed.put(String.valueOf(keys), new MalformedPrerequisiteException(String.valueOf(keys), "blank course id"));
            } else if (keys.size() > 1) {
                malformed.put(id, new MalformedPrerequisiteException(String.join(" | ", keys), "duplicate course id"));
            } else if (!CourseIds.isCourseId(id)) {
                malformed.put(id, new MalformedPrerequisiteException(keys.get(0), "not a course identifier"));
            } else {
                try {
                    parsed.put(id, parser.parse(entries.get(keys.get(0))).normalize());
                } catch (MalformedPrerequisiteException ex) {
                    log.debug("Course {} has malformed prerequisite: {}", id, ex.getMessage());
                    malformed.put(id, ex);
                }
            }
        }

        SortedMap<String, SortedSet<String>> unknown = new TreeMap<>();
        for (Map.Entry<String, RequirementExpression> e : parsed.entrySet()) {
            for (String ref : e.getValue().leaves()) {
                if (!rawKeys.containsKey(ref)) {
                    log.debug("Course {} requires unknown course {}", e.getKey(), ref);
                    unknown.computeIfAbsent(ref, k -> new TreeSet<>()).add(e.getKey());
                }
            }
        }

        if (!malformed.isEmpty() || !unknown.isEmpty()) {
            log.warn("Catalog of {} course(s) rejected: {} malformed prerequisite(s), {} unknown course reference(s)",
                    entries.size(), malformed.size(), unknown.size());
            throw new CatalogValidationException(malformed, unknown);
        }

        List<CourseNode> nodes = new ArrayList<>(parsed.size());
        parsed.forEach((id, requirement) -> nodes.add(new CourseNode(id, requirement)));
        DependencyGraph graph = DependencyGraph.of(nodes);
        log.info("Built dependency graph with {} course(s) and {} edge(s)", graph.size(), graph.edges().size());
        return graph;
    }

    /** As {@link #build(Map)} with the problems returned as messages instead of thrown. */
    public ErrorsOr<DependencyGraph> validate(Map<String, String> entries) {
        try {
            return ErrorsOr.lift(build(entries));
        } catch (CatalogValidationException e) {
            return ErrorsOr.errors(e.messages());
        }
    }
}
