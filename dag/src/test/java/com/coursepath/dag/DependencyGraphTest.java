package com.coursepath.dag;

import com.coursepath.prereq.AllOf;
import com.coursepath.prereq.Leaf;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import static com.coursepath.dag.TestCatalogFixture.*;
import static org.junit.jupiter.api.Assertions.*;

class DependencyGraphTest {

    @Test
    void dependenciesAndDependentsAreSorted() {
        DependencyGraph g = build(CS_TRACK);
        assertEquals(List.of("CS201", "CS301", "CS302"), List.copyOf(g.dependenciesOf("CS401")));
        assertEquals(List.of("CS301", "CS302", "CS401"), List.copyOf(g.dependentsOf("CS201")));
        assertTrue(g.dependentsOf("CS401").isEmpty());
        assertTrue(g.dependenciesOf("CS101").isEmpty());
    }

    @Test
    void unknownCourseIsRejected() {
        DependencyGraph g = build(DIAMOND);
        assertThrows(IllegalArgumentException.class, () -> g.dependenciesOf("Z"));
        assertThrows(IllegalArgumentException.class, () -> g.dependentsOf("Z"));
        assertTrue(g.node("Z").isEmpty());
        assertFalse(g.contains("Z"));
    }

    @Test
    void edgeToMissingNodeIsRejected() {
        var nodes = new TreeMap<String, CourseNode>(Map.of("A", new CourseNode("A", new Leaf("B"))));
        assertThrows(IllegalArgumentException.class, () -> new DependencyGraph(nodes, Set.of(new Edge("A", "B"))));
        assertThrows(IllegalArgumentException.class, () -> DependencyGraph.of(List.of(new CourseNode("A", new Leaf("B")))));
    }

    @Test
    void requirementNamingAMissingCourseIsRejected() {
        var nodes = new TreeMap<String, CourseNode>(Map.of("A", new CourseNode("A", new Leaf("Z"))));
        var e = assertThrows(IllegalArgumentException.class, () -> new DependencyGraph(nodes, Set.of()));
        assertTrue(e.getMessage().contains("Course A requires Z"), e.getMessage());
    }

    @Test
    void edgesMustBeTheOnesTheRequirementsImply() {
        var cyclic = new TreeMap<String, CourseNode>(Map.of(
                "A", new CourseNode("A", new Leaf("B")),
                "B", new CourseNode("B", new Leaf("A"))));
        assertThrows(IllegalArgumentException.class, () -> new DependencyGraph(cyclic, Set.of()));

        var independent = new TreeMap<String, CourseNode>(Map.of(
                "A", new CourseNode("A", AllOf.none()),
                "B", new CourseNode("B", AllOf.none())));
        assertThrows(IllegalArgumentException.class,
                () -> new DependencyGraph(independent, Set.of(new Edge("A", "B"), new Edge("B", "A"))));
    }

    @Test
    void derivedEdgesAreAccepted() {
        var nodes = new TreeMap<String, CourseNode>(Map.of(
                "A", new CourseNode("A", AllOf.none()),
                "B", new CourseNode("B", new Leaf("A"))));
        DependencyGraph g = new DependencyGraph(nodes, Set.of(new Edge("B", "A")));
        assertEquals(List.of("A", "B"), Topo.topologicalOrder(g));
    }

    @Test
    void duplicateCourseIsRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> DependencyGraph.of(List.of(new CourseNode("A", null), new CourseNode("A", AllOf.none()))));
    }

    @Test
    void viewsAreUnmodifiable() {
        DependencyGraph g = build(DIAMOND);
        assertThrows(UnsupportedOperationException.class, () -> g.nodes().remove("A"));
        assertThrows(UnsupportedOperationException.class, () -> g.edges().clear());
    }

    @Test
    void nullRequirementMeansNone() {
        CourseNode n = new CourseNode("A", null);
        assertEquals(AllOf.none(), n.requirement());
        assertFalse(n.hasPrerequisites());
        assertTrue(new CourseNode("B", new Leaf("A")).hasPrerequisites());
    }
}
