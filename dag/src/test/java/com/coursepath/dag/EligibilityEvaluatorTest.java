package com.coursepath.dag;

import com.coursepath.prereq.AllOf;
import com.coursepath.prereq.AnyOf;
import com.coursepath.prereq.Leaf;
import com.coursepath.prereq.PrerequisiteParser;
import com.coursepath.prereq.RequirementExpression;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

import static com.coursepath.dag.TestCatalogFixture.*;
import static org.junit.jupiter.api.Assertions.*;

public class EligibilityEvaluatorTest {

    @Nested
    class EligibleCourses {
        @Test
        void nothingCompletedMeansOnlyCoursesWithoutPrerequisites() {
            DependencyGraph g = build(catalog("A", "", "B", "A", "C", "one of A or B"));
            assertEquals(Set.of("A"), EligibilityEvaluator.eligibleCourses(g, Set.of()));
        }

        @Test
        void completingACourseUnlocksItsDependents() {
            DependencyGraph g = build(catalog("A", "", "B", "A", "C", "one of A or B"));
            assertEquals(Set.of("B", "C"), EligibilityEvaluator.eligibleCourses(g, Set.of("A")));
        }

        @Test
        void allOfNeedsEveryPart() {
            DependencyGraph g = build(CS_TRACK);
            assertEquals(Set.of("CS301", "MATH 100"), EligibilityEvaluator.eligibleCourses(g, Set.of("CS101", "CS201")));
            assertEquals(Set.of("CS302", "CS401"),
                    EligibilityEvaluator.eligibleCourses(g, Set.of("CS101", "CS201", "CS301", "MATH 100")));
        }

        @Test
        void unknownCompletedIdsAreIgnored() {
            DependencyGraph g = build(DIAMOND);
            assertEquals(Set.of("A"), EligibilityEvaluator.eligibleCourses(g, Set.of("TRANSFER 101")));
        }

        @ParameterizedTest
        @ValueSource(longs = {3, 5, 8, 13})
        void neverReturnsACompletedCourse(long seed) {
            DependencyGraph g = build(randomAcyclic(seed, 25));
            Set<String> completed = new HashSet<>();
            int i = 0;
            for (String id : g.courseIds()) if (i++ % 3 == 0) completed.add(id);
            SortedSet<String> eligible = EligibilityEvaluator.eligibleCourses(g, completed);
            for (String id : eligible) assertFalse(completed.contains(id), id);
        }

        @ParameterizedTest
        @ValueSource(longs = {3, 5, 8, 13})
        void withNothingCompletedEligibleMeansNoPrerequisites(long seed) {
            DependencyGraph g = build(randomAcyclic(seed, 25));
            Set<String> expected = new TreeSet<>();
            for (CourseNode n : g.nodes().values()) if (n.requirement().equals(AllOf.none())) expected.add(n.id());
            assertEquals(expected, EligibilityEvaluator.eligibleCourses(g, Set.of()));
        }

        @Test
        void inputsAreNotModified() {
            DependencyGraph g = build(DIAMOND);
            Set<String> completed = new HashSet<>(Set.of("A"));
            Map<String, CourseNode> before = Map.copyOf(g.nodes());
            EligibilityEvaluator.eligibleCourses(g, completed);
            assertEquals(Set.of("A"), completed);
            assertEquals(before, g.nodes());
        }
    }

    @Nested
    class Evaluate {
        @Test
        void parsedConjunctionRoundTrip() {
            RequirementExpression e = new PrerequisiteParser().parse("A and B");
            assertTrue(EligibilityEvaluator.evaluate(e, Set.of("A", "B")));
            assertFalse(EligibilityEvaluator.evaluate(e, Set.of("A")));
        }

        @Test
        void emptyAllOfHolds() {
            assertTrue(EligibilityEvaluator.evaluate(AllOf.none(), Set.of()));
        }

        @Test
        void anyOfNeedsOneAlternative() {
            var e = AnyOf.of(new Leaf("A"), new Leaf("B"));
            assertFalse(EligibilityEvaluator.evaluate(e, Set.of()));
            assertTrue(EligibilityEvaluator.evaluate(e, Set.of("B")));
        }

        @Test
        void emptyAnyOfIsInvalid() {
            var e = AllOf.of(new Leaf("A"), new AnyOf(List.of()));
            var ex = assertThrows(InvalidExpressionException.class, () -> EligibilityEvaluator.evaluate(e, Set.of("A")));
            assertEquals("one-of requirement has no alternatives", ex.getMessage());
        }

        @Test
        void emptyAnyOfInACatalogGraphIsInvalid() {
            DependencyGraph g = DependencyGraph.of(List.of(new CourseNode("A", new AnyOf(List.of()))));
            assertThrows(InvalidExpressionException.class, () -> EligibilityEvaluator.eligibleCourses(g, Set.of()));
        }
    }

    @Nested
    class Explain {
        private final DependencyGraph g = build(CS_TRACK);

        @Test
        void listsUnmetConjuncts() {
            Eligibility e = EligibilityEvaluator.explain(g, "CS401", Set.of("CS101"));
            assertFalse(e.eligible());
            assertFalse(e.alreadyCompleted());
            assertEquals(List.of(new Leaf("CS201"), AnyOf.of(new Leaf("CS301"), new Leaf("CS302"))), e.unmet());
        }

        @Test
        void singleRequirementIsReportedWhole() {
            Eligibility e = EligibilityEvaluator.explain(g, "CS201", Set.of());
            assertEquals(List.of(new Leaf("CS101")), e.unmet());
        }

        @Test
        void eligibleCourseHasNothingUnmet() {
            Eligibility e = EligibilityEvaluator.explain(g, "CS401", Set.of("CS101", "CS201", "CS302"));
            assertTrue(e.eligible());
            assertTrue(e.unmet().isEmpty());
        }

        @Test
        void completedCourseIsNotEligibleAgain() {
            Eligibility e = EligibilityEvaluator.explain(g, "CS101", Set.of("CS101"));
            assertTrue(e.alreadyCompleted());
            assertFalse(e.eligible());
        }

        @Test
        void unknownCourse() {
            assertThrows(IllegalArgumentException.class, () -> EligibilityEvaluator.explain(g, "CS999", Set.of()));
        }
    }
}
