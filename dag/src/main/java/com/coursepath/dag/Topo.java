package com.coursepath.dag;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Kahn's algorithm over a {@link DependencyGraph}. Ties are always broken by ascending course id, so the same graph
 * always gives the same answer. Never returns a partial ordering: a cycle is reported instead.
 */
public final class Topo {
    private static final Logger log = LoggerFactory.getLogger(Topo.class);

    private Topo() {}

    /**
     * Every course, each after all of its prerequisites.
     *
     * @throws CycleDetectedException if no such order exists
     */
    public static List<String> topologicalOrder(DependencyGraph graph) {
        Reduction r = new Reduction(graph);
        TreeSet<String> ready = r.initiallyReady();
        List<String> order = new ArrayList<>(graph.size());
        while (!ready.isEmpty()) {
            String next = ready.pollFirst();
            order.add(next);
            ready.addAll(r.resolve(next));
        }
        r.failIfStuck(order.size());
        return Collections.unmodifiableList(order);
    }

    /**
     * Layers of courses: a course sits in the first layer after all of its prerequisites. Layer 0 holds the courses
     * with no prerequisites. Read as a plan, each layer is one term.
     *
     * @throws CycleDetectedException if no such layering exists
     */
    public static List<SortedSet<String>> generations(DependencyGraph graph) {
        Reduction r = new Reduction(graph);
        TreeSet<String> layer = r.initiallyReady();
        List<SortedSet<String>> gens = new ArrayList<>();
        int placed = 0;
        while (!layer.isEmpty()) {
            gens.add(Collections.unmodifiableSortedSet(layer));
            placed += layer.size();
            TreeSet<String> next = new TreeSet<>();
            for (String n : layer) next.addAll(r.resolve(n));
            layer = next;
        }
        r.failIfStuck(placed);
        return Collections.unmodifiableList(gens);
    }

    /** Mutable bookkeeping for one sort; never shared. */
    private static final class Reduction {
        private final DependencyGraph graph;
        private final Map<String, Integer> unresolved = new HashMap<>();
        private final Map<String, List<String>> dependents = new HashMap<>();

        Reduction(DependencyGraph graph) {
            this.graph = graph;
            for (String id : graph.courseIds()) {
                unresolved.put(id, 0);
                dependents.put(id, new ArrayList<>());
            }
            for (Edge e : graph.edges()) {
                unresolved.merge(e.from(), 1, Integer::sum);
                dependents.get(e.to()).add(e.from());
            }
        }

        TreeSet<String> initiallyReady() {
            TreeSet<String> ready = new TreeSet<>();
            unresolved.forEach((id, count) -> { if (count == 0) ready.add(id); });
            return ready;
        }

        /** Marks {@code id} as placed and returns the dependents that became ready. */
        List<String> resolve(String id) {
            List<String> nowReady = new ArrayList<>();
            for (String d : dependents.get(id)) {
                int left = unresolved.merge(d, -1, Integer::sum);
                if (left == 0) nowReady.add(d);
            }
            return nowReady;
        }

        void failIfStuck(int placed) {
            if (placed == graph.size()) return;
            TreeSet<String> remaining = new TreeSet<>();
            unresolved.forEach((id, count) -> { if (count > 0) remaining.add(id); });
            List<String> cycle = witness(remaining);
            log.debug("{} of {} course(s) could not be ordered; witness cycle {}", remaining.size(), graph.size(), cycle);
            throw new CycleDetectedException(cycle);
        }

        /** Walks from the smallest stuck course along its smallest stuck prerequisite until a course repeats. */
        private List<String> witness(TreeSet<String> remaining) {
            List<String> path = new ArrayList<>();
            Map<String, Integer> seenAt = new HashMap<>();
            String current = remaining.first();
            while (!seenAt.containsKey(current)) {
                seenAt.put(current, path.size());
                path.add(current);
                current = graph.dependenciesOf(current).stream()
                        .filter(remaining::contains)
                        .findFirst()
                        .orElseThrow(() -> new IllegalStateException("Stuck course without stuck prerequisite"));
            }
            List<String> cycle = new ArrayList<>(path.subList(seenAt.get(current), path.size()));
            cycle.add(current);
            return cycle;
        }
    }
}
