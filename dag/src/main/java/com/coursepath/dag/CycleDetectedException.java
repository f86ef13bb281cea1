package com.coursepath.dag;

import java.util.List;

/** The graph has no topological order. {@link #cycle()} is one witness, first and last element equal. */
public final class CycleDetectedException extends RuntimeException {
    private final List<String> cycle;

    public CycleDetectedException(List<String> cycle) {
        super("Cycle detected: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    public List<String> cycle() {
        return cycle;
    }
}
