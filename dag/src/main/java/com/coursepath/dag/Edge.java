package com.coursepath.dag;

/** {@code from} requires {@code to}: the course {@code to} must be satisfied before {@code from}. */
public record Edge(String from, String to) {
    @Override
    public String toString() {
        return from + "->" + to;
    }
}
