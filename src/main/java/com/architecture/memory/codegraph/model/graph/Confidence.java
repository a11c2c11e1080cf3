package com.architecture.memory.codegraph.model.graph;

/**
 * How a relationship was resolved. HEURISTIC marks a pick among several candidates.
 */
public enum Confidence {
    EXACT,
    HEURISTIC
}
