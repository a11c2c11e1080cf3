package com.architecture.memory.codegraph.model.graph;

public enum RelationshipType {
    CONTAINS,
    CALLS,
    EXTENDS,
    IMPLEMENTS,
    REFERENCES
}
