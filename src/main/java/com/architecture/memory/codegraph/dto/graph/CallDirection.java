package com.architecture.memory.codegraph.dto.graph;

public enum CallDirection {
    // follow CALLS edges backward
    CALLERS,
    // follow CALLS edges forward
    CALLEES
}
