package com.architecture.memory.codegraph.dto.analysis;

public enum ImpactType {
    // reached at depth 1
    DIRECT,
    // reached at depth > 1
    INDIRECT;

    public static ImpactType forDepth(int depth) {
        return depth <= 1 ? DIRECT : INDIRECT;
    }
}
