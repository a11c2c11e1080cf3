package com.architecture.memory.codegraph.dto.analysis;

public enum FindingType {
    CIRCULAR_DEPENDENCY,
    UNUSED_ENTITY,
    CHANGE_IMPACT,
    ISOLATED_CHANGE,
    UNKNOWN_IMPACT,
    FILE_IMPACT
}
