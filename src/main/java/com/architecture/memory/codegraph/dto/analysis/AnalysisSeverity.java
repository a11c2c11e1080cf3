package com.architecture.memory.codegraph.dto.analysis;

public enum AnalysisSeverity {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW,
    INFO;

    /**
     * Map a 0-100 score to a severity.
     */
    public static AnalysisSeverity fromScore(int score) {
        if (score >= 70) return CRITICAL;
        if (score >= 50) return HIGH;
        if (score >= 25) return MEDIUM;
        if (score > 0) return LOW;
        return INFO;
    }
}
