package com.architecture.memory.codegraph.dto.analysis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Risk score (0-100) of a single changed entity and how it was composed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskAssessment {

    private int overallScore;
    private AnalysisSeverity severity;
    private ScoreBreakdown scoreBreakdown;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ScoreBreakdown {
        /**
         * Points from the number of affected entities (0-50), direct ones weighted higher.
         */
        private int affectedEntities;

        /**
         * Points from the fan-in of the changed entity itself (0-35).
         */
        private int fanIn;

        /**
         * Points for removing an entity that still has callers (0-15).
         */
        private int deletion;
    }
}
