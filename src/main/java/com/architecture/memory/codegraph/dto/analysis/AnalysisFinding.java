package com.architecture.memory.codegraph.dto.analysis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One result of an analyzer, handed to the reporting layer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisFinding {

    private FindingType findingType;
    private String title;
    private String description;
    private AnalysisSeverity severity;

    private String filePath;
    private int startLine;
    private int endLine;

    // Qualified names of the entities that triggered the finding
    @Builder.Default
    private List<String> affectedEntities = new ArrayList<>();

    // Impact findings only
    @Builder.Default
    private List<ImpactedEntity> impactedEntities = new ArrayList<>();

    private RiskAssessment risk;

    private String analysisModule;

    @Builder.Default
    private double confidenceScore = 1.0;

    @Builder.Default
    private List<String> recommendations = new ArrayList<>();

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    public int getRiskScore() {
        return risk != null ? risk.getOverallScore() : 0;
    }
}
