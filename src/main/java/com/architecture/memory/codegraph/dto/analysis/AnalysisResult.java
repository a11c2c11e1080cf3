package com.architecture.memory.codegraph.dto.analysis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisResult {

    private String analysisType;
    private String projectId;

    @Builder.Default
    private List<AnalysisFinding> findings = new ArrayList<>();

    private long durationMs;

    @Builder.Default
    private boolean success = true;

    @Builder.Default
    private List<String> errors = new ArrayList<>();

    @Builder.Default
    private List<String> warnings = new ArrayList<>();

    public List<AnalysisFinding> findingsOfType(FindingType type) {
        return findings.stream().filter(f -> f.getFindingType() == type).toList();
    }
}
