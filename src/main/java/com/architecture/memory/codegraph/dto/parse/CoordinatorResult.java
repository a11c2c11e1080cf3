package com.architecture.memory.codegraph.dto.parse;

import com.architecture.memory.codegraph.model.graph.CodeEntity;
import com.architecture.memory.codegraph.model.graph.Relationship;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merged output of all language parsers for one project scan.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CoordinatorResult {

    private String projectId;

    @Builder.Default
    private List<CodeEntity> entities = new ArrayList<>();

    @Builder.Default
    private List<Relationship> relationships = new ArrayList<>();

    @Builder.Default
    private Map<String, LanguageStats> perLanguageStats = new LinkedHashMap<>();

    @Builder.Default
    private List<ParseError> errors = new ArrayList<>();

    // Unsupported-language notes and other non-fatal remarks
    @Builder.Default
    private List<String> warnings = new ArrayList<>();

    private int filesProcessed;
    private int filesSkipped;
    private long durationMs;

    /**
     * Share of processed files that parsed without error, 0.0 to 1.0. An empty scan counts as fully successful.
     */
    public double getSuccessRate() {
        if (filesProcessed == 0) {
            return 1.0;
        }
        long failedFiles = errors.stream().map(ParseError::getFilePath).distinct().count();
        return (double) (filesProcessed - failedFiles) / filesProcessed;
    }

    public List<String> getLanguagesWithResults() {
        List<String> languages = new ArrayList<>();
        perLanguageStats.forEach((language, stats) -> {
            if (stats.getEntitiesFound() > 0) {
                languages.add(language);
            }
        });
        return languages;
    }
}
