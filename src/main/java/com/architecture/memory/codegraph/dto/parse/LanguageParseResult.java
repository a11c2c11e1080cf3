package com.architecture.memory.codegraph.dto.parse;

import com.architecture.memory.codegraph.model.graph.CodeEntity;
import com.architecture.memory.codegraph.model.graph.Relationship;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Output of one language parser over its share of a project's files.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LanguageParseResult {

    private String language;
    private String parserVersion;

    @Builder.Default
    private List<CodeEntity> entities = new ArrayList<>();

    @Builder.Default
    private List<Relationship> relationships = new ArrayList<>();

    @Builder.Default
    private List<ParseError> errors = new ArrayList<>();

    private int filesProcessed;
    private long durationMs;

    public int getFilesWithErrors() {
        return (int) errors.stream().map(ParseError::getFilePath).distinct().count();
    }

    public LanguageStats toStats() {
        return LanguageStats.builder()
                .language(language)
                .parserVersion(parserVersion)
                .filesProcessed(filesProcessed)
                .filesWithErrors(getFilesWithErrors())
                .entitiesFound(entities.size())
                .relationshipsFound(relationships.size())
                .durationMs(durationMs)
                .build();
    }
}
