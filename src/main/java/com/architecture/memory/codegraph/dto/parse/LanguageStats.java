package com.architecture.memory.codegraph.dto.parse;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LanguageStats {
    private String language;
    private String parserVersion;
    private int filesProcessed;
    private int filesWithErrors;
    private int entitiesFound;
    private int relationshipsFound;
    private long durationMs;
}
