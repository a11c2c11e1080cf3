package com.architecture.memory.codegraph.dto.parse;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A recovered per-file parse failure.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParseError {
    private String filePath;
    private String language;
    private String message;
    private int line;

    public static ParseError of(String filePath, String language, String message) {
        return ParseError.builder()
                .filePath(filePath)
                .language(language)
                .message(message)
                .build();
    }
}
