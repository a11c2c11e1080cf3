package com.architecture.memory.codegraph.dto.parse;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParserInfo {
    private String language;
    private String parserVersion;
    private Set<String> fileExtensions;
    private Set<String> aliases;
}
