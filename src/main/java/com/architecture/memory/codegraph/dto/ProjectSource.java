package com.architecture.memory.codegraph.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A checked-out source tree handed over by repository acquisition.
 * Files may be absolute or relative to rootPath.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProjectSource {

    private String rootPath;

    @Builder.Default
    private List<String> languages = new ArrayList<>();

    @Builder.Default
    private List<String> files = new ArrayList<>();
}
