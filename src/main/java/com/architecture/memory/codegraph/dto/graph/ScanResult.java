package com.architecture.memory.codegraph.dto.graph;

import com.architecture.memory.codegraph.dto.parse.CoordinatorResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScanResult {
    private String projectId;
    private CoordinatorResult parseResult;
    private BuildResult buildResult;

    public boolean isSuccess() {
        return buildResult != null && buildResult.isSuccess();
    }
}
