package com.architecture.memory.codegraph.dto.graph;

import com.architecture.memory.codegraph.model.graph.EntityKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApiSurfaceEntry {
    private String entityId;
    private String qualifiedName;
    private EntityKind kind;
    private String filePath;
    private String signature;
    private int usageCount;
}
