package com.architecture.memory.codegraph.dto.analysis;

import com.architecture.memory.codegraph.dto.graph.CallDirection;
import com.architecture.memory.codegraph.model.graph.EntityKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImpactedEntity {
    private String entityId;
    private String qualifiedName;
    private EntityKind kind;
    private String filePath;
    private int depth;
    private ImpactType impactType;

    // CALLERS: depends on the changed entity; CALLEES: the changed entity depends on it
    private CallDirection direction;
}
