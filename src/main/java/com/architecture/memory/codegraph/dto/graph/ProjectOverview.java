package com.architecture.memory.codegraph.dto.graph;

import com.architecture.memory.codegraph.model.graph.EntityKind;
import com.architecture.memory.codegraph.model.graph.RelationshipType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProjectOverview {

    private String projectId;

    @Builder.Default
    private Map<EntityKind, Long> entityCounts = new EnumMap<>(EntityKind.class);

    @Builder.Default
    private Map<RelationshipType, Long> relationshipCounts = new EnumMap<>(RelationshipType.class);

    public long getTotalEntities() {
        return entityCounts.values().stream().mapToLong(Long::longValue).sum();
    }

    public long getTotalRelationships() {
        return relationshipCounts.values().stream().mapToLong(Long::longValue).sum();
    }

    public long count(EntityKind kind) {
        return entityCounts.getOrDefault(kind, 0L);
    }
}
