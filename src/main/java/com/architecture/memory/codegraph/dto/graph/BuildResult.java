package com.architecture.memory.codegraph.dto.graph;

import com.architecture.memory.codegraph.model.graph.EntityKind;
import com.architecture.memory.codegraph.model.graph.RelationshipType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BuildResult {

    private String projectId;
    private boolean success;
    private int nodesCreated;
    private int relationshipsCreated;
    private int droppedRelationships;

    // Node write attempts, 1 unless a retry happened
    private int attempts;

    @Builder.Default
    private Map<EntityKind, Integer> nodesByKind = new EnumMap<>(EntityKind.class);

    @Builder.Default
    private Map<RelationshipType, Integer> relationshipsByType = new EnumMap<>(RelationshipType.class);

    @Builder.Default
    private List<String> errors = new ArrayList<>();

    @Builder.Default
    private List<String> warnings = new ArrayList<>();

    private long buildDurationMs;
}
