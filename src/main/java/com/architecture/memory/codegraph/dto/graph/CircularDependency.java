package com.architecture.memory.codegraph.dto.graph;

import com.architecture.memory.codegraph.model.graph.EntityKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A strongly connected component of more than one entity at a given scope.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CircularDependency {

    private EntityKind scopeKind;

    // Canonical order: starts at the smallest entity id
    @Builder.Default
    private List<String> entityIds = new ArrayList<>();

    @Builder.Default
    private List<String> entityNames = new ArrayList<>();

    @Builder.Default
    private List<CycleEdge> cycleEdges = new ArrayList<>();

    private String description;

    public int getSize() {
        return entityIds.size();
    }

    public int getEdgeCount() {
        return cycleEdges.size();
    }

    public long getHeuristicEdgeCount() {
        return cycleEdges.stream().filter(CycleEdge::isHeuristic).count();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CycleEdge {
        private String sourceId;
        private String targetId;

        // Underlying relationship types, e.g. [CALLS, REFERENCES]
        @Builder.Default
        private List<String> relationshipTypes = new ArrayList<>();

        // true if every underlying edge was resolved heuristically
        private boolean heuristic;
    }
}
