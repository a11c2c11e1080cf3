package com.architecture.memory.codegraph.model.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A typed, directed edge between two entities of the same build.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Relationship {

    private RelationshipType type;
    private String sourceId;
    private String targetId;

    @Builder.Default
    private Confidence confidence = Confidence.EXACT;

    private int sourceLine;

    /**
     * Identity of the edge within a build: {type}:{source}->{target}.
     */
    public String key() {
        return type + ":" + sourceId + "->" + targetId;
    }

    public static Relationship contains(String parentId, String childId, int line) {
        return Relationship.builder()
                .type(RelationshipType.CONTAINS)
                .sourceId(parentId)
                .targetId(childId)
                .sourceLine(line)
                .build();
    }
}
