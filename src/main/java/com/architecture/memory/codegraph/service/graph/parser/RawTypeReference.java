package com.architecture.memory.codegraph.service.graph.parser;

import com.architecture.memory.codegraph.model.graph.RelationshipType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A use of a type name (supertype, field type, instantiation) awaiting resolution to a type entity.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RawTypeReference {
    private String sourceId;

    // Simple or qualified name with generic arguments removed
    private String typeName;

    private RelationshipType relationshipType;
    private int line;
}
