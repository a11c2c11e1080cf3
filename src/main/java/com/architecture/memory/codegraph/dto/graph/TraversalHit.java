package com.architecture.memory.codegraph.dto.graph;

import com.architecture.memory.codegraph.model.graph.CodeEntity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An entity reached by a call traversal and the shortest depth it was reached at.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TraversalHit {
    private CodeEntity entity;
    private int depth;
}
