package com.architecture.memory.codegraph.service.graph.parser;

import com.architecture.memory.codegraph.model.graph.CodeEntity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A method entity with the argument counts it accepts, used as a call target candidate.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeclaredMethod {

    public static final int UNBOUNDED = Integer.MAX_VALUE;

    private CodeEntity entity;

    // Type entity, or the File entity for top-level functions
    private String ownerId;
    private String ownerQualifiedName;
    private boolean topLevel;

    private int minArity;
    private int maxArity;

    public boolean accepts(int arity) {
        return arity < 0 || (arity >= minArity && arity <= maxArity);
    }
}
