package com.architecture.memory.codegraph.repository.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Counters of one committed write transaction.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WriteResult {
    private int nodesCreated;
    private int nodesDeleted;
    private int relationshipsCreated;
    private int relationshipsDeleted;
}
