package com.architecture.memory.codegraph.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClassComplexity {
    private String entityId;
    private String qualifiedName;
    private String filePath;
    private int methodCount;
    private int outgoingCalls;
    private int incomingCalls;

    // methods * 2 + outgoing + incoming
    private int complexityScore;
}
