package com.architecture.memory.codegraph.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RefactoringCandidate {
    private String entityId;
    private String qualifiedName;
    private String filePath;
    private int outgoingCalls;
    // Distinct types owning the called methods
    private int calleeTypes;
    private String reason;
}
