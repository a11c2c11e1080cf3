package com.architecture.memory.codegraph.dto.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One resolved CALLS edge with the owning types of both ends.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CallPattern {
    private String callerId;
    private String callerName;
    private String callerOwner;
    private String calleeId;
    private String calleeName;
    private String calleeOwner;
    private boolean crossClass;
    private boolean heuristic;
}
