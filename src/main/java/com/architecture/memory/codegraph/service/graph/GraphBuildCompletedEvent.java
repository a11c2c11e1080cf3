package com.architecture.memory.codegraph.service.graph;

import com.architecture.memory.codegraph.dto.graph.BuildResult;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Published once a build has released its project lock, whether it succeeded or not.
 * Listeners that query the graph after this event see the committed result of that build.
 */
@Getter
@ToString
@AllArgsConstructor
public class GraphBuildCompletedEvent {
    private final String projectId;
    private final BuildResult result;

    public boolean isSuccess() {
        return result != null && result.isSuccess();
    }
}
