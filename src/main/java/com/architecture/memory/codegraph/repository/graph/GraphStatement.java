package com.architecture.memory.codegraph.repository.graph;

import com.architecture.memory.codegraph.model.graph.EntityKind;
import com.architecture.memory.codegraph.model.graph.RelationshipType;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Map;

/**
 * One structured write operation. Node and relationship rows are produced by {@link GraphRowMapper}.
 */
@Getter
@ToString(exclude = "rows")
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class GraphStatement {

    public enum Operation {
        DELETE_PROJECT,
        CREATE_NODES,
        CREATE_RELATIONSHIPS
    }

    private final Operation operation;
    private final String projectId;
    private final EntityKind kind;
    private final RelationshipType relationshipType;
    private final List<Map<String, Object>> rows;

    public static GraphStatement deleteProject(String projectId) {
        return new GraphStatement(Operation.DELETE_PROJECT, projectId, null, null, List.of());
    }

    public static GraphStatement createNodes(String projectId, EntityKind kind, List<Map<String, Object>> rows) {
        return new GraphStatement(Operation.CREATE_NODES, projectId, kind, null, List.copyOf(rows));
    }

    public static GraphStatement createRelationships(String projectId, RelationshipType type,
                                                     List<Map<String, Object>> rows) {
        return new GraphStatement(Operation.CREATE_RELATIONSHIPS, projectId, null, type, List.copyOf(rows));
    }

    public int size() {
        return rows.size();
    }
}
