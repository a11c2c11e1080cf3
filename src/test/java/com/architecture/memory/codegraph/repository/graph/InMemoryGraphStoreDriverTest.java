package com.architecture.memory.codegraph.repository.graph;

import com.architecture.memory.codegraph.exception.GraphWriteException;
import com.architecture.memory.codegraph.model.graph.CodeEntity;
import com.architecture.memory.codegraph.model.graph.EntityKind;
import com.architecture.memory.codegraph.model.graph.Relationship;
import com.architecture.memory.codegraph.model.graph.RelationshipType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryGraphStoreDriverTest {

    private InMemoryGraphStoreDriver driver;

    @BeforeEach
    void setUp() {
        driver = new InMemoryGraphStoreDriver();
        driver.connect(new GraphStoreSettings());
    }

    @Test
    void storesNodesAndRelationshipsPerProject() {
        driver.runWrite(List.of(
                GraphStatement.createNodes("p1", EntityKind.CLASS, List.of(row("p1", "A"), row("p1", "B"))),
                GraphStatement.createRelationships("p1", RelationshipType.REFERENCES, List.of(edge("p1", "A", "B")))));
        driver.runWrite(List.of(GraphStatement.createNodes("p2", EntityKind.CLASS, List.of(row("p2", "A")))));

        assertThat(driver.runRead(ReadQuery.PROJECT_ENTITIES, Map.of("projectId", "p1", "kinds", List.of()))).hasSize(2);
        assertThat(driver.runRead(ReadQuery.PROJECT_ENTITIES, Map.of("projectId", "p2", "kinds", List.of()))).hasSize(1);
        assertThat(driver.runRead(ReadQuery.OUTGOING_RELATIONSHIPS,
                Map.of("projectId", "p1", "ids", List.of("A"), "types", List.of("REFERENCES"))))
                .singleElement()
                .satisfies(row -> assertThat(row).containsEntry("targetId", "B").containsEntry("type", "REFERENCES"));
    }

    @Test
    void skipsRelationshipRows_whoseEndpointIsMissing() {
        WriteResult result = driver.runWrite(List.of(
                GraphStatement.createNodes("p1", EntityKind.CLASS, List.of(row("p1", "A"))),
                GraphStatement.createRelationships("p1", RelationshipType.CALLS, List.of(edge("p1", "A", "ghost")))));

        assertThat(result.getRelationshipsCreated()).isZero();
        assertThat(driver.runRead(ReadQuery.PROJECT_RELATIONSHIPS, Map.of("projectId", "p1"))).isEmpty();
    }

    @Test
    void rollsBackWholeTransaction_whenOneStatementFails() {
        driver.runWrite(List.of(GraphStatement.createNodes("p1", EntityKind.CLASS, List.of(row("p1", "Old")))));

        Map<String, Object> broken = new HashMap<>(row("p1", "X"));
        broken.remove("id");
        List<GraphStatement> statements = new ArrayList<>();
        statements.add(GraphStatement.deleteProject("p1"));
        statements.add(GraphStatement.createNodes("p1", EntityKind.CLASS, List.of(row("p1", "New"), broken)));

        assertThatThrownBy(() -> driver.runWrite(statements)).isInstanceOf(GraphWriteException.class);

        assertThat(driver.runRead(ReadQuery.PROJECT_ENTITIES, Map.of("projectId", "p1")))
                .extracting(r -> r.get("id"))
                .containsExactly("Old");
    }

    @Test
    void deletesOnlyTheGivenProject() {
        driver.runWrite(List.of(
                GraphStatement.createNodes("p1", EntityKind.FILE, List.of(row("p1", "f1"))),
                GraphStatement.createNodes("p2", EntityKind.FILE, List.of(row("p2", "f2")))));

        WriteResult result = driver.runWrite(List.of(GraphStatement.deleteProject("p1")));

        assertThat(result.getNodesDeleted()).isEqualTo(1);
        assertThat(driver.runRead(ReadQuery.PROJECT_ENTITIES, Map.of("projectId", "p1"))).isEmpty();
        assertThat(driver.runRead(ReadQuery.PROJECT_ENTITIES, Map.of("projectId", "p2"))).hasSize(1);
    }

    @Test
    void countsEntitiesByKind() {
        driver.runWrite(List.of(
                GraphStatement.createNodes("p1", EntityKind.CLASS, List.of(row("p1", "A"), row("p1", "B"))),
                GraphStatement.createNodes("p1", EntityKind.METHOD, List.of(row("p1", "A.m")))));

        assertThat(driver.runRead(ReadQuery.COUNT_ENTITIES_BY_KIND, Map.of("projectId", "p1")))
                .extracting(r -> r.get("kind") + "=" + r.get("count"))
                .containsExactly("Class=2", "Method=1");
    }

    @Test
    void refusesToWork_whenNotConnected() {
        driver.close();

        assertThat(driver.isConnected()).isFalse();
        assertThatThrownBy(() -> driver.runRead(ReadQuery.PROJECT_ENTITIES, Map.of("projectId", "p1")))
                .isInstanceOf(IllegalStateException.class);
    }

    private static Map<String, Object> row(String projectId, String id) {
        return GraphRowMapper.toRow(projectId, CodeEntity.builder().id(id).name(id).qualifiedName(id).build());
    }

    private static Map<String, Object> edge(String projectId, String source, String target) {
        return GraphRowMapper.toRow(projectId, Relationship.builder()
                .type(RelationshipType.CALLS)
                .sourceId(source)
                .targetId(target)
                .build());
    }
}
