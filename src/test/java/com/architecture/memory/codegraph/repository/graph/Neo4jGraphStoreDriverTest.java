package com.architecture.memory.codegraph.repository.graph;

import com.architecture.memory.codegraph.exception.GraphWriteException;
import com.architecture.memory.codegraph.exception.QueryException;
import com.architecture.memory.codegraph.model.graph.EntityKind;
import com.architecture.memory.codegraph.model.graph.RelationshipType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Session;
import org.neo4j.driver.SessionConfig;
import org.neo4j.driver.exceptions.ServiceUnavailableException;
import org.neo4j.driver.exceptions.TransientException;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class Neo4jGraphStoreDriverTest {

    @Mock
    private Driver neo4jDriver;

    @Mock
    private Session session;

    private Neo4jGraphStoreDriver driver;

    @BeforeEach
    void setUp() {
        driver = new Neo4jGraphStoreDriver(neo4jDriver, "neo4j");
    }

    @Test
    void scopesEveryReadQueryByProject() {
        for (ReadQuery query : ReadQuery.values()) {
            assertThat(driver.cypherFor(query))
                    .as(query.name())
                    .contains("projectId: $projectId");
        }
    }

    @Test
    void usesEntityKindAsLabel_andRelationshipTypeAsEdgeType() {
        String nodes = driver.cypherFor(GraphStatement.createNodes("p1", EntityKind.INTERFACE, List.of(Map.of("id", "x"))));
        String edges = driver.cypherFor(GraphStatement.createRelationships("p1", RelationshipType.CALLS, List.of()));
        String delete = driver.cypherFor(GraphStatement.deleteProject("p1"));

        assertThat(nodes).contains("MERGE (n:CodeEntity").contains("SET n:Interface");
        assertThat(edges).contains("MERGE (s)-[r:CALLS]->(t)");
        assertThat(delete).contains("DETACH DELETE");
    }

    @Test
    void wrapsReadFailure_inQueryException() {
        when(neo4jDriver.session(any(SessionConfig.class))).thenReturn(session);
        when(session.executeRead(any())).thenThrow(new ServiceUnavailableException("connection refused"));

        assertThatThrownBy(() -> driver.runRead(ReadQuery.PROJECT_ENTITIES, Map.of("projectId", "p1")))
                .isInstanceOf(QueryException.class)
                .hasMessageContaining("connection refused");
        verify(session).close();
    }

    @Test
    void wrapsWriteFailure_inGraphWriteException() {
        when(neo4jDriver.session(any(SessionConfig.class))).thenReturn(session);
        when(session.executeWrite(any())).thenThrow(new TransientException("Neo.TransientError", "deadlock"));

        assertThatThrownBy(() -> driver.runWrite(List.of(GraphStatement.deleteProject("p1"))))
                .isInstanceOf(GraphWriteException.class)
                .hasMessageContaining("rolled back");
    }

    @Test
    void rejectsOperations_afterClose() {
        driver.close();

        verify(neo4jDriver).close();
        assertThat(driver.isConnected()).isFalse();
        assertThatThrownBy(() -> driver.runRead(ReadQuery.ENTITY_BY_ID, Map.of("projectId", "p1", "id", "x")))
                .isInstanceOf(IllegalStateException.class);
    }
}
