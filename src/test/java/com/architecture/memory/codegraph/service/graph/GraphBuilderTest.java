package com.architecture.memory.codegraph.service.graph;

import com.architecture.memory.codegraph.config.CodeGraphProperties;
import com.architecture.memory.codegraph.dto.graph.BuildResult;
import com.architecture.memory.codegraph.exception.GraphWriteException;
import com.architecture.memory.codegraph.model.graph.CodeEntity;
import com.architecture.memory.codegraph.model.graph.Confidence;
import com.architecture.memory.codegraph.model.graph.EntityKind;
import com.architecture.memory.codegraph.model.graph.Relationship;
import com.architecture.memory.codegraph.model.graph.RelationshipType;
import com.architecture.memory.codegraph.repository.graph.GraphStatement;
import com.architecture.memory.codegraph.repository.graph.GraphStoreSettings;
import com.architecture.memory.codegraph.repository.graph.InMemoryGraphStoreDriver;
import com.architecture.memory.codegraph.repository.graph.ReadQuery;
import com.architecture.memory.codegraph.repository.graph.WriteResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class GraphBuilderTest {

    private static final String PROJECT = "shop";

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private CodeGraphProperties properties;
    private InMemoryGraphStoreDriver store;
    private GraphBuilder graphBuilder;

    @BeforeEach
    void setUp() {
        properties = new CodeGraphProperties();
        store = new InMemoryGraphStoreDriver();
        store.connect(new GraphStoreSettings());
        graphBuilder = new GraphBuilder(store, new CanonicalIdGenerator(), properties, eventPublisher);
    }

    // ========================= HELPERS =========================

    private static CodeEntity entity(String id, EntityKind kind) {
        return CodeEntity.builder().id(id).kind(kind).name(id).qualifiedName(id).filePath("src/Order.java").build();
    }

    private static List<CodeEntity> orderEntities() {
        return List.of(
                entity("f1", EntityKind.FILE),
                entity("c1", EntityKind.CLASS),
                entity("m1", EntityKind.METHOD),
                entity("m2", EntityKind.METHOD));
    }

    private static List<Relationship> orderRelationships() {
        return List.of(
                Relationship.contains("f1", "c1", 1),
                Relationship.contains("c1", "m1", 3),
                Relationship.contains("c1", "m2", 7),
                Relationship.builder().type(RelationshipType.CALLS).sourceId("m1").targetId("m2").sourceLine(4).build());
    }

    private long storedNodes(String projectId) {
        return store.runRead(ReadQuery.PROJECT_ENTITIES, Map.of("projectId", projectId)).size();
    }

    // ========================= TESTS =========================

    @Test
    void build_createsProjectNodeAndAllEntities() {
        BuildResult result = graphBuilder.build(PROJECT, orderEntities(), orderRelationships());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getAttempts()).isEqualTo(1);
        assertThat(result.getNodesCreated()).isEqualTo(5);
        // four parsed edges plus project CONTAINS file
        assertThat(result.getRelationshipsCreated()).isEqualTo(5);
        assertThat(result.getNodesByKind()).containsEntry(EntityKind.METHOD, 2).containsEntry(EntityKind.PROJECT, 1);
        assertThat(result.getRelationshipsByType()).containsEntry(RelationshipType.CONTAINS, 4)
                .containsEntry(RelationshipType.CALLS, 1);
        assertThat(store.runRead(ReadQuery.ENTITY_BY_ID, Map.of("projectId", PROJECT, "id", "project:shop"))).hasSize(1);
    }

    @Test
    void build_twice_replacesGraphWithoutDuplicates() {
        graphBuilder.build(PROJECT, orderEntities(), orderRelationships());
        BuildResult second = graphBuilder.build(PROJECT, orderEntities(), orderRelationships());

        assertThat(second.isSuccess()).isTrue();
        assertThat(storedNodes(PROJECT)).isEqualTo(5);
        assertThat(store.runRead(ReadQuery.PROJECT_RELATIONSHIPS, Map.of("projectId", PROJECT))).hasSize(5);
    }

    @Test
    void build_dropsRelationshipWithMissingEndpoint_andWarns() {
        List<Relationship> relationships = new ArrayList<>(orderRelationships());
        relationships.add(Relationship.builder().type(RelationshipType.CALLS).sourceId("m1").targetId("ghost").build());

        BuildResult result = graphBuilder.build(PROJECT, orderEntities(), relationships);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getDroppedRelationships()).isEqualTo(1);
        assertThat(result.getWarnings()).contains("Dropped CALLS relationship m1 -> ghost: target ghost not found");
        assertThat(result.getRelationshipsCreated()).isEqualTo(5);
    }

    @Test
    void build_keepsFirstOfDuplicateEntityIds() {
        List<CodeEntity> entities = new ArrayList<>(orderEntities());
        entities.add(entity("m1", EntityKind.METHOD));

        BuildResult result = graphBuilder.build(PROJECT, entities, orderRelationships());

        assertThat(result.getWarnings()).contains("Duplicate entity id ignored: m1");
        assertThat(storedNodes(PROJECT)).isEqualTo(5);
    }

    @Test
    void build_upgradesHeuristicEdge_whenExactDuplicateFollows() {
        List<Relationship> relationships = new ArrayList<>();
        relationships.add(Relationship.builder().type(RelationshipType.CALLS).sourceId("m1").targetId("m2")
                .confidence(Confidence.HEURISTIC).build());
        relationships.addAll(orderRelationships());

        graphBuilder.build(PROJECT, orderEntities(), relationships);

        assertThat(store.runRead(ReadQuery.OUTGOING_RELATIONSHIPS,
                Map.of("projectId", PROJECT, "ids", List.of("m1"), "types", List.of("CALLS"))))
                .singleElement()
                .satisfies(row -> assertThat(row).containsEntry("confidence", "EXACT"));
    }

    @Test
    void build_whenNodeWriteKeepsFailing_reportsFailureAndKeepsPreviousGraph() {
        FailingNodeStore failing = new FailingNodeStore();
        failing.connect(new GraphStoreSettings());
        GraphBuilder builder = new GraphBuilder(failing, new CanonicalIdGenerator(), properties, eventPublisher);
        builder.build(PROJECT, orderEntities(), orderRelationships());

        failing.failNodeWrites = true;
        BuildResult result = builder.build(PROJECT, List.of(entity("f9", EntityKind.FILE)), List.of());

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getAttempts()).isEqualTo(2);
        assertThat(failing.failedAttempts).isEqualTo(2);
        assertThat(result.getErrors()).singleElement().asString()
                .startsWith("Node write failed after 2 attempt(s), previous graph kept")
                .contains("disk full");
        assertThat(failing.runRead(ReadQuery.PROJECT_ENTITIES, Map.of("projectId", PROJECT))).hasSize(5);
    }

    @Test
    void build_publishesCompletionEvent() {
        BuildResult result = graphBuilder.build(PROJECT, orderEntities(), orderRelationships());

        ArgumentCaptor<GraphBuildCompletedEvent> captor = ArgumentCaptor.forClass(GraphBuildCompletedEvent.class);
        verify(eventPublisher).publishEvent(captor.capture());
        assertThat(captor.getValue().getProjectId()).isEqualTo(PROJECT);
        assertThat(captor.getValue().getResult()).isSameAs(result);
        assertThat(captor.getValue().isSuccess()).isTrue();
        assertThat(graphBuilder.isBuildInProgress(PROJECT)).isFalse();
    }

    @Test
    void concurrentBuildsOfSameProject_neverInterleave() throws Exception {
        RecordingStore recording = new RecordingStore();
        recording.connect(new GraphStoreSettings());
        GraphBuilder builder = new GraphBuilder(recording, new CanonicalIdGenerator(), properties, eventPublisher);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<BuildResult>> futures = new ArrayList<>();
            for (int i = 0; i < 2; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return builder.build(PROJECT, orderEntities(), orderRelationships());
                }));
            }
            start.countDown();
            for (Future<BuildResult> future : futures) {
                assertThat(future.get(10, TimeUnit.SECONDS).isSuccess()).isTrue();
            }
        } finally {
            pool.shutdownNow();
        }

        List<String> writers = recording.writers;
        int switches = 0;
        for (int i = 1; i < writers.size(); i++) {
            if (!writers.get(i).equals(writers.get(i - 1))) {
                switches++;
            }
        }
        assertThat(switches).isEqualTo(1);
        assertThat(recording.runRead(ReadQuery.PROJECT_ENTITIES, Map.of("projectId", PROJECT))).hasSize(5);
    }

    @Test
    void deleteProjectGraph_removesOnlyThatProject() {
        graphBuilder.build(PROJECT, orderEntities(), orderRelationships());
        graphBuilder.build("billing", orderEntities(), orderRelationships());

        int deleted = graphBuilder.deleteProjectGraph(PROJECT);

        assertThat(deleted).isEqualTo(5);
        assertThat(storedNodes(PROJECT)).isZero();
        assertThat(storedNodes("billing")).isEqualTo(5);
    }

    @Test
    void deleteProjectGraph_releasesProjectLock_andProjectCanBeRebuilt() {
        graphBuilder.build(PROJECT, orderEntities(), orderRelationships());
        graphBuilder.build("billing", orderEntities(), orderRelationships());
        assertThat(graphBuilder.trackedProjectCount()).isEqualTo(2);

        graphBuilder.deleteProjectGraph(PROJECT);

        assertThat(graphBuilder.trackedProjectCount()).isEqualTo(1);
        assertThat(graphBuilder.isBuildInProgress(PROJECT)).isFalse();
        assertThat(graphBuilder.awaitBuildCompletion(PROJECT, Duration.ofMillis(10))).isTrue();

        graphBuilder.build(PROJECT, orderEntities(), orderRelationships());
        assertThat(storedNodes(PROJECT)).isEqualTo(5);
        assertThat(graphBuilder.trackedProjectCount()).isEqualTo(2);
    }

    @Test
    void partition_splitsIntoBatchesOfGivenSize() {
        assertThat(GraphBuilder.partition(List.of(1, 2, 3, 4, 5), 2))
                .containsExactly(List.of(1, 2), List.of(3, 4), List.of(5));
    }

    // ========================= STORES =========================

    private static class FailingNodeStore extends InMemoryGraphStoreDriver {
        private volatile boolean failNodeWrites;
        private int failedAttempts;

        @Override
        public WriteResult runWrite(List<GraphStatement> statements) {
            boolean writesNodes = statements.stream()
                    .anyMatch(s -> s.getOperation() == GraphStatement.Operation.CREATE_NODES);
            if (failNodeWrites && writesNodes) {
                failedAttempts++;
                throw new GraphWriteException("disk full");
            }
            return super.runWrite(statements);
        }
    }

    private static class RecordingStore extends InMemoryGraphStoreDriver {
        private final List<String> writers = Collections.synchronizedList(new ArrayList<>());

        @Override
        public WriteResult runWrite(List<GraphStatement> statements) {
            writers.add(Thread.currentThread().getName());
            try {
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return super.runWrite(statements);
        }
    }
}
