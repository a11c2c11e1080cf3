package com.architecture.memory.codegraph.service.graph;

import com.architecture.memory.codegraph.config.CodeGraphProperties;
import com.architecture.memory.codegraph.dto.graph.BuildResult;
import com.architecture.memory.codegraph.exception.CodeGraphException;
import com.architecture.memory.codegraph.model.graph.CodeEntity;
import com.architecture.memory.codegraph.model.graph.Confidence;
import com.architecture.memory.codegraph.model.graph.EntityKind;
import com.architecture.memory.codegraph.model.graph.Relationship;
import com.architecture.memory.codegraph.model.graph.RelationshipType;
import com.architecture.memory.codegraph.model.graph.Visibility;
import com.architecture.memory.codegraph.repository.graph.GraphRowMapper;
import com.architecture.memory.codegraph.repository.graph.GraphStatement;
import com.architecture.memory.codegraph.repository.graph.GraphStoreDriver;
import com.architecture.memory.codegraph.repository.graph.WriteResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Replaces the graph of a project with a freshly parsed entity and relationship set.
 *
 * Steps:
 *   1. Validate input: drop duplicate entities, drop relationships whose endpoint is not part of this build.
 *   2. In ONE write transaction: delete the project's previous graph, then create nodes in batches by kind.
 *      A failed transaction is rolled back by the store and retried; if every attempt fails the build is
 *      reported as failed and the previous graph stays untouched.
 *   3. Create relationships in batches by type, each batch in its own transaction. A failed batch is a
 *      warning, not a failed build.
 *
 * Builds of one project are serialized by a per-project lock. Builds of different projects run in parallel.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class GraphBuilder {

    private final GraphStoreDriver graphStoreDriver;
    private final CanonicalIdGenerator idGenerator;
    private final CodeGraphProperties properties;
    private final ApplicationEventPublisher eventPublisher;

    private final ConcurrentMap<String, ReentrantLock> projectLocks = new ConcurrentHashMap<>();

    // ========================= PUBLIC API =========================

    public BuildResult build(String projectId, List<CodeEntity> entities, List<Relationship> relationships) {
        ReentrantLock current = projectLocks.get(projectId);
        if (current != null && current.isLocked()) {
            log.info("[ckg-builder] Build for project {} is waiting for the running build to finish", projectId);
        }
        BuildResult result;
        ReentrantLock lock = acquire(projectId);
        try {
            result = doBuild(projectId, entities, relationships);
        } finally {
            lock.unlock();
        }
        eventPublisher.publishEvent(new GraphBuildCompletedEvent(projectId, result));
        return result;
    }

    /**
     * Remove every node and relationship of a project. Waits for a running build of the same project.
     *
     * @return number of deleted nodes
     * @throws com.architecture.memory.codegraph.exception.GraphWriteException if the store rejects the delete
     */
    public int deleteProjectGraph(String projectId) {
        ReentrantLock lock = acquire(projectId);
        try {
            log.info("[ckg-builder] Deleting graph for project {}", projectId);
            WriteResult result = graphStoreDriver.runWrite(List.of(GraphStatement.deleteProject(projectId)));
            log.info("[ckg-builder] Deleted {} nodes and {} relationships for project {}",
                    result.getNodesDeleted(), result.getRelationshipsDeleted(), projectId);
            return result.getNodesDeleted();
        } finally {
            if (!lock.hasQueuedThreads()) {
                projectLocks.remove(projectId, lock);
            }
            lock.unlock();
        }
    }

    public boolean isBuildInProgress(String projectId) {
        ReentrantLock lock = projectLocks.get(projectId);
        return lock != null && lock.isLocked();
    }

    /**
     * Block until no build of the project is running, or the timeout elapses.
     *
     * @return true if no build is running anymore
     */
    public boolean awaitBuildCompletion(String projectId, Duration timeout) {
        ReentrantLock lock = projectLocks.get(projectId);
        if (lock == null) {
            return true;
        }
        try {
            if (lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                lock.unlock();
                return true;
            }
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public boolean awaitBuildCompletion(String projectId) {
        return awaitBuildCompletion(projectId, Duration.ofMillis(properties.getBuilder().getLockTimeoutMs()));
    }

    // ========================= BUILD =========================

    private BuildResult doBuild(String projectId, List<CodeEntity> entities, List<Relationship> relationships) {
        long start = System.currentTimeMillis();
        log.info("[ckg-builder] Building graph for project {}: {} entities, {} relationships",
                projectId, entities.size(), relationships.size());

        BuildResult result = BuildResult.builder().projectId(projectId).build();

        Map<String, CodeEntity> nodes = collectNodes(projectId, entities, result);
        List<Relationship> edges = collectRelationships(projectId, nodes, relationships, result);

        // nodes
        Map<EntityKind, List<Map<String, Object>>> nodeRows = new EnumMap<>(EntityKind.class);
        for (CodeEntity entity : nodes.values()) {
            nodeRows.computeIfAbsent(entity.getKind(), k -> new ArrayList<>()).add(GraphRowMapper.toRow(projectId, entity));
        }
        List<GraphStatement> nodeStatements = new ArrayList<>();
        nodeStatements.add(GraphStatement.deleteProject(projectId));
        nodeRows.forEach((kind, rows) -> {
            for (List<Map<String, Object>> chunk : partition(rows, batchSize())) {
                nodeStatements.add(GraphStatement.createNodes(projectId, kind, chunk));
            }
            result.getNodesByKind().put(kind, rows.size());
        });

        WriteResult nodeWrite = writeNodes(projectId, nodeStatements, result);
        if (nodeWrite == null) {
            result.setSuccess(false);
            result.getNodesByKind().clear();
            result.setBuildDurationMs(System.currentTimeMillis() - start);
            return result;
        }
        result.setNodesCreated(nodeWrite.getNodesCreated());

        // relationships
        Map<RelationshipType, List<Map<String, Object>>> edgeRows = new EnumMap<>(RelationshipType.class);
        for (Relationship relationship : edges) {
            edgeRows.computeIfAbsent(relationship.getType(), k -> new ArrayList<>())
                    .add(GraphRowMapper.toRow(projectId, relationship));
        }
        edgeRows.forEach((type, rows) -> {
            for (List<Map<String, Object>> chunk : partition(rows, batchSize())) {
                writeRelationships(projectId, type, chunk, result);
            }
        });

        result.setSuccess(true);
        result.setBuildDurationMs(System.currentTimeMillis() - start);
        log.info("[ckg-builder] Graph for project {} built in {} ms: {} nodes, {} relationships, {} dropped, {} warning(s)",
                projectId, result.getBuildDurationMs(), result.getNodesCreated(), result.getRelationshipsCreated(),
                result.getDroppedRelationships(), result.getWarnings().size());
        if (result.getBuildDurationMs() > properties.getSlowOperationThresholdMs()) {
            log.warn("[ckg-builder] Slow build for project {}: {} ms (threshold {} ms)",
                    projectId, result.getBuildDurationMs(), properties.getSlowOperationThresholdMs());
        }
        return result;
    }

    /**
     * Project node first, then entities in input order, first occurrence of an id wins.
     */
    private Map<String, CodeEntity> collectNodes(String projectId, List<CodeEntity> entities, BuildResult result) {
        Map<String, CodeEntity> nodes = new LinkedHashMap<>();
        CodeEntity project = CodeEntity.builder()
                .id(idGenerator.generateProjectId(projectId))
                .kind(EntityKind.PROJECT)
                .name(projectId)
                .qualifiedName(projectId)
                .filePath("")
                .visibility(Visibility.DEFAULT)
                .build();
        nodes.put(project.getId(), project);

        for (CodeEntity entity : entities) {
            if (entity == null || entity.getId() == null || entity.getKind() == null) {
                result.getWarnings().add("Entity without id or kind ignored: " + (entity != null ? entity.getName() : null));
                continue;
            }
            if (entity.getKind() == EntityKind.PROJECT) {
                continue;
            }
            if (nodes.putIfAbsent(entity.getId(), entity) != null) {
                result.getWarnings().add("Duplicate entity id ignored: " + entity.getId());
                log.debug("[ckg-builder] Duplicate entity id ignored: {}", entity.getId());
            }
        }
        return nodes;
    }

    /**
     * Deduplicates by (type, source, target) and drops relationships with an endpoint outside this build.
     * Files are attached to the project node.
     */
    private List<Relationship> collectRelationships(String projectId, Map<String, CodeEntity> nodes,
                                                    List<Relationship> relationships, BuildResult result) {
        Map<String, Relationship> edges = new LinkedHashMap<>();
        String projectNodeId = idGenerator.generateProjectId(projectId);
        for (CodeEntity entity : nodes.values()) {
            if (entity.getKind() == EntityKind.FILE) {
                Relationship contains = Relationship.contains(projectNodeId, entity.getId(), 0);
                edges.put(contains.key(), contains);
            }
        }

        for (Relationship relationship : relationships) {
            if (relationship == null || relationship.getType() == null) {
                result.getWarnings().add("Relationship without type ignored");
                continue;
            }
            String missing = !nodes.containsKey(relationship.getSourceId()) ? "source " + relationship.getSourceId()
                    : !nodes.containsKey(relationship.getTargetId()) ? "target " + relationship.getTargetId()
                    : null;
            if (missing != null) {
                result.setDroppedRelationships(result.getDroppedRelationships() + 1);
                String warning = String.format("Dropped %s relationship %s -> %s: %s not found",
                        relationship.getType(), relationship.getSourceId(), relationship.getTargetId(), missing);
                result.getWarnings().add(warning);
                log.warn("[ckg-builder] {}", warning);
                continue;
            }
            Relationship existing = edges.putIfAbsent(relationship.key(), relationship);
            if (existing != null && existing.getConfidence() == Confidence.HEURISTIC
                    && relationship.getConfidence() == Confidence.EXACT) {
                edges.put(relationship.key(), relationship);
            }
        }
        return new ArrayList<>(edges.values());
    }

    private WriteResult writeNodes(String projectId, List<GraphStatement> statements, BuildResult result) {
        int maxAttempts = 1 + Math.max(0, properties.getBuilder().getMaxRetries());
        CodeGraphException lastFailure = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            result.setAttempts(attempt);
            try {
                return graphStoreDriver.runWrite(statements);
            } catch (CodeGraphException e) {
                lastFailure = e;
                log.warn("[ckg-builder] Node write for project {} failed (attempt {}/{}): {}",
                        projectId, attempt, maxAttempts, e.getMessage());
            }
        }
        String error = String.format("Node write failed after %d attempt(s), previous graph kept: %s",
                maxAttempts, lastFailure != null ? lastFailure.getMessage() : "unknown error");
        result.getErrors().add(error);
        log.error("[ckg-builder] Build for project {} failed: {}", projectId, error, lastFailure);
        return null;
    }

    private void writeRelationships(String projectId, RelationshipType type, List<Map<String, Object>> rows,
                                    BuildResult result) {
        try {
            WriteResult write = graphStoreDriver.runWrite(List.of(GraphStatement.createRelationships(projectId, type, rows)));
            result.setRelationshipsCreated(result.getRelationshipsCreated() + write.getRelationshipsCreated());
            result.getRelationshipsByType().merge(type, write.getRelationshipsCreated(), Integer::sum);
        } catch (CodeGraphException e) {
            String warning = String.format("Failed to write %d %s relationship(s): %s", rows.size(), type, e.getMessage());
            result.getWarnings().add(warning);
            log.warn("[ckg-builder] Project {}: {}", projectId, warning);
        }
    }

    // ========================= HELPERS =========================

    /**
     * Locks the project's current lock. A lock dropped from the map by a delete while this thread
     * waited on it is released and the lookup repeated.
     */
    private ReentrantLock acquire(String projectId) {
        while (true) {
            ReentrantLock lock = projectLocks.computeIfAbsent(projectId, id -> new ReentrantLock(true));
            lock.lock();
            if (projectLocks.get(projectId) == lock) {
                return lock;
            }
            lock.unlock();
        }
    }

    int trackedProjectCount() {
        return projectLocks.size();
    }

    private int batchSize() {
        return Math.max(1, properties.getBuilder().getBatchSize());
    }

    static <T> List<List<T>> partition(List<T> items, int size) {
        List<List<T>> chunks = new ArrayList<>();
        for (int i = 0; i < items.size(); i += size) {
            chunks.add(items.subList(i, Math.min(items.size(), i + size)));
        }
        return chunks;
    }
}
