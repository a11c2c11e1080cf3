package com.architecture.memory.codegraph.repository.graph;

import com.architecture.memory.codegraph.exception.GraphWriteException;
import com.architecture.memory.codegraph.exception.QueryException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;

/**
 * Process-local graph store. A write transaction works on copies of the project slices it touches
 * and swaps them in only when every statement succeeded, so readers never see a partial write.
 */
@Slf4j
public class InMemoryGraphStoreDriver implements GraphStoreDriver {

    private static final Comparator<Map<String, Object>> RELATIONSHIP_ORDER = Comparator
            .comparing((Map<String, Object> row) -> String.valueOf(row.get("sourceId")))
            .thenComparing(row -> String.valueOf(row.get("targetId")))
            .thenComparing(row -> String.valueOf(row.get("type")));

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private Map<String, ProjectSlice> projects = new HashMap<>();
    private volatile boolean connected;

    @Override
    public void connect(GraphStoreSettings settings) {
        connected = true;
        log.info("[ckg-store] Using in-memory graph store");
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public String getName() {
        return "memory";
    }

    @Override
    public void close() {
        connected = false;
    }

    // ========================= READS =========================

    @Override
    public List<Map<String, Object>> runRead(ReadQuery query, Map<String, Object> params) {
        requireConnected();
        lock.readLock().lock();
        try {
            ProjectSlice slice = projects.getOrDefault(String.valueOf(params.get("projectId")), new ProjectSlice());
            switch (query) {
                case ENTITY_BY_ID:
                    return entities(slice, row -> Objects.equals(row.get("id"), params.get("id")));
                case ENTITIES_BY_IDS: {
                    Set<Object> ids = asSet(params.get("ids"));
                    return entities(slice, row -> ids.contains(row.get("id")));
                }
                case ENTITIES_BY_QUALIFIED_NAME:
                    return entities(slice, row -> Objects.equals(row.get("qualifiedName"), params.get("qualifiedName")));
                case ENTITIES_BY_FILE:
                    return entities(slice, row -> Objects.equals(row.get("filePath"), params.get("filePath")));
                case PROJECT_ENTITIES: {
                    Set<Object> kinds = asSet(params.get("kinds"));
                    return entities(slice, row -> kinds.isEmpty() || kinds.contains(row.get("kind")));
                }
                case PROJECT_RELATIONSHIPS:
                    return relationships(slice, typeFilter(params));
                case OUTGOING_RELATIONSHIPS: {
                    Set<Object> ids = asSet(params.get("ids"));
                    return relationships(slice, typeFilter(params).and(row -> ids.contains(row.get("sourceId"))));
                }
                case INCOMING_RELATIONSHIPS: {
                    Set<Object> ids = asSet(params.get("ids"));
                    return relationships(slice, typeFilter(params).and(row -> ids.contains(row.get("targetId"))));
                }
                case COUNT_ENTITIES_BY_KIND:
                    return counts(slice.nodes.values(), "kind");
                case COUNT_RELATIONSHIPS_BY_TYPE:
                    return counts(slice.relationships.values(), "type");
                default:
                    throw new QueryException("Unsupported query: " + query);
            }
        } finally {
            lock.readLock().unlock();
        }
    }

    private List<Map<String, Object>> entities(ProjectSlice slice, Predicate<Map<String, Object>> filter) {
        List<Map<String, Object>> rows = new ArrayList<>();
        new TreeMap<>(slice.nodes).values().stream()
                .filter(filter)
                .forEach(row -> rows.add(new HashMap<>(row)));
        return rows;
    }

    private List<Map<String, Object>> relationships(ProjectSlice slice, Predicate<Map<String, Object>> filter) {
        List<Map<String, Object>> rows = new ArrayList<>();
        slice.relationships.values().stream()
                .filter(filter)
                .sorted(RELATIONSHIP_ORDER)
                .forEach(row -> {
                    Map<String, Object> copy = new HashMap<>();
                    copy.put("sourceId", row.get("sourceId"));
                    copy.put("targetId", row.get("targetId"));
                    copy.put("type", row.get("type"));
                    copy.put("confidence", row.get("confidence"));
                    copy.put("sourceLine", row.get("sourceLine"));
                    rows.add(copy);
                });
        return rows;
    }

    private List<Map<String, Object>> counts(Collection<Map<String, Object>> rows, String key) {
        Map<String, Long> counts = new TreeMap<>();
        rows.forEach(row -> counts.merge(String.valueOf(row.get(key)), 1L, Long::sum));
        List<Map<String, Object>> result = new ArrayList<>();
        counts.forEach((value, count) -> {
            Map<String, Object> row = new HashMap<>();
            row.put(key, value);
            row.put("count", count);
            result.add(row);
        });
        return result;
    }

    private Predicate<Map<String, Object>> typeFilter(Map<String, Object> params) {
        Set<Object> types = asSet(params.get("types"));
        return row -> types.isEmpty() || types.contains(row.get("type"));
    }

    private Set<Object> asSet(Object value) {
        if (value instanceof Collection<?>) {
            return new LinkedHashSet<>((Collection<?>) value);
        }
        return Set.of();
    }

    // ========================= WRITES =========================

    @Override
    public WriteResult runWrite(List<GraphStatement> statements) {
        requireConnected();
        lock.writeLock().lock();
        try {
            Map<String, ProjectSlice> working = new HashMap<>(projects);
            Set<String> copied = new LinkedHashSet<>();
            WriteResult result = new WriteResult();
            for (GraphStatement statement : statements) {
                String projectId = statement.getProjectId();
                if (copied.add(projectId)) {
                    ProjectSlice current = working.get(projectId);
                    working.put(projectId, current != null ? current.copy() : new ProjectSlice());
                }
                apply(working.get(projectId), statement, result);
            }
            projects = working;
            return result;
        } catch (GraphWriteException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new GraphWriteException("In-memory write transaction rolled back: " + e.getMessage(), e);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void apply(ProjectSlice slice, GraphStatement statement, WriteResult result) {
        switch (statement.getOperation()) {
            case DELETE_PROJECT:
                result.setNodesDeleted(result.getNodesDeleted() + slice.nodes.size());
                result.setRelationshipsDeleted(result.getRelationshipsDeleted() + slice.relationships.size());
                slice.nodes.clear();
                slice.relationships.clear();
                break;
            case CREATE_NODES:
                for (Map<String, Object> row : statement.getRows()) {
                    String id = (String) row.get("id");
                    if (id == null) {
                        throw new GraphWriteException("Node row without id for kind " + statement.getKind());
                    }
                    Map<String, Object> node = new HashMap<>(row);
                    node.put("kind", statement.getKind().getLabel());
                    if (slice.nodes.put(id, node) == null) {
                        result.setNodesCreated(result.getNodesCreated() + 1);
                    }
                }
                break;
            case CREATE_RELATIONSHIPS:
                String type = statement.getRelationshipType().name();
                for (Map<String, Object> row : statement.getRows()) {
                    Object sourceId = row.get("sourceId");
                    Object targetId = row.get("targetId");
                    // same semantics as MATCH: rows with a missing endpoint create nothing
                    if (!slice.nodes.containsKey(sourceId) || !slice.nodes.containsKey(targetId)) {
                        continue;
                    }
                    Map<String, Object> relationship = new HashMap<>(row);
                    relationship.put("type", type);
                    String key = type + ":" + sourceId + "->" + targetId;
                    if (slice.relationships.put(key, relationship) == null) {
                        result.setRelationshipsCreated(result.getRelationshipsCreated() + 1);
                    }
                }
                break;
            default:
                throw new GraphWriteException("Unsupported statement: " + statement.getOperation());
        }
    }

    private void requireConnected() {
        if (!connected) {
            throw new IllegalStateException("In-memory graph store is not connected");
        }
    }

    private static class ProjectSlice {
        private final Map<String, Map<String, Object>> nodes = new LinkedHashMap<>();
        private final Map<String, Map<String, Object>> relationships = new LinkedHashMap<>();

        private ProjectSlice copy() {
            ProjectSlice copy = new ProjectSlice();
            copy.nodes.putAll(nodes);
            copy.relationships.putAll(relationships);
            return copy;
        }
    }
}
