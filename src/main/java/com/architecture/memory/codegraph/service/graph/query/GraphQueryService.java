package com.architecture.memory.codegraph.service.graph.query;

import com.architecture.memory.codegraph.dto.graph.ApiSurfaceEntry;
import com.architecture.memory.codegraph.dto.graph.CallDirection;
import com.architecture.memory.codegraph.dto.graph.CallPattern;
import com.architecture.memory.codegraph.dto.graph.CircularDependency;
import com.architecture.memory.codegraph.dto.graph.ClassComplexity;
import com.architecture.memory.codegraph.dto.graph.ProjectOverview;
import com.architecture.memory.codegraph.dto.graph.RefactoringCandidate;
import com.architecture.memory.codegraph.dto.graph.TraversalHit;
import com.architecture.memory.codegraph.model.graph.CodeEntity;
import com.architecture.memory.codegraph.model.graph.Confidence;
import com.architecture.memory.codegraph.model.graph.EntityKind;
import com.architecture.memory.codegraph.model.graph.Relationship;
import com.architecture.memory.codegraph.model.graph.RelationshipType;
import com.architecture.memory.codegraph.model.graph.Visibility;
import com.architecture.memory.codegraph.repository.graph.GraphRowMapper;
import com.architecture.memory.codegraph.repository.graph.GraphStoreDriver;
import com.architecture.memory.codegraph.repository.graph.ReadQuery;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Read-only operations over the persisted graph of a project.
 *
 * Nothing is cached: every call reads the store, so concurrent calls are independent.
 * Store failures surface as {@link com.architecture.memory.codegraph.exception.QueryException}
 * and are never turned into empty results.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class GraphQueryService {

    private static final List<String> DEPENDENCY_TYPES = List.of(
            RelationshipType.CALLS.name(), RelationshipType.REFERENCES.name(), RelationshipType.EXTENDS.name());

    private static final int REFACTORING_CALL_THRESHOLD = 5;
    private static final int REFACTORING_LIMIT = 10;

    private final GraphStoreDriver graphStoreDriver;

    // ========================= ENTITY QUERIES =========================

    public ProjectOverview getProjectOverview(String projectId) {
        ProjectOverview overview = ProjectOverview.builder().projectId(projectId).build();
        for (Map<String, Object> row : read(ReadQuery.COUNT_ENTITIES_BY_KIND, projectId, Map.of())) {
            overview.getEntityCounts().put(EntityKind.fromLabel(String.valueOf(row.get("kind"))),
                    GraphRowMapper.asLong(row.get("count")));
        }
        for (Map<String, Object> row : read(ReadQuery.COUNT_RELATIONSHIPS_BY_TYPE, projectId, Map.of())) {
            overview.getRelationshipCounts().put(RelationshipType.valueOf(String.valueOf(row.get("type"))),
                    GraphRowMapper.asLong(row.get("count")));
        }
        log.debug("[ckg-query] Overview of project {}: {} entities, {} relationships",
                projectId, overview.getTotalEntities(), overview.getTotalRelationships());
        return overview;
    }

    public Optional<CodeEntity> findEntity(String projectId, String entityId) {
        return entities(read(ReadQuery.ENTITY_BY_ID, projectId, Map.of("id", entityId))).stream().findFirst();
    }

    public List<CodeEntity> findEntitiesByQualifiedName(String projectId, String qualifiedName) {
        return entities(read(ReadQuery.ENTITIES_BY_QUALIFIED_NAME, projectId, Map.of("qualifiedName", qualifiedName)));
    }

    public List<CodeEntity> findEntitiesInFile(String projectId, String filePath) {
        return entities(read(ReadQuery.ENTITIES_BY_FILE, projectId, Map.of("filePath", filePath)));
    }

    public List<CodeEntity> findEntitiesByKind(String projectId, EntityKind... kinds) {
        List<String> labels = new ArrayList<>();
        for (EntityKind kind : kinds) {
            labels.add(kind.getLabel());
        }
        return entities(read(ReadQuery.PROJECT_ENTITIES, projectId, Map.of("kinds", labels)));
    }

    // ========================= CALL TRAVERSAL =========================

    public List<TraversalHit> findCallers(String projectId, String entityId) {
        return findCallers(projectId, entityId, 1);
    }

    /**
     * Entities reaching {@code entityId} through at most {@code maxDepth} CALLS edges, each with its shortest distance.
     */
    public List<TraversalHit> findCallers(String projectId, String entityId, int maxDepth) {
        return traverseCalls(projectId, entityId, CallDirection.CALLERS, maxDepth);
    }

    public List<TraversalHit> findCallees(String projectId, String entityId) {
        return findCallees(projectId, entityId, 1);
    }

    public List<TraversalHit> findCallees(String projectId, String entityId, int maxDepth) {
        return traverseCalls(projectId, entityId, CallDirection.CALLEES, maxDepth);
    }

    /**
     * Breadth-first traversal of CALLS edges. The start entity is never part of the result, even when
     * it is reachable from itself. Hits are ordered by depth, then id.
     */
    public List<TraversalHit> traverseCalls(String projectId, String entityId, CallDirection direction, int maxDepth) {
        if (maxDepth < 1) {
            return List.of();
        }
        ReadQuery query = direction == CallDirection.CALLERS
                ? ReadQuery.INCOMING_RELATIONSHIPS : ReadQuery.OUTGOING_RELATIONSHIPS;

        Map<String, Integer> depths = new LinkedHashMap<>();
        Set<String> visited = new HashSet<>();
        visited.add(entityId);
        List<String> frontier = List.of(entityId);

        for (int depth = 1; depth <= maxDepth && !frontier.isEmpty(); depth++) {
            Map<String, Object> params = new HashMap<>();
            params.put("ids", frontier);
            params.put("types", List.of(RelationshipType.CALLS.name()));
            Set<String> next = new TreeSet<>();
            for (Map<String, Object> row : read(query, projectId, params)) {
                Relationship edge = GraphRowMapper.toRelationship(row);
                String neighbour = direction == CallDirection.CALLERS ? edge.getSourceId() : edge.getTargetId();
                if (visited.add(neighbour)) {
                    next.add(neighbour);
                    depths.put(neighbour, depth);
                }
            }
            frontier = new ArrayList<>(next);
        }

        if (depths.isEmpty()) {
            return List.of();
        }
        Map<String, CodeEntity> found = new HashMap<>();
        for (CodeEntity entity : entities(read(ReadQuery.ENTITIES_BY_IDS, projectId,
                Map.of("ids", new ArrayList<>(depths.keySet()))))) {
            found.put(entity.getId(), entity);
        }
        return depths.entrySet().stream()
                .filter(entry -> found.containsKey(entry.getKey()))
                .map(entry -> TraversalHit.builder().entity(found.get(entry.getKey())).depth(entry.getValue()).build())
                .sorted(Comparator.comparingInt(TraversalHit::getDepth).thenComparing(hit -> hit.getEntity().getId()))
                .toList();
    }

    // ========================= CYCLES =========================

    /**
     * Cycles among entities of one scope. CLASS and INTERFACE share the type scope: CALLS, REFERENCES
     * and EXTENDS endpoints are lifted to their nearest containing type. FILE lifts them to the
     * containing file. METHOD uses CALLS edges between methods as they are.
     */
    public List<CircularDependency> findCircularDependencies(String projectId, EntityKind scopeKind) {
        long start = System.currentTimeMillis();
        ProjectGraph graph = loadGraph(projectId, scopeKind == EntityKind.METHOD
                ? List.of(RelationshipType.CALLS.name()) : DEPENDENCY_TYPES);
        Predicate<CodeEntity> inScope = scopePredicate(scopeKind);

        Map<String, Set<String>> adjacency = new TreeMap<>();
        Map<String, Set<String>> edgeTypes = new HashMap<>();
        Map<String, Boolean> edgeHeuristic = new HashMap<>();
        for (Relationship relationship : graph.dependencies) {
            String source = graph.lift(relationship.getSourceId(), inScope);
            String target = graph.lift(relationship.getTargetId(), inScope);
            if (source == null || target == null || source.equals(target)) {
                continue;
            }
            adjacency.computeIfAbsent(source, k -> new TreeSet<>()).add(target);
            String key = source + "->" + target;
            edgeTypes.computeIfAbsent(key, k -> new TreeSet<>()).add(relationship.getType().name());
            boolean heuristic = relationship.getConfidence() == Confidence.HEURISTIC;
            edgeHeuristic.merge(key, heuristic, Boolean::logicalAnd);
        }

        List<CircularDependency> cycles = new ArrayList<>();
        for (List<String> members : StronglyConnectedComponents.findCycles(adjacency)) {
            Set<String> memberSet = new HashSet<>(members);
            List<CircularDependency.CycleEdge> cycleEdges = new ArrayList<>();
            for (String source : members.stream().sorted().toList()) {
                for (String target : adjacency.getOrDefault(source, Set.of())) {
                    if (memberSet.contains(target)) {
                        String key = source + "->" + target;
                        cycleEdges.add(CircularDependency.CycleEdge.builder()
                                .sourceId(source)
                                .targetId(target)
                                .relationshipTypes(new ArrayList<>(edgeTypes.get(key)))
                                .heuristic(edgeHeuristic.getOrDefault(key, false))
                                .build());
                    }
                }
            }
            List<String> names = members.stream().map(graph::displayName).toList();
            cycles.add(CircularDependency.builder()
                    .scopeKind(scopeKind)
                    .entityIds(members)
                    .entityNames(names)
                    .cycleEdges(cycleEdges)
                    .description(String.format("Circular dependency between %d %s: %s -> %s",
                            members.size(), scopeNoun(scopeKind), String.join(" -> ", names), names.get(0)))
                    .build());
        }

        log.info("[ckg-query] Found {} {}-level cycle(s) in project {} ({} ms)",
                cycles.size(), scopeKind.getLabel(), projectId, System.currentTimeMillis() - start);
        return cycles;
    }

    private static Predicate<CodeEntity> scopePredicate(EntityKind scopeKind) {
        switch (scopeKind) {
            case CLASS:
            case INTERFACE:
                return entity -> entity.getKind().isType();
            case FILE:
                return entity -> entity.getKind() == EntityKind.FILE;
            case METHOD:
                return entity -> entity.getKind() == EntityKind.METHOD;
            default:
                throw new IllegalArgumentException("Unsupported cycle scope: " + scopeKind);
        }
    }

    private static String scopeNoun(EntityKind scopeKind) {
        switch (scopeKind) {
            case FILE:
                return "files";
            case METHOD:
                return "methods";
            default:
                return "types";
        }
    }

    // ========================= UNUSED ENTITIES =========================

    public List<CodeEntity> findUnusedEntities(String projectId) {
        return findUnusedEntities(projectId, entity -> false);
    }

    /**
     * Classes, interfaces and methods without incoming CALLS or REFERENCES edges, minus those the
     * exclusion predicate matches. A heuristic: dynamic and reflective use is invisible here.
     */
    public List<CodeEntity> findUnusedEntities(String projectId, Predicate<CodeEntity> exclusion) {
        Set<String> used = new HashSet<>();
        Map<String, Object> params = Map.of("types", List.of(RelationshipType.CALLS.name(), RelationshipType.REFERENCES.name()));
        for (Map<String, Object> row : read(ReadQuery.PROJECT_RELATIONSHIPS, projectId, params)) {
            used.add(String.valueOf(row.get("targetId")));
        }
        List<CodeEntity> unused = findEntitiesByKind(projectId, EntityKind.CLASS, EntityKind.INTERFACE, EntityKind.METHOD)
                .stream()
                .filter(entity -> !used.contains(entity.getId()))
                .filter(entity -> !exclusion.test(entity))
                .sorted(Comparator.comparing(CodeEntity::getId))
                .toList();
        log.debug("[ckg-query] {} unused entities in project {}", unused.size(), projectId);
        return unused;
    }

    // ========================= STRUCTURE METRICS =========================

    /**
     * Complexity per type: methods * 2 + outgoing calls + incoming calls of its methods. Highest first.
     */
    public List<ClassComplexity> analyzeClassComplexity(String projectId) {
        ProjectGraph graph = loadGraph(projectId, List.of(RelationshipType.CALLS.name()));
        Map<String, Integer> methodCount = new HashMap<>();
        Map<String, Integer> outgoing = new HashMap<>();
        Map<String, Integer> incoming = new HashMap<>();
        for (CodeEntity entity : graph.entities.values()) {
            if (entity.getKind() == EntityKind.METHOD) {
                String owner = graph.parents.get(entity.getId());
                if (owner != null) {
                    methodCount.merge(owner, 1, Integer::sum);
                }
            }
        }
        for (Relationship call : graph.dependencies) {
            String callerOwner = graph.parents.get(call.getSourceId());
            String calleeOwner = graph.parents.get(call.getTargetId());
            if (callerOwner != null) {
                outgoing.merge(callerOwner, 1, Integer::sum);
            }
            if (calleeOwner != null) {
                incoming.merge(calleeOwner, 1, Integer::sum);
            }
        }
        return graph.entities.values().stream()
                .filter(entity -> entity.getKind().isType())
                .map(type -> {
                    int methods = methodCount.getOrDefault(type.getId(), 0);
                    int out = outgoing.getOrDefault(type.getId(), 0);
                    int in = incoming.getOrDefault(type.getId(), 0);
                    return ClassComplexity.builder()
                            .entityId(type.getId())
                            .qualifiedName(type.getQualifiedName())
                            .filePath(type.getFilePath())
                            .methodCount(methods)
                            .outgoingCalls(out)
                            .incomingCalls(in)
                            .complexityScore(methods * 2 + out + in)
                            .build();
                })
                .sorted(Comparator.comparingInt(ClassComplexity::getComplexityScore).reversed()
                        .thenComparing(ClassComplexity::getEntityId))
                .toList();
    }

    /**
     * Public types and methods with the number of incoming CALLS and REFERENCES edges. Most used first.
     */
    public List<ApiSurfaceEntry> getPublicApiSurface(String projectId) {
        ProjectGraph graph = loadGraph(projectId,
                List.of(RelationshipType.CALLS.name(), RelationshipType.REFERENCES.name()));
        Map<String, Integer> usage = new HashMap<>();
        for (Relationship relationship : graph.dependencies) {
            usage.merge(relationship.getTargetId(), 1, Integer::sum);
        }
        return graph.entities.values().stream()
                .filter(entity -> entity.getKind().isType() || entity.getKind() == EntityKind.METHOD)
                .filter(entity -> entity.getVisibility() == Visibility.PUBLIC)
                .map(entity -> ApiSurfaceEntry.builder()
                        .entityId(entity.getId())
                        .qualifiedName(entity.getQualifiedName())
                        .kind(entity.getKind())
                        .filePath(entity.getFilePath())
                        .signature(entity.getSignature())
                        .usageCount(usage.getOrDefault(entity.getId(), 0))
                        .build())
                .sorted(Comparator.comparingInt(ApiSurfaceEntry::getUsageCount).reversed()
                        .thenComparing(ApiSurfaceEntry::getQualifiedName, Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
    }

    /**
     * Methods calling more than five other methods, the ten busiest first.
     */
    public List<RefactoringCandidate> findRefactoringCandidates(String projectId) {
        ProjectGraph graph = loadGraph(projectId, List.of(RelationshipType.CALLS.name()));
        Map<String, List<Relationship>> callsBySource = graph.dependencies.stream()
                .collect(Collectors.groupingBy(Relationship::getSourceId));
        return callsBySource.entrySet().stream()
                .filter(entry -> entry.getValue().size() > REFACTORING_CALL_THRESHOLD)
                .filter(entry -> graph.entities.containsKey(entry.getKey()))
                .map(entry -> {
                    CodeEntity method = graph.entities.get(entry.getKey());
                    long calleeTypes = entry.getValue().stream()
                            .map(call -> graph.parents.get(call.getTargetId()))
                            .filter(Objects::nonNull)
                            .distinct()
                            .count();
                    return RefactoringCandidate.builder()
                            .entityId(method.getId())
                            .qualifiedName(method.getQualifiedName())
                            .filePath(method.getFilePath())
                            .outgoingCalls(entry.getValue().size())
                            .calleeTypes((int) calleeTypes)
                            .reason(String.format("Calls %d methods across %d type(s); consider splitting it",
                                    entry.getValue().size(), calleeTypes))
                            .build();
                })
                .sorted(Comparator.comparingInt(RefactoringCandidate::getOutgoingCalls).reversed()
                        .thenComparing(RefactoringCandidate::getEntityId))
                .limit(REFACTORING_LIMIT)
                .toList();
    }

    /**
     * Every resolved call between two methods, flagged when it crosses a type boundary.
     */
    public List<CallPattern> getCallPatterns(String projectId) {
        ProjectGraph graph = loadGraph(projectId, List.of(RelationshipType.CALLS.name()));
        return graph.dependencies.stream()
                .filter(call -> graph.entities.containsKey(call.getSourceId()) && graph.entities.containsKey(call.getTargetId()))
                .map(call -> {
                    String callerOwner = graph.parents.get(call.getSourceId());
                    String calleeOwner = graph.parents.get(call.getTargetId());
                    return CallPattern.builder()
                            .callerId(call.getSourceId())
                            .callerName(graph.entities.get(call.getSourceId()).getQualifiedName())
                            .callerOwner(callerOwner)
                            .calleeId(call.getTargetId())
                            .calleeName(graph.entities.get(call.getTargetId()).getQualifiedName())
                            .calleeOwner(calleeOwner)
                            .crossClass(!Objects.equals(callerOwner, calleeOwner))
                            .heuristic(call.getConfidence() == Confidence.HEURISTIC)
                            .build();
                })
                .sorted(Comparator.comparing(CallPattern::getCallerId).thenComparing(CallPattern::getCalleeId))
                .toList();
    }

    // ========================= HELPERS =========================

    private List<Map<String, Object>> read(ReadQuery query, String projectId, Map<String, Object> params) {
        Map<String, Object> withProject = new HashMap<>(params);
        withProject.put("projectId", projectId);
        return graphStoreDriver.runRead(query, withProject);
    }

    private static List<CodeEntity> entities(List<Map<String, Object>> rows) {
        return rows.stream().map(GraphRowMapper::toEntity).toList();
    }

    private ProjectGraph loadGraph(String projectId, List<String> dependencyTypes) {
        ProjectGraph graph = new ProjectGraph();
        for (CodeEntity entity : entities(read(ReadQuery.PROJECT_ENTITIES, projectId, Map.of("kinds", List.of())))) {
            graph.entities.put(entity.getId(), entity);
        }
        for (Map<String, Object> row : read(ReadQuery.PROJECT_RELATIONSHIPS, projectId,
                Map.of("types", List.of(RelationshipType.CONTAINS.name())))) {
            Relationship contains = GraphRowMapper.toRelationship(row);
            graph.parents.put(contains.getTargetId(), contains.getSourceId());
        }
        for (Map<String, Object> row : read(ReadQuery.PROJECT_RELATIONSHIPS, projectId, Map.of("types", dependencyTypes))) {
            graph.dependencies.add(GraphRowMapper.toRelationship(row));
        }
        return graph;
    }

    /**
     * Snapshot of one project's entities, containment tree and selected dependency edges.
     */
    private static final class ProjectGraph {
        private final Map<String, CodeEntity> entities = new LinkedHashMap<>();
        // child id -> parent id, from CONTAINS edges
        private final Map<String, String> parents = new HashMap<>();
        private final List<Relationship> dependencies = new ArrayList<>();

        /**
         * The entity itself or its nearest container matching the scope; null if none.
         */
        private String lift(String entityId, Predicate<CodeEntity> inScope) {
            String current = entityId;
            Set<String> seen = new HashSet<>();
            while (current != null && seen.add(current)) {
                CodeEntity entity = entities.get(current);
                if (entity != null && inScope.test(entity)) {
                    return current;
                }
                current = parents.get(current);
            }
            return null;
        }

        private String displayName(String entityId) {
            CodeEntity entity = entities.get(entityId);
            return entity != null && entity.getQualifiedName() != null ? entity.getQualifiedName() : entityId;
        }
    }
}
