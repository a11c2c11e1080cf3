package com.architecture.memory.codegraph.service.analysis;

import com.architecture.memory.codegraph.config.CodeGraphProperties;
import com.architecture.memory.codegraph.dto.ChangeSet;
import com.architecture.memory.codegraph.dto.analysis.AnalysisFinding;
import com.architecture.memory.codegraph.dto.analysis.AnalysisResult;
import com.architecture.memory.codegraph.dto.analysis.AnalysisSeverity;
import com.architecture.memory.codegraph.dto.analysis.FindingType;
import com.architecture.memory.codegraph.dto.analysis.ImpactType;
import com.architecture.memory.codegraph.dto.analysis.ImpactedEntity;
import com.architecture.memory.codegraph.dto.analysis.RiskAssessment;
import com.architecture.memory.codegraph.dto.graph.CallDirection;
import com.architecture.memory.codegraph.dto.graph.TraversalHit;
import com.architecture.memory.codegraph.exception.QueryException;
import com.architecture.memory.codegraph.model.graph.CodeEntity;
import com.architecture.memory.codegraph.model.graph.EntityKind;
import com.architecture.memory.codegraph.service.graph.query.GraphQueryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Change-impact assessment of a pull request over the call graph of the last build.
 * Emits one finding per changed or deleted entity name, plus one per changed file whose
 * methods are called from other files.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PRImpactAnalyzer {

    static final String MODULE = "PRImpactAnalyzer";

    private static final int DESCRIPTION_NAME_LIMIT = 5;

    private final GraphQueryService graphQueryService;
    private final RiskScorer riskScorer;
    private final CodeGraphProperties properties;

    public AnalysisResult analyze(String projectId, ChangeSet changeSet) {
        return analyze(projectId, changeSet, properties.getImpact().getDefaultDepth());
    }

    /**
     * @param depth maximum CALLS distance followed in each direction
     */
    public AnalysisResult analyze(String projectId, ChangeSet changeSet, int depth) {
        long start = System.currentTimeMillis();
        AnalysisResult result = AnalysisResult.builder()
                .analysisType("pr-impact")
                .projectId(projectId)
                .build();
        if (changeSet == null) {
            result.getWarnings().add("Empty change set");
            return result;
        }

        Set<String> deleted = new LinkedHashSet<>(changeSet.getDeletedEntityNames());
        Set<String> names = new LinkedHashSet<>(changeSet.getChangedEntityNames());
        names.addAll(deleted);
        log.info("[ckg-impact] Analyzing {} changed entit(ies) and {} file(s) of project {} at depth {}",
                names.size(), changeSet.getChangedFiles().size(), projectId, depth);

        try {
            List<AnalysisFinding> findings = new ArrayList<>();
            for (String name : names) {
                findings.add(analyzeEntity(projectId, name, deleted.contains(name), depth));
            }
            for (String file : new LinkedHashSet<>(changeSet.getChangedFiles())) {
                AnalysisFinding fileFinding = analyzeFile(projectId, file);
                if (fileFinding != null) {
                    findings.add(fileFinding);
                }
            }
            result.setFindings(findings);
        } catch (QueryException e) {
            log.error("[ckg-impact] Impact analysis of project {} failed: {}", projectId, e.getMessage(), e);
            result.setSuccess(false);
            result.getFindings().clear();
            result.getErrors().add("Graph query failed: " + e.getMessage());
        }

        result.setDurationMs(System.currentTimeMillis() - start);
        log.info("[ckg-impact] Project {}: {} finding(s) in {} ms", projectId,
                result.getFindings().size(), result.getDurationMs());
        return result;
    }

    // ========================= ENTITY IMPACT =========================

    /**
     * Impact of one qualified name. All graph entities carrying the name (overloads, same name in
     * several languages) are merged into one finding.
     *
     * @throws QueryException if the graph cannot be read
     */
    public AnalysisFinding analyzeEntity(String projectId, String qualifiedName, boolean deleted, int depth) {
        List<CodeEntity> matches = graphQueryService.findEntitiesByQualifiedName(projectId, qualifiedName);
        if (matches.isEmpty()) {
            log.debug("[ckg-impact] {} not in graph of project {}", qualifiedName, projectId);
            return unknownImpact(qualifiedName, deleted);
        }

        List<CodeEntity> targets = expandTargets(projectId, matches);
        Set<String> targetIds = new LinkedHashSet<>();
        targets.forEach(target -> targetIds.add(target.getId()));

        Map<String, ImpactedEntity> callers = collect(projectId, targets, targetIds, CallDirection.CALLERS, depth);
        Map<String, ImpactedEntity> callees = collect(projectId, targets, targetIds, CallDirection.CALLEES, depth);

        CodeEntity primary = matches.get(0);
        if (callers.isEmpty() && callees.isEmpty()) {
            return isolatedChange(primary, qualifiedName, deleted);
        }

        List<ImpactedEntity> affected = new ArrayList<>(callers.values());
        affected.addAll(callees.values());
        affected.sort(Comparator.comparingInt(ImpactedEntity::getDepth)
                .thenComparing(ImpactedEntity::getDirection)
                .thenComparing(ImpactedEntity::getEntityId));

        int direct = (int) affected.stream().filter(a -> a.getImpactType() == ImpactType.DIRECT).count();
        int indirect = affected.size() - direct;
        int fanIn = (int) callers.values().stream().filter(a -> a.getImpactType() == ImpactType.DIRECT).count();
        boolean deletedWithCallers = deleted && !callers.isEmpty();

        RiskAssessment risk = riskScorer.assessChange(direct, indirect, fanIn, deletedWithCallers);
        log.debug("[ckg-impact] {}: {} caller(s), {} callee(s), risk {}", qualifiedName,
                callers.size(), callees.size(), risk.getOverallScore());

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("entityIds", new ArrayList<>(targetIds));
        metadata.put("deleted", deleted);
        metadata.put("depth", depth);
        metadata.put("directCount", direct);
        metadata.put("indirectCount", indirect);
        metadata.put("fanIn", fanIn);

        return AnalysisFinding.builder()
                .findingType(FindingType.CHANGE_IMPACT)
                .title((deleted ? "Deletion impact: " : "Change impact: ") + qualifiedName)
                .description(describe(qualifiedName, callers.values(), callees.values()))
                .severity(risk.getSeverity())
                .filePath(primary.getFilePath())
                .startLine(primary.getStartLine())
                .endLine(primary.getEndLine())
                .affectedEntities(new ArrayList<>(List.of(qualifiedName)))
                .impactedEntities(affected)
                .risk(risk)
                .analysisModule(MODULE)
                .confidenceScore(1.0)
                .recommendations(recommendations(deleted, fanIn, callers.values(), indirect))
                .metadata(metadata)
                .build();
    }

    /**
     * A changed type is called through its methods.
     */
    private List<CodeEntity> expandTargets(String projectId, List<CodeEntity> matches) {
        List<CodeEntity> targets = new ArrayList<>(matches);
        for (CodeEntity match : matches) {
            if (match.getKind() != null && match.getKind().isType() && match.getFilePath() != null) {
                for (CodeEntity member : graphQueryService.findEntitiesInFile(projectId, match.getFilePath())) {
                    if (member.getKind() == EntityKind.METHOD && match.getId().equals(member.getParentId())) {
                        targets.add(member);
                    }
                }
            }
        }
        return targets;
    }

    private Map<String, ImpactedEntity> collect(String projectId, List<CodeEntity> targets, Set<String> targetIds,
                                                CallDirection direction, int depth) {
        Map<String, ImpactedEntity> impacted = new TreeMap<>();
        for (CodeEntity target : targets) {
            for (TraversalHit hit : graphQueryService.traverseCalls(projectId, target.getId(), direction, depth)) {
                CodeEntity entity = hit.getEntity();
                if (targetIds.contains(entity.getId())) {
                    continue;
                }
                ImpactedEntity existing = impacted.get(entity.getId());
                if (existing == null || hit.getDepth() < existing.getDepth()) {
                    impacted.put(entity.getId(), ImpactedEntity.builder()
                            .entityId(entity.getId())
                            .qualifiedName(entity.getQualifiedName())
                            .kind(entity.getKind())
                            .filePath(entity.getFilePath())
                            .depth(hit.getDepth())
                            .impactType(ImpactType.forDepth(hit.getDepth()))
                            .direction(direction)
                            .build());
                }
            }
        }
        return impacted;
    }

    private AnalysisFinding unknownImpact(String qualifiedName, boolean deleted) {
        return AnalysisFinding.builder()
                .findingType(FindingType.UNKNOWN_IMPACT)
                .title("Unknown impact - newly introduced entity: " + qualifiedName)
                .description(deleted
                        ? qualifiedName + " is marked as deleted but is not in the current graph"
                        : qualifiedName + " is not in the current graph; it is probably introduced by this change")
                .severity(AnalysisSeverity.INFO)
                .affectedEntities(new ArrayList<>(List.of(qualifiedName)))
                .analysisModule(MODULE)
                .confidenceScore(0.5)
                .recommendations(new ArrayList<>(List.of("Rescan the project after merging to include " + qualifiedName)))
                .build();
    }

    private AnalysisFinding isolatedChange(CodeEntity entity, String qualifiedName, boolean deleted) {
        RiskAssessment risk = riskScorer.assessChange(0, 0, 0, false);
        return AnalysisFinding.builder()
                .findingType(FindingType.ISOLATED_CHANGE)
                .title("Isolated change: " + qualifiedName)
                .description(qualifiedName + (deleted ? " is removed and" : "") + " has no callers or callees in the project")
                .severity(AnalysisSeverity.INFO)
                .filePath(entity.getFilePath())
                .startLine(entity.getStartLine())
                .endLine(entity.getEndLine())
                .affectedEntities(new ArrayList<>(List.of(qualifiedName)))
                .impactedEntities(new ArrayList<>())
                .risk(risk)
                .analysisModule(MODULE)
                .confidenceScore(1.0)
                .build();
    }

    private String describe(String qualifiedName, Collection<ImpactedEntity> callers,
                            Collection<ImpactedEntity> callees) {
        StringBuilder description = new StringBuilder();
        description.append(qualifiedName).append(" affects ")
                .append(callers.size()).append(" caller(s) and ")
                .append(callees.size()).append(" callee(s).");
        if (!callers.isEmpty()) {
            description.append(" Callers: ").append(names(callers)).append('.');
        }
        if (!callees.isEmpty()) {
            description.append(" Callees: ").append(names(callees)).append('.');
        }
        return description.toString();
    }

    private String names(Collection<ImpactedEntity> impacted) {
        List<String> names = impacted.stream()
                .sorted(Comparator.comparingInt(ImpactedEntity::getDepth).thenComparing(ImpactedEntity::getEntityId))
                .map(ImpactedEntity::getQualifiedName)
                .toList();
        String shown = String.join(", ", names.subList(0, Math.min(DESCRIPTION_NAME_LIMIT, names.size())));
        return names.size() > DESCRIPTION_NAME_LIMIT
                ? shown + " and " + (names.size() - DESCRIPTION_NAME_LIMIT) + " more"
                : shown;
    }

    private List<String> recommendations(boolean deleted, int fanIn, Collection<ImpactedEntity> callers,
                                         int indirect) {
        List<String> recommendations = new ArrayList<>();
        if (deleted && !callers.isEmpty()) {
            recommendations.add("Update or remove the " + callers.size() + " caller(s) before deleting this entity");
        }
        if (fanIn > properties.getImpact().getHighFanInThreshold()) {
            recommendations.add("High fan-in (" + fanIn + " direct callers): consider a gradual rollout or a feature flag");
        }
        if (indirect > 0) {
            recommendations.add("Run integration tests covering the " + indirect + " indirectly affected entit(ies)");
        }
        if (recommendations.isEmpty()) {
            recommendations.add("Review the directly affected entities");
        }
        return recommendations;
    }

    // ========================= FILE IMPACT =========================

    /**
     * Methods of a changed file that are called from other files.
     *
     * @return null if no method of the file has callers outside it
     */
    public AnalysisFinding analyzeFile(String projectId, String filePath) {
        Map<String, List<String>> externalCallers = new TreeMap<>();
        Set<String> callerFiles = new LinkedHashSet<>();
        for (CodeEntity entity : graphQueryService.findEntitiesInFile(projectId, filePath)) {
            if (entity.getKind() != EntityKind.METHOD) {
                continue;
            }
            for (TraversalHit hit : graphQueryService.findCallers(projectId, entity.getId())) {
                CodeEntity caller = hit.getEntity();
                if (caller.getFilePath() != null && !caller.getFilePath().equals(filePath)) {
                    externalCallers.computeIfAbsent(entity.getQualifiedName(), k -> new ArrayList<>())
                            .add(caller.getQualifiedName());
                    callerFiles.add(caller.getFilePath());
                }
            }
        }
        if (externalCallers.isEmpty()) {
            return null;
        }

        int callerCount = externalCallers.values().stream().mapToInt(List::size).sum();
        RiskAssessment risk = riskScorer.assessChange(callerCount, 0, callerCount, false);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("calledMethods", externalCallers);
        metadata.put("callerFiles", new ArrayList<>(callerFiles));

        return AnalysisFinding.builder()
                .findingType(FindingType.FILE_IMPACT)
                .title("File impact: " + filePath)
                .description(String.format("%d method(s) of %s are called from %d other file(s)",
                        externalCallers.size(), filePath, callerFiles.size()))
                .severity(risk.getSeverity())
                .filePath(filePath)
                .affectedEntities(new ArrayList<>(externalCallers.keySet()))
                .risk(risk)
                .analysisModule(MODULE)
                .confidenceScore(1.0)
                .recommendations(new ArrayList<>(List.of("Review the callers in " + String.join(", ", callerFiles))))
                .metadata(metadata)
                .build();
    }
}
