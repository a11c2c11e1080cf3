package com.architecture.memory.codegraph.service.analysis;

import com.architecture.memory.codegraph.config.CodeGraphProperties;
import com.architecture.memory.codegraph.dto.analysis.AnalysisFinding;
import com.architecture.memory.codegraph.dto.analysis.AnalysisResult;
import com.architecture.memory.codegraph.dto.analysis.AnalysisSeverity;
import com.architecture.memory.codegraph.dto.analysis.FindingType;
import com.architecture.memory.codegraph.dto.graph.CircularDependency;
import com.architecture.memory.codegraph.exception.QueryException;
import com.architecture.memory.codegraph.model.graph.CodeEntity;
import com.architecture.memory.codegraph.model.graph.EntityKind;
import com.architecture.memory.codegraph.model.graph.Visibility;
import com.architecture.memory.codegraph.service.graph.query.GraphQueryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Circular-dependency and unused-entity findings for a built project graph.
 * Reads the graph through {@link GraphQueryService} only.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ArchitecturalAnalyzer {

    static final String MODULE = "ArchitecturalAnalyzer";

    static final String STATIC_ANALYSIS_WARNING = "Static analysis limitations: Cannot detect usage through reflection, "
            + "dependency injection, external APIs, or runtime dynamic calls";

    private final GraphQueryService graphQueryService;
    private final UnusedEntityFilter unusedEntityFilter;
    private final RiskScorer riskScorer;
    private final CodeGraphProperties properties;

    /**
     * Run both analyses. A failed query fails the whole result: no findings are returned from a partial read.
     */
    public AnalysisResult analyze(String projectId) {
        long start = System.currentTimeMillis();
        log.info("[ckg-analyzer] Analyzing architecture of project {}", projectId);
        AnalysisResult result = AnalysisResult.builder()
                .analysisType("architecture")
                .projectId(projectId)
                .build();
        try {
            List<AnalysisFinding> findings = new ArrayList<>(detectCircularDependencies(projectId));
            List<AnalysisFinding> unused = detectUnusedEntities(projectId);
            findings.addAll(unused);
            if (!unused.isEmpty()) {
                result.getWarnings().add(STATIC_ANALYSIS_WARNING);
            }
            result.setFindings(findings);
        } catch (QueryException e) {
            log.error("[ckg-analyzer] Architecture analysis of project {} failed: {}", projectId, e.getMessage(), e);
            result.setSuccess(false);
            result.getFindings().clear();
            result.getErrors().add("Graph query failed: " + e.getMessage());
        }
        result.setDurationMs(System.currentTimeMillis() - start);
        log.info("[ckg-analyzer] Project {}: {} finding(s) in {} ms", projectId,
                result.getFindings().size(), result.getDurationMs());
        return result;
    }

    // ========================= CYCLES =========================

    /**
     * One finding per cycle, for every configured scope.
     *
     * @throws QueryException if the graph cannot be read
     */
    public List<AnalysisFinding> detectCircularDependencies(String projectId) {
        List<AnalysisFinding> findings = new ArrayList<>();
        for (EntityKind scope : properties.getAnalyzer().getCycleScopes()) {
            for (CircularDependency cycle : graphQueryService.findCircularDependencies(projectId, scope)) {
                findings.add(toCycleFinding(cycle));
            }
        }
        return findings;
    }

    private AnalysisFinding toCycleFinding(CircularDependency cycle) {
        int score = riskScorer.scoreCycle(cycle);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("scope", cycle.getScopeKind().name());
        metadata.put("entityIds", cycle.getEntityIds());
        metadata.put("cycleSize", cycle.getSize());
        metadata.put("edgeCount", cycle.getEdgeCount());
        metadata.put("heuristicEdges", cycle.getHeuristicEdgeCount());
        metadata.put("score", score);

        return AnalysisFinding.builder()
                .findingType(FindingType.CIRCULAR_DEPENDENCY)
                .title("Circular dependency: " + String.join(" -> ", cycle.getEntityNames()))
                .description(cycle.getDescription())
                .severity(AnalysisSeverity.fromScore(score))
                .affectedEntities(new ArrayList<>(cycle.getEntityNames()))
                .analysisModule(MODULE)
                .confidenceScore(riskScorer.cycleConfidence(cycle))
                .recommendations(cycleRecommendations(cycle))
                .metadata(metadata)
                .build();
    }

    private List<String> cycleRecommendations(CircularDependency cycle) {
        List<String> recommendations = new ArrayList<>();
        switch (cycle.getScopeKind()) {
            case FILE:
                recommendations.add("Move the mutually dependent declarations into one file or extract the shared part into a new module");
                recommendations.add("Check the import order: cyclic module imports can fail at load time");
                break;
            case METHOD:
                recommendations.add("Verify that the mutual recursion terminates on every path");
                recommendations.add("Consider an explicit loop or work queue if the recursion depth is unbounded");
                break;
            default:
                recommendations.add("Introduce an interface or an event to invert one of the dependencies");
                recommendations.add("Extract the logic both types need into a separate type");
                break;
        }
        if (cycle.getHeuristicEdgeCount() > 0) {
            recommendations.add(String.format("%d edge(s) of this cycle were resolved by name only; confirm them before refactoring",
                    cycle.getHeuristicEdgeCount()));
        }
        return recommendations;
    }

    // ========================= UNUSED ENTITIES =========================

    /**
     * @throws QueryException if the graph cannot be read
     */
    public List<AnalysisFinding> detectUnusedEntities(String projectId) {
        List<CodeEntity> unused = graphQueryService.findUnusedEntities(projectId, unusedEntityFilter);
        log.info("[ckg-analyzer] {} unused entit(ies) in project {}", unused.size(), projectId);
        return unused.stream().map(this::toUnusedFinding).toList();
    }

    private AnalysisFinding toUnusedFinding(CodeEntity entity) {
        String noun = entity.getKind() == EntityKind.METHOD ? "method" : entity.getKind().getLabel().toLowerCase();
        boolean privateEntity = entity.getVisibility() == Visibility.PRIVATE;
        AnalysisSeverity severity = entity.getKind().isType() ? AnalysisSeverity.MEDIUM : AnalysisSeverity.LOW;

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("entityId", entity.getId());
        metadata.put("kind", entity.getKind().name());
        metadata.put("visibility", entity.getVisibility() != null ? entity.getVisibility().name() : null);
        metadata.put("language", entity.getLanguage());

        return AnalysisFinding.builder()
                .findingType(FindingType.UNUSED_ENTITY)
                .title("Unused " + noun + ": " + entity.getName())
                .description(String.format("%s %s has no incoming calls or references in the project",
                        capitalize(noun), entity.getQualifiedName()))
                .severity(severity)
                .filePath(entity.getFilePath())
                .startLine(entity.getStartLine())
                .endLine(entity.getEndLine())
                .affectedEntities(new ArrayList<>(List.of(entity.getQualifiedName())))
                .analysisModule(MODULE)
                // private code cannot be reached from outside the project
                .confidenceScore(privateEntity ? 0.9 : 0.6)
                .recommendations(new ArrayList<>(List.of(
                        "Remove " + entity.getName() + " if it is not used through reflection, configuration or external callers")))
                .metadata(metadata)
                .build();
    }

    private static String capitalize(String value) {
        return value.isEmpty() ? value : Character.toUpperCase(value.charAt(0)) + value.substring(1);
    }
}
