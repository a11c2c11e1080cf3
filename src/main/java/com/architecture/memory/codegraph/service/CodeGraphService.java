package com.architecture.memory.codegraph.service;

import com.architecture.memory.codegraph.dto.ChangeSet;
import com.architecture.memory.codegraph.dto.ProjectSource;
import com.architecture.memory.codegraph.dto.analysis.AnalysisResult;
import com.architecture.memory.codegraph.dto.graph.BuildResult;
import com.architecture.memory.codegraph.dto.graph.ScanResult;
import com.architecture.memory.codegraph.dto.parse.CoordinatorResult;
import com.architecture.memory.codegraph.service.analysis.ArchitecturalAnalyzer;
import com.architecture.memory.codegraph.service.analysis.PRImpactAnalyzer;
import com.architecture.memory.codegraph.service.graph.GraphBuilder;
import com.architecture.memory.codegraph.service.graph.parser.ParserCoordinator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point for collaborators: scan a source tree into the graph, analyze it, drop it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CodeGraphService {

    private final ParserCoordinator parserCoordinator;
    private final GraphBuilder graphBuilder;
    private final ArchitecturalAnalyzer architecturalAnalyzer;
    private final PRImpactAnalyzer prImpactAnalyzer;

    /**
     * Parse the source tree and replace the project's graph with the result.
     * If every processed file failed to parse, the previous graph is kept.
     */
    public ScanResult scan(String projectId, ProjectSource source) {
        log.info("[ckg-coordinator] Scanning project {} at {}", projectId, source.getRootPath());
        CoordinatorResult parseResult = parserCoordinator.coordinate(projectId, source);

        BuildResult buildResult;
        if (parseResult.getFilesProcessed() > 0 && parseResult.getSuccessRate() == 0.0) {
            String error = String.format("All %d file(s) failed to parse, previous graph kept",
                    parseResult.getFilesProcessed());
            log.error("[ckg-coordinator] Project {}: {}", projectId, error);
            buildResult = BuildResult.builder().projectId(projectId).success(false).build();
            buildResult.getErrors().add(error);
        } else {
            buildResult = graphBuilder.build(projectId, parseResult.getEntities(), parseResult.getRelationships());
        }

        return ScanResult.builder()
                .projectId(projectId)
                .parseResult(parseResult)
                .buildResult(buildResult)
                .build();
    }

    public AnalysisResult analyzeArchitecture(String projectId) {
        return architecturalAnalyzer.analyze(projectId);
    }

    public AnalysisResult analyzeChanges(String projectId, ChangeSet changeSet) {
        return prImpactAnalyzer.analyze(projectId, changeSet);
    }

    public AnalysisResult analyzeChanges(String projectId, ChangeSet changeSet, int depth) {
        return prImpactAnalyzer.analyze(projectId, changeSet, depth);
    }

    /**
     * Remove the project's graph, e.g. when the project itself is removed.
     *
     * @return number of nodes deleted
     */
    public int deleteProject(String projectId) {
        log.info("[ckg-store] Deleting graph of project {}", projectId);
        return graphBuilder.deleteProjectGraph(projectId);
    }
}
