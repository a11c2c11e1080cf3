package com.architecture.memory.codegraph.service.analysis;

import com.architecture.memory.codegraph.dto.analysis.AnalysisSeverity;
import com.architecture.memory.codegraph.dto.analysis.RiskAssessment;
import com.architecture.memory.codegraph.dto.analysis.RiskAssessment.ScoreBreakdown;
import com.architecture.memory.codegraph.dto.graph.CircularDependency;
import com.architecture.memory.codegraph.model.graph.EntityKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Scores for impact and cycle findings, both on a 0-100 scale mapped through
 * {@link AnalysisSeverity#fromScore(int)}.
 */
@Component
@Slf4j
public class RiskScorer {

    /**
     * Risk of changing one entity.
     *
     * @param directAffected   entities one CALLS edge away, either direction
     * @param indirectAffected entities further away, up to the analysis depth
     * @param fanIn            direct callers of the changed entity
     * @param deletedWithCallers the change removes an entity that still has callers
     */
    public RiskAssessment assessChange(int directAffected, int indirectAffected, int fanIn, boolean deletedWithCallers) {
        ScoreBreakdown breakdown = ScoreBreakdown.builder()
                .affectedEntities(calculateAffectedScore(directAffected, indirectAffected))
                .fanIn(calculateFanInScore(fanIn))
                .deletion(deletedWithCallers ? 15 : 0)
                .build();
        int total = Math.min(100, breakdown.getAffectedEntities() + breakdown.getFanIn() + breakdown.getDeletion());

        AnalysisSeverity severity = AnalysisSeverity.fromScore(total);
        if (deletedWithCallers && severity.ordinal() > AnalysisSeverity.HIGH.ordinal()) {
            // removing something that is still called breaks the build
            severity = AnalysisSeverity.HIGH;
        }
        log.debug("[ckg-impact] Risk score {} ({}): affected={}, fanIn={}, deletion={}",
                total, severity, breakdown.getAffectedEntities(), breakdown.getFanIn(), breakdown.getDeletion());

        return RiskAssessment.builder()
                .overallScore(total)
                .severity(severity)
                .scoreBreakdown(breakdown)
                .build();
    }

    /**
     * Affected entities score (0-50 points). Direct neighbours weigh more than indirect ones.
     */
    private int calculateAffectedScore(int direct, int indirect) {
        return Math.min(direct * 5 + indirect * 2, 50);
    }

    /**
     * Fan-in score (0-35 points).
     */
    private int calculateFanInScore(int fanIn) {
        return Math.min(fanIn * 7, 35);
    }

    /**
     * Cycle score: size * 10 + edges * 15, capped at 100, then weighted by scope. Type-level cycles
     * count fully, file-level 0.8, method-level (often intended recursion) 0.6.
     */
    public int scoreCycle(CircularDependency cycle) {
        int raw = Math.min(100, cycle.getSize() * 10 + cycle.getEdgeCount() * 15);
        return (int) Math.round(raw * scopeFactor(cycle.getScopeKind()));
    }

    /**
     * Share of the cycle's edges that were resolved exactly; heuristic edges count half.
     */
    public double cycleConfidence(CircularDependency cycle) {
        if (cycle.getEdgeCount() == 0) {
            return 1.0;
        }
        double heuristic = cycle.getHeuristicEdgeCount();
        return (cycle.getEdgeCount() - heuristic * 0.5) / cycle.getEdgeCount();
    }

    private double scopeFactor(EntityKind scopeKind) {
        if (scopeKind == null) {
            return 1.0;
        }
        switch (scopeKind) {
            case FILE:
                return 0.8;
            case METHOD:
                return 0.6;
            default:
                return 1.0;
        }
    }
}
