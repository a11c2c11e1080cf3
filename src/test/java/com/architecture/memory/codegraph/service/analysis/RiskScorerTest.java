package com.architecture.memory.codegraph.service.analysis;

import com.architecture.memory.codegraph.dto.analysis.AnalysisSeverity;
import com.architecture.memory.codegraph.dto.analysis.RiskAssessment;
import com.architecture.memory.codegraph.dto.graph.CircularDependency;
import com.architecture.memory.codegraph.model.graph.EntityKind;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class RiskScorerTest {

    private final RiskScorer riskScorer = new RiskScorer();

    @Test
    void assessChange_withNothingAffected_isInfo() {
        RiskAssessment risk = riskScorer.assessChange(0, 0, 0, false);

        assertThat(risk.getOverallScore()).isZero();
        assertThat(risk.getSeverity()).isEqualTo(AnalysisSeverity.INFO);
    }

    @Test
    void assessChange_weighsDirectAboveIndirect() {
        RiskAssessment risk = riskScorer.assessChange(2, 3, 1, false);

        assertThat(risk.getScoreBreakdown().getAffectedEntities()).isEqualTo(16);
        assertThat(risk.getScoreBreakdown().getFanIn()).isEqualTo(7);
        assertThat(risk.getOverallScore()).isEqualTo(23);
        assertThat(risk.getSeverity()).isEqualTo(AnalysisSeverity.LOW);
    }

    @Test
    void assessChange_capsEachComponent() {
        RiskAssessment risk = riskScorer.assessChange(40, 40, 40, true);

        assertThat(risk.getScoreBreakdown().getAffectedEntities()).isEqualTo(50);
        assertThat(risk.getScoreBreakdown().getFanIn()).isEqualTo(35);
        assertThat(risk.getScoreBreakdown().getDeletion()).isEqualTo(15);
        assertThat(risk.getOverallScore()).isEqualTo(100);
        assertThat(risk.getSeverity()).isEqualTo(AnalysisSeverity.CRITICAL);
    }

    @Test
    void assessChange_deletionWithCallers_isAtLeastHigh() {
        RiskAssessment risk = riskScorer.assessChange(1, 0, 1, true);

        assertThat(risk.getOverallScore()).isEqualTo(27);
        assertThat(risk.getSeverity()).isEqualTo(AnalysisSeverity.HIGH);
    }

    @Test
    void scoreCycle_weightsByScope() {
        assertThat(riskScorer.scoreCycle(cycle(EntityKind.CLASS, 3, 0))).isEqualTo(75);
        assertThat(riskScorer.scoreCycle(cycle(EntityKind.FILE, 3, 0))).isEqualTo(60);
        assertThat(riskScorer.scoreCycle(cycle(EntityKind.METHOD, 3, 0))).isEqualTo(45);
        assertThat(riskScorer.scoreCycle(cycle(EntityKind.CLASS, 6, 0))).isEqualTo(100);
    }

    @Test
    void cycleConfidence_countsHeuristicEdgesAtHalfWeight() {
        assertThat(riskScorer.cycleConfidence(cycle(EntityKind.CLASS, 2, 0))).isEqualTo(1.0);
        assertThat(riskScorer.cycleConfidence(cycle(EntityKind.CLASS, 2, 1))).isCloseTo(0.75, within(1e-9));
        assertThat(riskScorer.cycleConfidence(cycle(EntityKind.CLASS, 2, 2))).isCloseTo(0.5, within(1e-9));
    }

    /**
     * A ring of {@code size} entities; the first {@code heuristic} edges are heuristic.
     */
    private static CircularDependency cycle(EntityKind scope, int size, int heuristic) {
        List<String> ids = new ArrayList<>();
        List<CircularDependency.CycleEdge> edges = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            ids.add("e" + i);
            edges.add(CircularDependency.CycleEdge.builder()
                    .sourceId("e" + i)
                    .targetId("e" + ((i + 1) % size))
                    .heuristic(i < heuristic)
                    .build());
        }
        return CircularDependency.builder().scopeKind(scope).entityIds(ids).cycleEdges(edges).build();
    }
}
