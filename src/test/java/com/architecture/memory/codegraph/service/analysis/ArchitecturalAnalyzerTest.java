package com.architecture.memory.codegraph.service.analysis;

import com.architecture.memory.codegraph.config.CodeGraphProperties;
import com.architecture.memory.codegraph.dto.analysis.AnalysisFinding;
import com.architecture.memory.codegraph.dto.analysis.AnalysisResult;
import com.architecture.memory.codegraph.dto.analysis.AnalysisSeverity;
import com.architecture.memory.codegraph.dto.analysis.FindingType;
import com.architecture.memory.codegraph.exception.QueryException;
import com.architecture.memory.codegraph.model.graph.CodeEntity;
import com.architecture.memory.codegraph.model.graph.Confidence;
import com.architecture.memory.codegraph.model.graph.EntityKind;
import com.architecture.memory.codegraph.model.graph.Relationship;
import com.architecture.memory.codegraph.model.graph.RelationshipType;
import com.architecture.memory.codegraph.model.graph.Visibility;
import com.architecture.memory.codegraph.repository.graph.GraphStoreSettings;
import com.architecture.memory.codegraph.repository.graph.InMemoryGraphStoreDriver;
import com.architecture.memory.codegraph.service.graph.CanonicalIdGenerator;
import com.architecture.memory.codegraph.service.graph.GraphBuilder;
import com.architecture.memory.codegraph.service.graph.query.GraphQueryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ArchitecturalAnalyzerTest {

    private static final String PROJECT = "shop";

    private CodeGraphProperties properties;
    private GraphBuilder graphBuilder;
    private ArchitecturalAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        properties = new CodeGraphProperties();
        InMemoryGraphStoreDriver store = new InMemoryGraphStoreDriver();
        store.connect(new GraphStoreSettings());
        graphBuilder = new GraphBuilder(store, new CanonicalIdGenerator(), properties, event -> { });
        analyzer = new ArchitecturalAnalyzer(new GraphQueryService(store), new UnusedEntityFilter(properties),
                new RiskScorer(), properties);
    }

    /**
     * OrderService.place -> PaymentService.charge -> OrderService.confirm, so the two types depend on each other.
     * AuditLog.record is private and never called.
     */
    private void seed(Confidence backEdge) {
        List<CodeEntity> entities = new ArrayList<>();
        List<Relationship> relationships = new ArrayList<>();
        addType(entities, relationships, "OrderService", "place", "confirm");
        addType(entities, relationships, "PaymentService", "charge");
        addType(entities, relationships, "AuditLog", "record");
        entities.stream().filter(e -> e.getName().equals("record")).forEach(e -> e.setVisibility(Visibility.PRIVATE));

        relationships.add(call("OrderService.place", "PaymentService.charge", Confidence.EXACT));
        relationships.add(call("PaymentService.charge", "OrderService.confirm", backEdge));
        relationships.add(Relationship.builder().type(RelationshipType.REFERENCES)
                .sourceId("m:OrderService.place").targetId("c:AuditLog").build());
        graphBuilder.build(PROJECT, entities, relationships);
    }

    private static void addType(List<CodeEntity> entities, List<Relationship> relationships,
                                String type, String... methods) {
        String file = type + ".java";
        entities.add(CodeEntity.builder().id("f:" + type).kind(EntityKind.FILE).name(file)
                .qualifiedName(file).filePath(file).build());
        entities.add(CodeEntity.builder().id("c:" + type).kind(EntityKind.CLASS).name(type)
                .qualifiedName("com.shop." + type).filePath(file).visibility(Visibility.PUBLIC).build());
        relationships.add(Relationship.contains("f:" + type, "c:" + type, 1));
        for (String method : methods) {
            String id = "m:" + type + "." + method;
            entities.add(CodeEntity.builder().id(id).kind(EntityKind.METHOD).name(method)
                    .qualifiedName("com.shop." + type + "." + method).filePath(file)
                    .startLine(10).endLine(20).visibility(Visibility.PUBLIC).build());
            relationships.add(Relationship.contains("c:" + type, id, 10));
        }
    }

    private static Relationship call(String source, String target, Confidence confidence) {
        return Relationship.builder().type(RelationshipType.CALLS)
                .sourceId("m:" + source).targetId("m:" + target).confidence(confidence).build();
    }

    @Test
    void analyze_reportsTypeAndFileCycles() {
        seed(Confidence.EXACT);

        AnalysisResult result = analyzer.analyze(PROJECT);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getAnalysisType()).isEqualTo("architecture");
        List<AnalysisFinding> cycles = result.findingsOfType(FindingType.CIRCULAR_DEPENDENCY);
        assertThat(cycles).hasSize(2);

        AnalysisFinding typeCycle = cycles.get(0);
        assertThat(typeCycle.getTitle()).isEqualTo("Circular dependency: com.shop.OrderService -> com.shop.PaymentService");
        // 2 * 10 + 2 * 15
        assertThat(typeCycle.getMetadata()).containsEntry("scope", "CLASS").containsEntry("score", 50);
        assertThat(typeCycle.getSeverity()).isEqualTo(AnalysisSeverity.HIGH);
        assertThat(typeCycle.getConfidenceScore()).isEqualTo(1.0);
        assertThat(typeCycle.getAnalysisModule()).isEqualTo(ArchitecturalAnalyzer.MODULE);

        AnalysisFinding fileCycle = cycles.get(1);
        assertThat(fileCycle.getMetadata()).containsEntry("scope", "FILE").containsEntry("score", 40);
        assertThat(fileCycle.getSeverity()).isEqualTo(AnalysisSeverity.MEDIUM);
    }

    @Test
    void analyze_lowersConfidence_forHeuristicEdges() {
        seed(Confidence.HEURISTIC);

        AnalysisFinding typeCycle = analyzer.detectCircularDependencies(PROJECT).get(0);

        assertThat(typeCycle.getConfidenceScore()).isEqualTo(0.75);
        assertThat(typeCycle.getRecommendations()).anyMatch(r -> r.startsWith("1 edge(s) of this cycle were resolved by name only"));
    }

    @Test
    void analyze_usesConfiguredScopes() {
        seed(Confidence.EXACT);
        properties.getAnalyzer().setCycleScopes(new ArrayList<>(List.of(EntityKind.METHOD)));

        assertThat(analyzer.detectCircularDependencies(PROJECT)).isEmpty();
    }

    @Test
    void analyze_reportsUnusedEntities_withStaticAnalysisWarning() {
        seed(Confidence.EXACT);

        AnalysisResult result = analyzer.analyze(PROJECT);

        List<AnalysisFinding> unused = result.findingsOfType(FindingType.UNUSED_ENTITY);
        assertThat(unused).extracting(AnalysisFinding::getTitle).containsExactly(
                "Unused class: OrderService",
                "Unused class: PaymentService",
                "Unused method: record",
                "Unused method: place");
        assertThat(unused.get(0).getSeverity()).isEqualTo(AnalysisSeverity.MEDIUM);
        assertThat(unused.get(2).getSeverity()).isEqualTo(AnalysisSeverity.LOW);
        assertThat(unused.get(2).getConfidenceScore()).isEqualTo(0.9);
        assertThat(unused.get(3).getConfidenceScore()).isEqualTo(0.6);
        assertThat(unused.get(2).getFilePath()).isEqualTo("AuditLog.java");
        assertThat(result.getWarnings()).containsExactly(ArchitecturalAnalyzer.STATIC_ANALYSIS_WARNING);
    }

    @Test
    void analyze_onEmptyProject_hasNoFindingsAndNoWarning() {
        AnalysisResult result = analyzer.analyze("empty");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getFindings()).isEmpty();
        assertThat(result.getWarnings()).isEmpty();
    }

    @Test
    void analyze_whenQueryFails_returnsFailureWithoutFindings() {
        GraphQueryService failing = mock(GraphQueryService.class);
        when(failing.findCircularDependencies(anyString(), any())).thenThrow(new QueryException("connection reset"));
        ArchitecturalAnalyzer broken = new ArchitecturalAnalyzer(failing, new UnusedEntityFilter(properties),
                new RiskScorer(), properties);

        AnalysisResult result = broken.analyze(PROJECT);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getFindings()).isEmpty();
        assertThat(result.getErrors()).containsExactly("Graph query failed: connection reset");
    }
}
