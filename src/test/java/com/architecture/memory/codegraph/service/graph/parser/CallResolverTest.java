package com.architecture.memory.codegraph.service.graph.parser;

import com.architecture.memory.codegraph.dto.parse.LanguageParseResult;
import com.architecture.memory.codegraph.model.graph.CodeEntity;
import com.architecture.memory.codegraph.model.graph.Confidence;
import com.architecture.memory.codegraph.model.graph.EntityKind;
import com.architecture.memory.codegraph.model.graph.Relationship;
import com.architecture.memory.codegraph.model.graph.RelationshipType;
import com.architecture.memory.codegraph.service.graph.CanonicalIdGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CallResolverTest {

    private ParseBatch batch;
    private CodeEntity file;
    private CodeEntity caller;
    private CodeEntity callerType;

    @BeforeEach
    void setUp() {
        ParseContext context = ParseContext.builder()
                .projectId("p1")
                .rootPath(Path.of("/src"))
                .idGenerator(new CanonicalIdGenerator())
                .build();
        batch = new ParseBatch(context, "kotlin");
        file = batch.addFile("Main.kt", 10);
        callerType = type("Main");
        caller = method(callerType, "run", 0, 0);
    }

    @Test
    void resolvesExactly_whenOneCandidateMatches() {
        CodeEntity mailer = type("Mailer");
        CodeEntity send = method(mailer, "send", 1, 1);

        batch.addCall(call("send", 1, RawCall.ReceiverKind.NAMED, "Mailer"));
        LanguageParseResult result = batch.complete("test", 0);

        assertThat(calls(result)).singleElement().satisfies(edge -> {
            assertThat(edge.getTargetId()).isEqualTo(send.getId());
            assertThat(edge.getConfidence()).isEqualTo(Confidence.EXACT);
        });
        assertThat(edgesOf(result, RelationshipType.REFERENCES))
                .anyMatch(r -> r.getSourceId().equals(caller.getId()) && r.getTargetId().equals(mailer.getId()));
    }

    @Test
    void picksFirstDeclaredCandidate_asHeuristic_whenReceiverIsUnknown() {
        CodeEntity first = method(type("EmailSender"), "send", 1, 1);
        method(type("SmsSender"), "send", 1, 1);

        batch.addCall(call("send", 1, RawCall.ReceiverKind.UNKNOWN, null));
        LanguageParseResult result = batch.complete("test", 0);

        assertThat(calls(result)).singleElement().satisfies(edge -> {
            assertThat(edge.getTargetId()).isEqualTo(first.getId());
            assertThat(edge.getConfidence()).isEqualTo(Confidence.HEURISTIC);
        });
    }

    @Test
    void filtersCandidatesByArgumentCount() {
        method(type("EmailSender"), "send", 2, 2);
        CodeEntity single = method(type("SmsSender"), "send", 1, 1);

        batch.addCall(call("send", 1, RawCall.ReceiverKind.UNKNOWN, null));
        LanguageParseResult result = batch.complete("test", 0);

        assertThat(calls(result)).singleElement().satisfies(edge -> {
            assertThat(edge.getTargetId()).isEqualTo(single.getId());
            assertThat(edge.getConfidence()).isEqualTo(Confidence.EXACT);
        });
    }

    @Test
    void prefersOwnTypeForBareCalls_thenTopLevelFunctions() {
        CodeEntity own = method(callerType, "helper", 0, 0);
        CodeEntity topLevel = topLevelFunction("format");
        method(type("Other"), "format", 0, 0);

        batch.addCall(bareCall("helper"));
        batch.addCall(bareCall("format"));
        LanguageParseResult result = batch.complete("test", 0);

        assertThat(calls(result)).extracting(Relationship::getTargetId)
                .containsExactlyInAnyOrder(own.getId(), topLevel.getId());
    }

    @Test
    void createsNoEdge_whenNothingMatches() {
        method(type("Mailer"), "send", 1, 1);

        batch.addCall(call("publish", 1, RawCall.ReceiverKind.UNKNOWN, null));
        batch.addCall(call("send", 1, RawCall.ReceiverKind.NAMED, "Unrelated"));
        LanguageParseResult result = batch.complete("test", 0);

        assertThat(calls(result)).isEmpty();
    }

    @Test
    void resolvesTypeReferencesBySimpleName() {
        CodeEntity base = type("Base");
        CodeEntity derived = type("Derived");
        batch.addTypeReference(RawTypeReference.builder()
                .sourceId(derived.getId())
                .typeName("com.other.Base")
                .relationshipType(RelationshipType.EXTENDS)
                .line(1)
                .build());
        LanguageParseResult result = batch.complete("test", 0);

        assertThat(edgesOf(result, RelationshipType.EXTENDS)).singleElement().satisfies(edge -> {
            assertThat(edge.getSourceId()).isEqualTo(derived.getId());
            assertThat(edge.getTargetId()).isEqualTo(base.getId());
        });
    }

    @Test
    void extractsSimpleNames() {
        assertThat(CallResolver.simpleName("com.example.Outer$Inner")).isEqualTo("Inner");
        assertThat(CallResolver.simpleName("Plain")).isEqualTo("Plain");
        assertThat(CallResolver.simpleName(null)).isEmpty();
    }

    private CodeEntity type(String name) {
        CodeEntity type = CodeEntity.builder()
                .id("kotlin:class:Main.kt#" + name)
                .kind(EntityKind.CLASS)
                .name(name)
                .qualifiedName(name)
                .filePath("Main.kt")
                .build();
        batch.addEntity(type, file.getId());
        return type;
    }

    private CodeEntity method(CodeEntity owner, String name, int minArity, int maxArity) {
        CodeEntity method = CodeEntity.builder()
                .id("kotlin:method:Main.kt#" + owner.getQualifiedName() + "." + name + "/" + minArity)
                .kind(EntityKind.METHOD)
                .name(name)
                .qualifiedName(owner.getQualifiedName() + "." + name)
                .filePath("Main.kt")
                .build();
        batch.declareMethod(method, owner, minArity, maxArity);
        return method;
    }

    private CodeEntity topLevelFunction(String name) {
        CodeEntity function = CodeEntity.builder()
                .id("kotlin:method:Main.kt#" + name)
                .kind(EntityKind.METHOD)
                .name(name)
                .qualifiedName(name)
                .filePath("Main.kt")
                .build();
        batch.declareMethod(function, file, 0, 0);
        return function;
    }

    private RawCall call(String name, int arity, RawCall.ReceiverKind receiverKind, String receiverType) {
        return RawCall.builder()
                .callerId(caller.getId())
                .callerOwnerId(callerType.getId())
                .calleeName(name)
                .arity(arity)
                .receiverKind(receiverKind)
                .receiverType(receiverType)
                .line(3)
                .build();
    }

    private RawCall bareCall(String name) {
        return RawCall.builder()
                .callerId(caller.getId())
                .callerOwnerId(callerType.getId())
                .calleeName(name)
                .arity(0)
                .receiverKind(RawCall.ReceiverKind.NONE)
                .implicitSelf(true)
                .line(4)
                .build();
    }

    private static List<Relationship> calls(LanguageParseResult result) {
        return edgesOf(result, RelationshipType.CALLS);
    }

    private static List<Relationship> edgesOf(LanguageParseResult result, RelationshipType type) {
        return result.getRelationships().stream().filter(r -> r.getType() == type).toList();
    }
}
