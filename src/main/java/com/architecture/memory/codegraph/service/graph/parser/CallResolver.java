package com.architecture.memory.codegraph.service.graph.parser;

import com.architecture.memory.codegraph.model.graph.CodeEntity;
import com.architecture.memory.codegraph.model.graph.Confidence;
import com.architecture.memory.codegraph.model.graph.Relationship;
import com.architecture.memory.codegraph.model.graph.RelationshipType;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Matches raw call sites and type references against the entities declared in the same batch.
 *
 * Rules:
 *   1. Candidates are methods with the called name that accept the call's argument count,
 *      in declaration order.
 *   2. The receiver narrows the candidates: SELF keeps methods of the caller's type, NAMED keeps
 *      methods of the named type, UNKNOWN keeps type members, NONE keeps the caller's own type
 *      (when the language has an implicit this) and then top-level functions.
 *   3. One remaining candidate gives an EXACT edge; several give a HEURISTIC edge to the first.
 *   4. No remaining candidate: no edge. Targets are never fabricated.
 *
 * A call to a method of another type also yields a REFERENCES edge from the caller to that type.
 */
@Slf4j
public class CallResolver {

    public void resolve(ParseBatch batch) {
        int resolvedCalls = 0;
        int heuristicCalls = 0;
        for (RawCall call : batch.getCalls()) {
            List<DeclaredMethod> candidates = candidatesFor(batch, call);
            if (candidates.isEmpty()) {
                continue;
            }
            DeclaredMethod target = candidates.get(0);
            Confidence confidence = candidates.size() == 1 ? Confidence.EXACT : Confidence.HEURISTIC;
            if (confidence == Confidence.HEURISTIC) {
                heuristicCalls++;
            }
            resolvedCalls++;
            batch.addRelationship(Relationship.builder()
                    .type(RelationshipType.CALLS)
                    .sourceId(call.getCallerId())
                    .targetId(target.getEntity().getId())
                    .confidence(confidence)
                    .sourceLine(call.getLine())
                    .build());
            if (!target.isTopLevel() && !Objects.equals(target.getOwnerId(), call.getCallerOwnerId())) {
                batch.addRelationship(Relationship.builder()
                        .type(RelationshipType.REFERENCES)
                        .sourceId(call.getCallerId())
                        .targetId(target.getOwnerId())
                        .confidence(confidence)
                        .sourceLine(call.getLine())
                        .build());
            }
        }

        int resolvedReferences = 0;
        for (RawTypeReference reference : batch.getTypeReferences()) {
            if (resolveTypeReference(batch, reference)) {
                resolvedReferences++;
            }
        }

        log.debug("[ckg-parser:{}] Resolved {}/{} calls ({} heuristic), {}/{} type references",
                batch.getLanguage(), resolvedCalls, batch.getCalls().size(), heuristicCalls,
                resolvedReferences, batch.getTypeReferences().size());
    }

    List<DeclaredMethod> candidatesFor(ParseBatch batch, RawCall call) {
        List<DeclaredMethod> byName = new ArrayList<>();
        for (DeclaredMethod method : batch.getMethods()) {
            if (method.getEntity().getName().equals(call.getCalleeName()) && method.accepts(call.getArity())) {
                byName.add(method);
            }
        }
        if (byName.isEmpty()) {
            return byName;
        }

        switch (call.getReceiverKind()) {
            case SELF:
                return filter(byName, m -> Objects.equals(m.getOwnerId(), call.getCallerOwnerId()));
            case NAMED:
                return filter(byName, m -> !m.isTopLevel() && ownerMatches(m, call.getReceiverType()));
            case UNKNOWN:
                return filter(byName, m -> !m.isTopLevel());
            case NONE:
            default:
                if (call.isImplicitSelf()) {
                    List<DeclaredMethod> own = filter(byName, m -> Objects.equals(m.getOwnerId(), call.getCallerOwnerId()));
                    if (!own.isEmpty()) {
                        return own;
                    }
                }
                return filter(byName, DeclaredMethod::isTopLevel);
        }
    }

    private boolean resolveTypeReference(ParseBatch batch, RawTypeReference reference) {
        String typeName = reference.getTypeName();
        CodeEntity target = batch.typeWithQualifiedName(typeName);
        Confidence confidence = Confidence.EXACT;
        if (target == null) {
            List<CodeEntity> named = batch.typesNamed(simpleName(typeName));
            if (named.isEmpty()) {
                return false;
            }
            target = named.get(0);
            confidence = named.size() == 1 ? Confidence.EXACT : Confidence.HEURISTIC;
        }
        if (target.getId().equals(reference.getSourceId())) {
            return false;
        }
        batch.addRelationship(Relationship.builder()
                .type(reference.getRelationshipType())
                .sourceId(reference.getSourceId())
                .targetId(target.getId())
                .confidence(confidence)
                .sourceLine(reference.getLine())
                .build());
        return true;
    }

    private boolean ownerMatches(DeclaredMethod method, String receiverType) {
        if (receiverType == null) {
            return false;
        }
        String ownerName = method.getOwnerQualifiedName();
        return receiverType.equals(ownerName) || simpleName(receiverType).equals(simpleName(ownerName));
    }

    private List<DeclaredMethod> filter(List<DeclaredMethod> methods, Predicate<DeclaredMethod> predicate) {
        List<DeclaredMethod> result = new ArrayList<>();
        for (DeclaredMethod method : methods) {
            if (predicate.test(method)) {
                result.add(method);
            }
        }
        return result;
    }

    static String simpleName(String name) {
        if (name == null) {
            return "";
        }
        int lastDot = Math.max(name.lastIndexOf('.'), name.lastIndexOf('$'));
        return lastDot >= 0 ? name.substring(lastDot + 1) : name;
    }
}
