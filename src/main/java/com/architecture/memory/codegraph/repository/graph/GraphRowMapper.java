package com.architecture.memory.codegraph.repository.graph;

import com.architecture.memory.codegraph.model.graph.CodeEntity;
import com.architecture.memory.codegraph.model.graph.Confidence;
import com.architecture.memory.codegraph.model.graph.EntityKind;
import com.architecture.memory.codegraph.model.graph.Relationship;
import com.architecture.memory.codegraph.model.graph.RelationshipType;
import com.architecture.memory.codegraph.model.graph.Visibility;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts entities and relationships to and from the flat property rows exchanged with a graph store.
 * Null values are skipped so the rows can be handed to any backend as-is.
 */
public final class GraphRowMapper {

    private GraphRowMapper() {
    }

    public static Map<String, Object> toRow(String projectId, CodeEntity entity) {
        Map<String, Object> row = new HashMap<>();
        putIfNotNull(row, "projectId", projectId);
        putIfNotNull(row, "id", entity.getId());
        putIfNotNull(row, "kind", entity.getKind() != null ? entity.getKind().getLabel() : null);
        putIfNotNull(row, "name", entity.getName());
        putIfNotNull(row, "qualifiedName", entity.getQualifiedName());
        putIfNotNull(row, "filePath", entity.getFilePath());
        row.put("startLine", entity.getStartLine());
        row.put("endLine", entity.getEndLine());
        row.put("visibility", entity.getVisibility() != null ? entity.getVisibility().name() : Visibility.DEFAULT.name());
        putIfNotNull(row, "language", entity.getLanguage());
        putIfNotNull(row, "parentId", entity.getParentId());
        putIfNotNull(row, "signature", entity.getSignature());
        putIfNotNull(row, "returnType", entity.getReturnType());
        row.put("parameterTypes", entity.getParameterTypes() != null ? List.copyOf(entity.getParameterTypes()) : List.of());
        row.put("modifiers", entity.getModifiers() != null ? List.copyOf(entity.getModifiers()) : List.of());
        return row;
    }

    public static Map<String, Object> toRow(String projectId, Relationship relationship) {
        Map<String, Object> row = new HashMap<>();
        putIfNotNull(row, "projectId", projectId);
        putIfNotNull(row, "sourceId", relationship.getSourceId());
        putIfNotNull(row, "targetId", relationship.getTargetId());
        putIfNotNull(row, "type", relationship.getType() != null ? relationship.getType().name() : null);
        row.put("confidence", relationship.getConfidence() != null
                ? relationship.getConfidence().name() : Confidence.EXACT.name());
        row.put("sourceLine", relationship.getSourceLine());
        return row;
    }

    public static CodeEntity toEntity(Map<String, Object> row) {
        return CodeEntity.builder()
                .id(asString(row.get("id")))
                .kind(row.get("kind") != null ? EntityKind.fromLabel(asString(row.get("kind"))) : null)
                .name(asString(row.get("name")))
                .qualifiedName(asString(row.get("qualifiedName")))
                .filePath(asString(row.get("filePath")))
                .startLine(asInt(row.get("startLine")))
                .endLine(asInt(row.get("endLine")))
                .visibility(Visibility.fromValue(asString(row.get("visibility"))))
                .language(asString(row.get("language")))
                .parentId(asString(row.get("parentId")))
                .signature(asString(row.get("signature")))
                .returnType(asString(row.get("returnType")))
                .parameterTypes(asStringList(row.get("parameterTypes")))
                .modifiers(asStringList(row.get("modifiers")))
                .build();
    }

    public static Relationship toRelationship(Map<String, Object> row) {
        String confidence = asString(row.get("confidence"));
        return Relationship.builder()
                .type(RelationshipType.valueOf(asString(row.get("type"))))
                .sourceId(asString(row.get("sourceId")))
                .targetId(asString(row.get("targetId")))
                .confidence(confidence != null ? Confidence.valueOf(confidence) : Confidence.EXACT)
                .sourceLine(asInt(row.get("sourceLine")))
                .build();
    }

    public static long asLong(Object value) {
        return value instanceof Number ? ((Number) value).longValue() : 0L;
    }

    private static int asInt(Object value) {
        return value instanceof Number ? ((Number) value).intValue() : 0;
    }

    private static String asString(Object value) {
        return value != null ? value.toString() : null;
    }

    private static List<String> asStringList(Object value) {
        List<String> result = new ArrayList<>();
        if (value instanceof Collection<?>) {
            for (Object item : (Collection<?>) value) {
                if (item != null) {
                    result.add(item.toString());
                }
            }
        }
        return result;
    }

    private static void putIfNotNull(Map<String, Object> row, String key, Object value) {
        if (value != null) {
            row.put(key, value);
        }
    }
}
