package com.architecture.memory.codegraph.service.graph;

import com.architecture.memory.codegraph.model.graph.EntityKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Centralized service for generating stable, deterministic ids for graph entities and edges.
 *
 * Ids are:
 * - Deterministic: the same source always produces the same id
 * - Namespaced: language and file path are part of the id, so same-named entities in
 *   different languages or files never collide
 * - Independent of line numbers and formatting
 *
 * Format Rules:
 * - Project: project:{projectId}
 * - File: {language}:file:{filePath}
 * - Type: {language}:{class|interface}:{filePath}#{qualifiedName}
 * - Method: {language}:method:{filePath}#{qualifiedName}({paramTypes})
 * - Field / Parameter: {language}:{field|parameter}:{filePath}#{qualifiedName}
 *
 * Edge ids:
 * - Format: {edgeType}:{sourceId}->{targetId}
 */
@Service
@Slf4j
public class CanonicalIdGenerator {

    // Generic arguments, e.g. List<String> -> List
    private static final Pattern GENERIC_ARGUMENTS = Pattern.compile("<.*>");

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public String generateProjectId(String projectId) {
        if (projectId == null) {
            log.warn("Cannot generate canonical ID for project with null id");
            return "project:unknown";
        }
        return "project:" + projectId;
    }

    public String generateFileId(String language, String filePath) {
        if (language == null || filePath == null) {
            log.warn("Cannot generate canonical ID for file with null language or path");
            return "file:unknown";
        }
        return String.format("%s:file:%s", language, normalizePath(filePath));
    }

    /**
     * Id for Class, Interface, Field and Parameter entities.
     */
    public String generateEntityId(String language, EntityKind kind, String filePath, String qualifiedName) {
        if (language == null || kind == null || filePath == null || qualifiedName == null) {
            log.warn("Cannot generate canonical ID for entity with null language, kind, path or name");
            return "entity:unknown";
        }
        return String.format("%s:%s:%s#%s", language, kind.getLabel().toLowerCase(), normalizePath(filePath), qualifiedName);
    }

    /**
     * Method ids carry parameter types so overloads stay distinct.
     */
    public String generateMethodId(String language, String filePath, String qualifiedName, List<String> parameterTypes) {
        if (language == null || filePath == null || qualifiedName == null) {
            log.warn("Cannot generate canonical ID for method with null language, path or name");
            return "method:unknown";
        }
        String params = parameterTypes == null ? "" : parameterTypes.stream()
                .map(this::normalizeType)
                .collect(Collectors.joining(","));
        return String.format("%s:method:%s#%s(%s)", language, normalizePath(filePath), qualifiedName, params);
    }

    /**
     * Forward slashes, no leading "./".
     */
    public String normalizePath(String path) {
        String normalized = path.replace('\\', '/');
        while (normalized.startsWith("./")) {
            normalized = normalized.substring(2);
        }
        return normalized;
    }

    /**
     * Drop generic arguments and whitespace from a type name: "Map<String, Integer>" -> "Map".
     */
    public String normalizeType(String type) {
        if (type == null || type.isBlank()) {
            return "?";
        }
        String withoutGenerics = GENERIC_ARGUMENTS.matcher(type).replaceAll("");
        return WHITESPACE.matcher(withoutGenerics).replaceAll("");
    }
}
