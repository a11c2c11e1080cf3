package com.architecture.memory.codegraph.model.graph;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A code construct (project, file, type, method, field, parameter) represented as one graph node.
 *
 * The id is derived from language, file path and qualified name by
 * {@link com.architecture.memory.codegraph.service.graph.CanonicalIdGenerator}, so parsing the
 * same source twice yields the same ids.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CodeEntity {

    private String id;
    private EntityKind kind;
    private String name;
    private String qualifiedName;
    private String filePath;
    private int startLine;
    private int endLine;

    @Builder.Default
    private Visibility visibility = Visibility.DEFAULT;

    private String language;

    // Id of the enclosing entity (File for top-level types, type for members)
    private String parentId;

    // Methods only: "returnType name(paramTypes)"
    private String signature;
    private String returnType;

    @Builder.Default
    private List<String> parameterTypes = new ArrayList<>();

    @Builder.Default
    private List<String> modifiers = new ArrayList<>();

    public boolean hasModifier(String modifier) {
        return modifiers != null && modifiers.contains(modifier);
    }
}
