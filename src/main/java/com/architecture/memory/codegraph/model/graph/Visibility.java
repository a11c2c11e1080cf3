package com.architecture.memory.codegraph.model.graph;

/**
 * Access level of an entity. PACKAGE covers Java package-private and Kotlin internal.
 * DEFAULT is used when the source language or grammar gives no information.
 */
public enum Visibility {
    PUBLIC,
    PRIVATE,
    PROTECTED,
    PACKAGE,
    DEFAULT;

    public static Visibility fromValue(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT;
        }
        for (Visibility visibility : values()) {
            if (visibility.name().equalsIgnoreCase(value)) {
                return visibility;
            }
        }
        if ("internal".equalsIgnoreCase(value)) {
            return PACKAGE;
        }
        return DEFAULT;
    }
}
