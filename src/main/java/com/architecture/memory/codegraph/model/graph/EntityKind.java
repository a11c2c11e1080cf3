package com.architecture.memory.codegraph.model.graph;

/**
 * Kinds of code entities stored as graph nodes. The enum constant name doubles as the node label.
 */
public enum EntityKind {
    PROJECT("Project"),
    FILE("File"),
    CLASS("Class"),
    INTERFACE("Interface"),
    METHOD("Method"),
    FIELD("Field"),
    PARAMETER("Parameter");

    private final String label;

    EntityKind(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Class and Interface are both type declarations and share the type-level scope.
     */
    public boolean isType() {
        return this == CLASS || this == INTERFACE;
    }

    public static EntityKind fromLabel(String value) {
        for (EntityKind kind : values()) {
            if (kind.label.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown entity kind: " + value);
    }
}
