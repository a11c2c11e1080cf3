package com.architecture.memory.codegraph.repository.graph;

/**
 * Read operations a graph store must answer. Every query is scoped by a {@code projectId} parameter.
 */
public enum ReadQuery {
    /** params: id */
    ENTITY_BY_ID(true),
    /** params: ids (list) */
    ENTITIES_BY_IDS(true),
    /** params: qualifiedName */
    ENTITIES_BY_QUALIFIED_NAME(true),
    /** params: filePath */
    ENTITIES_BY_FILE(true),
    /** params: kinds (list of labels, empty for all) */
    PROJECT_ENTITIES(true),
    /** params: types (list, empty for all) */
    PROJECT_RELATIONSHIPS(false),
    /** params: ids, types */
    OUTGOING_RELATIONSHIPS(false),
    /** params: ids, types */
    INCOMING_RELATIONSHIPS(false),
    COUNT_ENTITIES_BY_KIND(false),
    COUNT_RELATIONSHIPS_BY_TYPE(false);

    private final boolean entityRows;

    ReadQuery(boolean entityRows) {
        this.entityRows = entityRows;
    }

    public boolean returnsEntities() {
        return entityRows;
    }
}
