package com.architecture.memory.codegraph.repository.graph;

import java.util.List;
import java.util.Map;

/**
 * Minimal contract every graph backend implements. The engine only issues the structured
 * operations in {@link ReadQuery} and {@link GraphStatement}; translating them into a
 * backend's query language is the driver's job.
 */
public interface GraphStoreDriver extends AutoCloseable {

    /**
     * Open the connection and prepare the schema (indexes).
     *
     * @throws com.architecture.memory.codegraph.exception.ConfigurationException if the store is unreachable
     */
    void connect(GraphStoreSettings settings);

    /**
     * Run a read-only query. Entity queries return one property map per entity,
     * relationship queries return {sourceId, targetId, type, confidence, sourceLine} rows,
     * count queries return {kind|type, count} rows.
     *
     * @throws com.architecture.memory.codegraph.exception.QueryException on any store failure
     */
    List<Map<String, Object>> runRead(ReadQuery query, Map<String, Object> params);

    /**
     * Apply all statements in one transaction: either every statement is committed or none is.
     *
     * @throws com.architecture.memory.codegraph.exception.GraphWriteException if the transaction was rolled back
     */
    WriteResult runWrite(List<GraphStatement> statements);

    boolean isConnected();

    String getName();

    @Override
    void close();
}
