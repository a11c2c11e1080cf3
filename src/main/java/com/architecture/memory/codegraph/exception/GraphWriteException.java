package com.architecture.memory.codegraph.exception;

/**
 * A write transaction against the graph store failed and was rolled back.
 */
public class GraphWriteException extends CodeGraphException {

    public GraphWriteException(String message) {
        super(message);
    }

    public GraphWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
