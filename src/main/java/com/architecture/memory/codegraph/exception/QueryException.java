package com.architecture.memory.codegraph.exception;

/**
 * A read against the graph store failed. Always propagated to the caller.
 */
public class QueryException extends CodeGraphException {

    public QueryException(String message) {
        super(message);
    }

    public QueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
