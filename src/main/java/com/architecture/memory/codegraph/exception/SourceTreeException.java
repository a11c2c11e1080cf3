package com.architecture.memory.codegraph.exception;

/**
 * The project source root cannot be read at all.
 */
public class SourceTreeException extends CodeGraphException {

    public SourceTreeException(String message) {
        super(message);
    }

    public SourceTreeException(String message, Throwable cause) {
        super(message, cause);
    }
}
