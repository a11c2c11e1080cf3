package com.architecture.memory.codegraph.exception;

/**
 * Base class for infrastructure failures raised by the code graph engine.
 * Expected per-item failures (a file that does not parse, a dangling edge) are reported as data instead.
 */
public class CodeGraphException extends RuntimeException {

    public CodeGraphException(String message) {
        super(message);
    }

    public CodeGraphException(String message, Throwable cause) {
        super(message, cause);
    }
}
