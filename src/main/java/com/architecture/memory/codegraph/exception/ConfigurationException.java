package com.architecture.memory.codegraph.exception;

/**
 * Invalid configuration or unreachable graph store. Fatal at startup.
 */
public class ConfigurationException extends CodeGraphException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
