package com.dotprint.core.definition;

/**
 * Thrown when a graph definition cannot be read or contains an invalid value.
 */
public class DefinitionException extends RuntimeException {

    public DefinitionException(String message) {
        super(message);
    }

    public DefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
