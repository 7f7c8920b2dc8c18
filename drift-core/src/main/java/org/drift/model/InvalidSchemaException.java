package org.drift.model;

/**
 * Thrown when a schema tree breaks its input contract: a node missing metadata its
 * kind requires, a child of the wrong kind, a duplicated name, or a value that cannot
 * be interpreted (for example a non-numeric varchar length).
 */
public class InvalidSchemaException extends RuntimeException {

    public InvalidSchemaException(String message) {
        super(message);
    }

    public InvalidSchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}
