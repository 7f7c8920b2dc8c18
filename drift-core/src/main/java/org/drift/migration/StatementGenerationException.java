package org.drift.migration;

import org.drift.model.Change;

/**
 * A single change could not be turned into SQL, typically because its node is missing
 * or of the wrong kind, or because required before/after metadata is absent.
 * The generator logs it and skips that statement.
 */
public class StatementGenerationException extends Exception {

    private final transient Change change;

    public StatementGenerationException(Change change, String message) {
        super(message);
        this.change = change;
    }

    public StatementGenerationException(Change change, String message, Throwable cause) {
        super(message, cause);
        this.change = change;
    }

    public Change getChange() {
        return change;
    }
}
