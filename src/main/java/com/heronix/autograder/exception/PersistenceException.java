package com.heronix.autograder.exception;

/**
 * Exception thrown when a record store call fails: network errors, timeouts,
 * constraint violations, or rows that cannot be read back.
 */
public class PersistenceException extends AutograderException {

    private final String table;

    public PersistenceException(String table, String message) {
        super("PERSISTENCE_FAILED", message);
        this.table = table;
    }

    public PersistenceException(String table, String message, Throwable cause) {
        super("PERSISTENCE_FAILED", message, cause);
        this.table = table;
    }

    public String getTable() {
        return table;
    }
}
