package com.heronix.autograder.exception;

/**
 * Exception thrown when a record expected to exist is absent from the store.
 * Carries the parent view the caller should fall back to.
 */
public class RecordNotFoundException extends AutograderException {

    private final String table;
    private final String recordId;
    private final String redirectTo;

    public RecordNotFoundException(String entityName, String table, String recordId, String redirectTo) {
        super("NOT_FOUND", entityName + " not found");
        this.table = table;
        this.recordId = recordId;
        this.redirectTo = redirectTo;
    }

    public String getTable() {
        return table;
    }

    public String getRecordId() {
        return recordId;
    }

    public String getRedirectTo() {
        return redirectTo;
    }
}
