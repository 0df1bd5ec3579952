package com.heronix.autograder.exception;

/**
 * Exception thrown when a submission batch would be created without files.
 */
public class EmptyUploadException extends AutograderException {

    private final String assignmentId;

    public EmptyUploadException(String assignmentId) {
        super("EMPTY_UPLOAD", "Please select at least one file to upload");
        this.assignmentId = assignmentId;
    }

    public String getAssignmentId() {
        return assignmentId;
    }
}
