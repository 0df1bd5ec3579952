package com.heronix.autograder.exception;

/**
 * Base exception of the autograder record service.
 */
public class AutograderException extends RuntimeException {

    private final String errorCode;

    public AutograderException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public AutograderException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
