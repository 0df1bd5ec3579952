package com.heronix.autograder.model.dto;

import java.time.OffsetDateTime;

/**
 * A user-visible notice (the toast of the web client).
 */
public record UserNotice(Level level, String message, OffsetDateTime createdAt) {

    public enum Level {
        SUCCESS,
        ERROR
    }
}
