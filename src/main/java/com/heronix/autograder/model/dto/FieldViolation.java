package com.heronix.autograder.model.dto;

/**
 * A constraint failure on one field of a mutation payload.
 *
 * @param field  canonical field name (e.g. "code")
 * @param reason human-readable reason, shown next to the field
 */
public record FieldViolation(String field, String reason) {
}
