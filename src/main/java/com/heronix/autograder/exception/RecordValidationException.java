package com.heronix.autograder.exception;

import java.util.List;

import com.heronix.autograder.model.dto.FieldViolation;

/**
 * Exception thrown when a payload fails its schema. Never reaches the record store.
 */
public class RecordValidationException extends AutograderException {

    private final List<FieldViolation> violations;

    public RecordValidationException(List<FieldViolation> violations) {
        super("VALIDATION_FAILED", describe(violations));
        this.violations = List.copyOf(violations);
    }

    public RecordValidationException(String field, String reason) {
        this(List.of(new FieldViolation(field, reason)));
    }

    public List<FieldViolation> getViolations() {
        return violations;
    }

    private static String describe(List<FieldViolation> violations) {
        if (violations.size() == 1) {
            return violations.get(0).reason();
        }
        return violations.size() + " fields failed validation";
    }
}
