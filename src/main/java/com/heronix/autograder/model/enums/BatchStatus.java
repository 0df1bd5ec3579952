package com.heronix.autograder.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import lombok.RequiredArgsConstructor;

/**
 * Grading status of a submission batch.
 *
 * GRADING is the initial state. COMPLETED and FAILED are terminal: the batch
 * service accepts no transition out of them.
 */
@RequiredArgsConstructor
public enum BatchStatus implements LabeledEnum {

    /**
     * Batch uploaded, grading pipeline working on it
     */
    GRADING("grading"),

    /**
     * Grading finished and results are available
     */
    COMPLETED("completed"),

    /**
     * Grading pipeline gave up on the batch
     */
    FAILED("failed");

    private final String label;

    @Override
    @JsonValue
    public String getLabel() {
        return label;
    }

    public boolean isTerminal() {
        return this != GRADING;
    }

    /**
     * Whether moving from this status to {@code next} is a legal transition.
     * Staying in the same status is not a transition.
     */
    public boolean canTransitionTo(BatchStatus next) {
        return this == GRADING && next != null && next.isTerminal();
    }

    @JsonCreator
    public static BatchStatus fromLabel(String label) {
        return LabeledEnum.fromLabel(BatchStatus.class, label)
                .orElseThrow(() -> new IllegalArgumentException("Unknown batch status: " + label));
    }
}
