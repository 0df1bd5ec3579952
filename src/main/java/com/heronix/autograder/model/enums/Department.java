package com.heronix.autograder.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import lombok.RequiredArgsConstructor;

/**
 * Departments a class can belong to. The set is closed.
 */
@RequiredArgsConstructor
public enum Department implements LabeledEnum {

    LANGUAGE("Language"),
    COMPUTER_SCIENCE("Computer Science"),
    MATHEMATICS("Mathematics"),
    PHYSICS("Physics"),
    CHEMISTRY("Chemistry"),
    BIOLOGY("Biology"),
    ENGINEERING("Engineering");

    private final String label;

    @Override
    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * @throws IllegalArgumentException if the label is not a known department
     */
    @JsonCreator
    public static Department fromLabel(String label) {
        return LabeledEnum.fromLabel(Department.class, label)
                .orElseThrow(() -> new IllegalArgumentException("Unknown department: " + label));
    }
}
