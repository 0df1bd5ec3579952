package com.heronix.autograder.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import lombok.RequiredArgsConstructor;

/**
 * Status of a class.
 */
@RequiredArgsConstructor
public enum ClassStatus implements LabeledEnum {

    /**
     * Class is running and accepts new assignments
     */
    ACTIVE("active"),

    /**
     * Class is archived
     */
    INACTIVE("inactive");

    private final String label;

    @Override
    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static ClassStatus fromLabel(String label) {
        return LabeledEnum.fromLabel(ClassStatus.class, label)
                .orElseThrow(() -> new IllegalArgumentException("Unknown class status: " + label));
    }
}
