package com.heronix.autograder.model.enums;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * An enumeration whose constants travel across the record store boundary
 * as fixed string labels (e.g. "Computer Science", "grading").
 */
public interface LabeledEnum {

    /**
     * Label stored in the record store and returned to API clients.
     */
    String getLabel();

    /**
     * Look up a constant by its exact label.
     */
    static <E extends Enum<E> & LabeledEnum> Optional<E> fromLabel(Class<E> type, String label) {
        if (label == null) {
            return Optional.empty();
        }
        return Arrays.stream(type.getEnumConstants())
                .filter(constant -> constant.getLabel().equals(label))
                .findFirst();
    }

    /**
     * All labels of an enumeration, in declaration order.
     */
    static List<String> labels(Class<? extends LabeledEnum> type) {
        return Arrays.stream(type.getEnumConstants())
                .map(LabeledEnum::getLabel)
                .toList();
    }
}
