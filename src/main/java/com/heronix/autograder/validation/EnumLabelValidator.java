package com.heronix.autograder.validation;

import java.util.Set;

import com.heronix.autograder.model.enums.LabeledEnum;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;

/**
 * Checks a string against the closed label set of a {@link LabeledEnum}.
 */
public class EnumLabelValidator implements ConstraintValidator<EnumLabel, String> {

    private Set<String> allowedLabels;

    @Override
    public void initialize(EnumLabel annotation) {
        this.allowedLabels = Set.copyOf(LabeledEnum.labels(annotation.value()));
    }

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        return value == null || allowedLabels.contains(value);
    }
}
