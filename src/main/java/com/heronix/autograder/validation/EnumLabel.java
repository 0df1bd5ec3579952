package com.heronix.autograder.validation;

import static java.lang.annotation.ElementType.FIELD;
import static java.lang.annotation.ElementType.PARAMETER;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import com.heronix.autograder.model.enums.LabeledEnum;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

/**
 * The annotated string must be the label of one of the constants of
 * {@link #value()}. {@code null} is valid; combine with {@code @NotNull} when
 * the field is required.
 */
@Documented
@Constraint(validatedBy = EnumLabelValidator.class)
@Target({FIELD, PARAMETER})
@Retention(RUNTIME)
public @interface EnumLabel {

    Class<? extends LabeledEnum> value();

    String message() default "is not an allowed value";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
