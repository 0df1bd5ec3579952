package com.heronix.autograder.service;

import java.util.List;
import java.util.function.Function;

import com.heronix.autograder.exception.AutograderException;
import com.heronix.autograder.exception.PersistenceException;
import com.heronix.autograder.exception.RecordNotFoundException;
import com.heronix.autograder.exception.RecordValidationException;
import com.heronix.autograder.model.dto.FieldViolation;

/**
 * Outcome of a record mutation: the refreshed record, or a typed failure.
 *
 * @author Heronix Development Team
 * @version 1.0.0
 */
public record MutationResult<T>(boolean success, T value, MutationError error) {

    public static <T> MutationResult<T> success(T value) {
        return new MutationResult<>(true, value, null);
    }

    public static <T> MutationResult<T> failure(AutograderException cause) {
        return new MutationResult<>(false, null, MutationError.of(cause));
    }

    public <R> MutationResult<R> map(Function<? super T, ? extends R> mapper) {
        if (!success) {
            return new MutationResult<>(false, null, error);
        }
        return new MutationResult<>(true, mapper.apply(value), null);
    }

    /**
     * The record, or the failure rethrown as its exception.
     */
    public T getOrThrow() {
        if (!success) {
            throw error.cause();
        }
        return value;
    }

    public enum FailureKind {
        VALIDATION,
        NOT_FOUND,
        PERSISTENCE
    }

    /**
     * Why a mutation did not land. Field violations are present for
     * {@link FailureKind#VALIDATION} only.
     */
    public record MutationError(
            FailureKind kind,
            String message,
            List<FieldViolation> violations,
            AutograderException cause
    ) {
        static MutationError of(AutograderException cause) {
            if (cause instanceof RecordValidationException) {
                return new MutationError(FailureKind.VALIDATION, cause.getMessage(),
                        ((RecordValidationException) cause).getViolations(), cause);
            }
            if (cause instanceof RecordNotFoundException) {
                return new MutationError(FailureKind.NOT_FOUND, cause.getMessage(), List.of(), cause);
            }
            if (cause instanceof PersistenceException) {
                return new MutationError(FailureKind.PERSISTENCE, cause.getMessage(), List.of(), cause);
            }
            throw new IllegalArgumentException("Not a mutation failure: " + cause.getErrorCode(), cause);
        }
    }
}
