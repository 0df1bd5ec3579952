package com.heronix.autograder.model.dto;

import java.time.OffsetDateTime;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Error body returned by the REST API.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class ApiErrorResponse {

    /**
     * Machine-readable error code (e.g. VALIDATION_FAILED)
     */
    private String code;

    private String message;

    /**
     * Per-field violations for validation failures
     */
    private List<FieldViolation> violations;

    /**
     * Safe parent view the client should navigate to, for not-found failures
     */
    private String redirectTo;

    private OffsetDateTime timestamp;
}
