package com.heronix.autograder.service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.springframework.stereotype.Service;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.heronix.autograder.exception.RecordValidationException;
import com.heronix.autograder.model.dto.FieldViolation;
import com.heronix.autograder.model.dto.RecordPatch;
import com.heronix.autograder.model.enums.RecordKind;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;

/**
 * Checks mutation payloads against the schema of their {@link RecordKind}.
 *
 * Synchronous and side-effect free: the record store is never touched.
 * A payload that passes comes back trimmed and normalized; one that fails
 * raises a {@link RecordValidationException} listing every violation in
 * schema field order.
 *
 * @author Heronix Development Team
 * @version 1.0.0
 */
@Service
@Slf4j
public class RecordValidationService {

    static final String PATCH_FIELD = "patch";

    private final ObjectMapper payloadMapper;
    private final Validator validator;

    public RecordValidationService(ObjectMapper objectMapper, Validator validator) {
        // "points": 2.5 is a type error, not a silently truncated 2
        this.payloadMapper = objectMapper.copy()
                .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT);
        this.validator = validator;
    }

    /**
     * Validate a canonical (camelCase) payload.
     *
     * @return the trimmed, normalized patch
     * @throws RecordValidationException if any field violates the schema
     */
    public RecordPatch validate(RecordKind kind, Map<String, Object> payload) {
        Map<String, Object> fields = payload != null ? payload : Map.of();

        List<FieldViolation> violations = new ArrayList<>(rejectForeignFields(kind, fields));
        if (!violations.isEmpty()) {
            throw reject(kind, violations);
        }

        RecordPatch patch = bind(kind, fields).trimmed();

        for (ConstraintViolation<RecordPatch> violation : validator.validate(patch)) {
            violations.add(new FieldViolation(violation.getPropertyPath().toString(), violation.getMessage()));
        }
        if (!violations.isEmpty()) {
            throw reject(kind, sortBySchemaOrder(kind, violations));
        }

        if (patch.toCanonicalMap().isEmpty()) {
            throw reject(kind, List.of(new FieldViolation(PATCH_FIELD,
                    "At least one of " + String.join(", ", kind.getEditableFields()) + " must be provided")));
        }

        return patch.normalized();
    }

    // ========================================================================
    // HELPER METHODS
    // ========================================================================

    private List<FieldViolation> rejectForeignFields(RecordKind kind, Map<String, Object> fields) {
        Set<String> editable = Set.copyOf(kind.getEditableFields());
        List<FieldViolation> violations = new ArrayList<>();

        for (String key : fields.keySet()) {
            if (editable.contains(key)) {
                continue;
            }
            if (kind == RecordKind.ASSIGNMENT && "gradingCriteria".equals(key)) {
                violations.add(new FieldViolation(key,
                        "Grading criteria can only be changed through the grading criteria editor"));
            } else {
                violations.add(new FieldViolation(key, key + " is not an editable field"));
            }
        }
        return violations;
    }

    private RecordPatch bind(RecordKind kind, Map<String, Object> fields) {
        try {
            return payloadMapper.convertValue(fields, kind.getSchema());
        } catch (IllegalArgumentException e) {
            String field = PATCH_FIELD;
            if (e.getCause() instanceof JsonMappingException) {
                List<JsonMappingException.Reference> path = ((JsonMappingException) e.getCause()).getPath();
                if (!path.isEmpty() && path.get(0).getFieldName() != null) {
                    field = path.get(0).getFieldName();
                }
            }
            throw reject(kind, List.of(new FieldViolation(field, "Invalid value for " + field)));
        }
    }

    private static List<FieldViolation> sortBySchemaOrder(RecordKind kind, List<FieldViolation> violations) {
        List<String> order = kind.getEditableFields();
        List<FieldViolation> sorted = new ArrayList<>(violations);
        sorted.sort(Comparator
                .comparingInt((FieldViolation v) -> order.indexOf(v.field()))
                .thenComparing(FieldViolation::reason));
        return sorted;
    }

    private static RecordValidationException reject(RecordKind kind, List<FieldViolation> violations) {
        log.warn("RECORD_VALIDATION: rejected kind={} violations={}", kind, violations);
        return new RecordValidationException(violations);
    }
}
