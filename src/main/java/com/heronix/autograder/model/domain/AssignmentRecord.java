package com.heronix.autograder.model.domain;

import java.time.OffsetDateTime;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.heronix.autograder.model.enums.AssignmentType;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Canonical assignment record, read from the {@code assignments} table.
 *
 * gradingCriteria is written only through the grading criteria path of the
 * mutation service; the general assignment edit rejects it.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class AssignmentRecord {

    /**
     * Opaque identifier assigned by the record store
     */
    String id;

    /**
     * Owning class, when the store provides it
     */
    String classId;

    String title;

    String description;

    /**
     * Decides which file types a submission batch accepts
     */
    AssignmentType type;

    /**
     * Points possible, always positive
     */
    Integer points;

    /**
     * Free-text rubric
     */
    String gradingCriteria;

    OffsetDateTime createdAt;

    OffsetDateTime updatedAt;
}
