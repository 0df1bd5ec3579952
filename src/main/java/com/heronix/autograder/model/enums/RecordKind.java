package com.heronix.autograder.model.enums;

import java.util.List;

import com.heronix.autograder.model.dto.AssignmentUpdateDTO;
import com.heronix.autograder.model.dto.ClassUpdateDTO;
import com.heronix.autograder.model.dto.GradingCriteriaUpdateDTO;
import com.heronix.autograder.model.dto.RecordPatch;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Mutation paths of the record mutation service.
 *
 * Each kind names the store table it writes to, the schema its patches are
 * validated against, and the canonical fields that schema lets through.
 * Grading criteria live on the assignments table but are only writable
 * through {@link #GRADING_CRITERIA}.
 */
@Getter
@RequiredArgsConstructor
public enum RecordKind {

    CLASS("classes", "Class",
            ClassUpdateDTO.class,
            List.of("title", "description", "department", "code", "schedule", "term", "status"),
            "Class updated successfully!"),

    ASSIGNMENT("assignments", "Assignment",
            AssignmentUpdateDTO.class,
            List.of("title", "description", "type", "points"),
            "Assignment updated successfully"),

    GRADING_CRITERIA("assignments", "Assignment",
            GradingCriteriaUpdateDTO.class,
            List.of("gradingCriteria"),
            "Grading criteria updated successfully");

    /**
     * Store table the patch is written to
     */
    private final String table;

    /**
     * Entity name used in messages
     */
    private final String entityName;

    /**
     * Validation schema for patches of this kind
     */
    private final Class<? extends RecordPatch> schema;

    /**
     * Canonical field names the schema accepts, in display order
     */
    private final List<String> editableFields;

    /**
     * User notice shown after a successful update
     */
    private final String successNotice;
}
