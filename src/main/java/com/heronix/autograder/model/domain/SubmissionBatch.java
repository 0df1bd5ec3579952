package com.heronix.autograder.model.domain;

import java.time.OffsetDateTime;
import java.util.Comparator;

import com.heronix.autograder.model.enums.BatchStatus;

import lombok.Builder;
import lombok.Value;

/**
 * A named group of uploaded submission files graded as one unit.
 *
 * A batch belongs to exactly one assignment for its whole life. Its file count
 * is fixed when the batch is created; only the status changes afterwards, and
 * only through the external grading pipeline.
 */
@Value
@Builder(toBuilder = true)
public class SubmissionBatch {

    /**
     * Newest first by creation time; ties broken by identifier, descending.
     */
    public static final Comparator<SubmissionBatch> NEWEST_FIRST = Comparator
            .comparing(SubmissionBatch::getCreatedAt, Comparator.nullsFirst(Comparator.<OffsetDateTime>naturalOrder()))
            .thenComparing(SubmissionBatch::getId, Comparator.nullsFirst(Comparator.<String>naturalOrder()))
            .reversed();

    String id;

    String assignmentId;

    /**
     * Batch name given at upload, or "Batch {id}" when none was given
     */
    String displayName;

    OffsetDateTime createdAt;

    BatchStatus status;

    int fileCount;
}
