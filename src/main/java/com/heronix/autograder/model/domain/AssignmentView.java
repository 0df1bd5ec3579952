package com.heronix.autograder.model.domain;

import java.time.OffsetDateTime;
import java.util.List;

import lombok.Builder;
import lombok.Value;

/**
 * An assignment together with its submission batches, as last committed by
 * the assignment view service. Instances are immutable snapshots.
 */
@Value
@Builder(toBuilder = true)
public class AssignmentView {

    /**
     * Class the view was opened from; the redirect target when the assignment disappears
     */
    String classId;

    AssignmentRecord assignment;

    /**
     * Batches, newest first
     */
    List<SubmissionBatch> batches;

    /**
     * MIME types accepted for new uploads
     */
    List<String> acceptedFileTypes;

    /**
     * "Audio" or "PDF"
     */
    String fileRequirement;

    /**
     * Sequence number of the refresh or update that produced this snapshot
     */
    long sequence;

    OffsetDateTime committedAt;

    public int getBatchCount() {
        return batches != null ? batches.size() : 0;
    }
}
