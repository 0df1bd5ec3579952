package com.heronix.autograder.event;

import java.util.List;

import com.heronix.autograder.model.domain.SubmissionBatch;

/**
 * Published whenever the committed batch list of an assignment is replaced.
 */
public record BatchListChangedEvent(String assignmentId, List<SubmissionBatch> batches) {
}
