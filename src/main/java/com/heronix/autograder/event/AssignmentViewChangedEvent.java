package com.heronix.autograder.event;

import com.heronix.autograder.model.domain.AssignmentView;

/**
 * Published whenever a new assignment view snapshot is committed.
 */
public record AssignmentViewChangedEvent(String assignmentId, AssignmentView view) {
}
