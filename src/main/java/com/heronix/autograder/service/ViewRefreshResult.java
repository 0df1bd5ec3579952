package com.heronix.autograder.service;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.heronix.autograder.exception.AutograderException;
import com.heronix.autograder.exception.RecordNotFoundException;
import com.heronix.autograder.model.domain.AssignmentView;

/**
 * Outcome of an assignment view refresh.
 *
 * @param status     what happened to the fetched data
 * @param view       the view committed after the refresh; on failure the
 *                   previous view, or null if none was ever committed
 * @param message    failure message, null otherwise
 * @param redirectTo parent view to navigate to when the assignment is gone
 * @param error      the failure, for rethrowing at the API edge
 *
 * @author Heronix Development Team
 * @version 1.0.0
 */
public record ViewRefreshResult(
        Status status,
        AssignmentView view,
        String message,
        String redirectTo,
        @JsonIgnore AutograderException error
) {

    public enum Status {
        /** Fetched data was committed */
        COMMITTED,
        /** A newer refresh or update was committed first; fetched data was discarded */
        SUPERSEDED,
        /** A fetch failed; nothing was committed */
        FAILED
    }

    public static ViewRefreshResult committed(AssignmentView view) {
        return new ViewRefreshResult(Status.COMMITTED, view, null, null, null);
    }

    public static ViewRefreshResult superseded(AssignmentView current) {
        return new ViewRefreshResult(Status.SUPERSEDED, current, null, null, null);
    }

    public static ViewRefreshResult failed(AutograderException error, AssignmentView previous) {
        String redirectTo = error instanceof RecordNotFoundException
                ? ((RecordNotFoundException) error).getRedirectTo()
                : null;
        return new ViewRefreshResult(Status.FAILED, previous, error.getMessage(), redirectTo, error);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return status != Status.FAILED;
    }
}
