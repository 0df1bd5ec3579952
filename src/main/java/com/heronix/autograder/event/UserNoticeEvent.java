package com.heronix.autograder.event;

import com.heronix.autograder.model.dto.UserNotice;

/**
 * Carries one user-visible notice to subscribers.
 */
public record UserNoticeEvent(UserNotice notice) {
}
