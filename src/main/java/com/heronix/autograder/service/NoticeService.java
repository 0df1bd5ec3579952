package com.heronix.autograder.service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import com.heronix.autograder.config.AutograderProperties;
import com.heronix.autograder.event.UserNoticeEvent;
import com.heronix.autograder.model.dto.UserNotice;

import lombok.extern.slf4j.Slf4j;

/**
 * Emits user-visible notices.
 *
 * Each operation outcome produces exactly one notice: the services call
 * {@link #success(String)} or {@link #error(String)} once per outcome. Notices
 * are published as {@link UserNoticeEvent}s and the most recent ones are kept
 * for the notices endpoint.
 *
 * @author Heronix Development Team
 * @version 1.0.0
 */
@Service
@Slf4j
public class NoticeService {

    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;
    private final int bufferSize;
    private final Deque<UserNotice> recent = new ArrayDeque<>();

    public NoticeService(ApplicationEventPublisher eventPublisher, Clock clock, AutograderProperties properties) {
        this.eventPublisher = eventPublisher;
        this.clock = clock;
        this.bufferSize = Math.max(1, properties.getNotices().getBufferSize());
    }

    public UserNotice success(String message) {
        return publish(UserNotice.Level.SUCCESS, message);
    }

    public UserNotice error(String message) {
        return publish(UserNotice.Level.ERROR, message);
    }

    /**
     * Most recent notices, newest first.
     */
    public synchronized List<UserNotice> recent(int limit) {
        List<UserNotice> result = new ArrayList<>(Math.min(limit, recent.size()));
        for (UserNotice notice : recent) {
            if (result.size() >= limit) {
                break;
            }
            result.add(notice);
        }
        return result;
    }

    private UserNotice publish(UserNotice.Level level, String message) {
        UserNotice notice = new UserNotice(level, message, OffsetDateTime.now(clock));
        synchronized (this) {
            recent.addFirst(notice);
            while (recent.size() > bufferSize) {
                recent.removeLast();
            }
        }
        log.debug("NOTICE: level={} message={}", level, message);
        eventPublisher.publishEvent(new UserNoticeEvent(notice));
        return notice;
    }
}
