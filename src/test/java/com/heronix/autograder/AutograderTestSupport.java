package com.heronix.autograder;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import org.springframework.context.ApplicationEventPublisher;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.heronix.autograder.config.AutograderProperties;

import jakarta.validation.Validation;
import jakarta.validation.Validator;

/**
 * Shared wiring for unit tests that build services by hand.
 */
public final class AutograderTestSupport {

    public static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    private AutograderTestSupport() {
    }

    public static Clock fixedClock() {
        return Clock.fixed(NOW, ZoneOffset.UTC);
    }

    public static ObjectMapper objectMapper() {
        return new ObjectMapper().findAndRegisterModules();
    }

    public static Validator validator() {
        return Validation.buildDefaultValidatorFactory().getValidator();
    }

    public static AutograderProperties properties() {
        return new AutograderProperties();
    }

    /**
     * Event publisher that records every published event.
     */
    public static final class RecordingPublisher implements ApplicationEventPublisher {

        private final List<Object> events = new ArrayList<>();

        @Override
        public void publishEvent(Object event) {
            events.add(event);
        }

        public List<Object> events() {
            return events;
        }

        public <T> List<T> events(Class<T> type) {
            return events.stream().filter(type::isInstance).map(type::cast).toList();
        }

        public void clear() {
            events.clear();
        }
    }
}
