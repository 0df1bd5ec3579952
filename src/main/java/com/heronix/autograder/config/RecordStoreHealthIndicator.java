package com.heronix.autograder.config;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import com.heronix.autograder.store.RecordStore;

import lombok.RequiredArgsConstructor;

/**
 * Spring Boot Actuator health indicator for the record store.
 *
 * Reports UP when the store answers, DOWN when it is unreachable. Reads and
 * mutations fail with a persistence error while the store is down.
 */
@Component
@RequiredArgsConstructor
public class RecordStoreHealthIndicator implements HealthIndicator {

    private final RecordStore recordStore;

    @Override
    public Health health() {
        if (recordStore.isAvailable()) {
            return Health.up()
                    .withDetail("mode", recordStore.getMode())
                    .withDetail("record-store", "connected")
                    .build();
        }

        return Health.down()
                .withDetail("mode", recordStore.getMode())
                .withDetail("record-store", "unreachable")
                .build();
    }
}
