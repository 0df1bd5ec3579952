package com.heronix.autograder.config;

import java.time.Clock;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Shared infrastructure beans.
 *
 * @author Heronix Development Team
 * @version 1.0.0
 */
@Configuration
public class AutograderConfig {

    /**
     * Clock used for updated_at stamps and in-memory store timestamps.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
