package com.heronix.autograder;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

import com.heronix.autograder.config.AutograderProperties;

/**
 * Heronix Autograder - Assignment and Submission Record Service
 *
 * Keeps class, assignment and submission batch records in sync with the
 * backing record store. Every record crossing the store boundary is
 * validated, renamed between snake_case and camelCase, and republished to
 * listeners as an immutable snapshot.
 *
 * Grading itself happens elsewhere: this service only reflects the batch
 * status the grading pipeline writes back to the store.
 */
@SpringBootApplication
@EnableConfigurationProperties(AutograderProperties.class)
public class AutograderApplication {

    public static void main(String[] args) {
        SpringApplication.run(AutograderApplication.class, args);
    }
}
