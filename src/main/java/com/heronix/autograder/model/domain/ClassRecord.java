package com.heronix.autograder.model.domain;

import java.time.OffsetDateTime;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.heronix.autograder.model.enums.ClassStatus;
import com.heronix.autograder.model.enums.Department;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Canonical class record, read from the {@code classes} table.
 *
 * The class code is always upper-case: the mutation service upper-cases it
 * before it reaches the store.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class ClassRecord {

    /**
     * Opaque identifier assigned by the record store
     */
    String id;

    String title;

    String description;

    Department department;

    /**
     * Alphanumeric class code, 2-10 characters (e.g. "CS101")
     */
    String code;

    /**
     * Free-form meeting schedule (e.g. "Mon, Wed 2-3:30 PM")
     */
    String schedule;

    /**
     * Academic term (e.g. "Spring 2025")
     */
    String term;

    ClassStatus status;

    OffsetDateTime createdAt;

    OffsetDateTime updatedAt;
}
