package com.heronix.autograder.model.dto;

/**
 * Body of the grading criteria edit.
 */
public record GradingCriteriaRequest(String gradingCriteria) {
}
