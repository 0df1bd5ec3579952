package com.heronix.autograder.service;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GradingCriteriaTemplateServiceTest {

    @Test
    void tenPointRubric_matchesTheClassicExample() {
        String rubric = GradingCriteriaTemplateService.exampleCriteria(10);

        assertTrue(rubric.startsWith("Rubric Guidelines (Total: 10 points)"));
        assertTrue(rubric.contains("• Complete (4pts)"));
        assertTrue(rubric.contains("• Partial (2-3pts)"));
        assertTrue(rubric.contains("• Strong (3pts)"));
        assertTrue(rubric.contains("• Thorough (3pts)"));
    }

    @Test
    void categoriesAddUpToTotal() {
        String rubric = GradingCriteriaTemplateService.exampleCriteria(25);

        assertTrue(rubric.contains("Content Understanding [40%] (10pts)"));
        assertTrue(rubric.contains("Organization [30%] (8pts)"));
        assertTrue(rubric.contains("Evidence/Support [30%] (7pts)"));
    }
}
