package com.heronix.autograder.controller.api;

import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.heronix.autograder.model.domain.AssignmentRecord;
import com.heronix.autograder.model.dto.GradingCriteriaRequest;
import com.heronix.autograder.service.GradingCriteriaTemplateService;
import com.heronix.autograder.service.GradingCriteriaTemplateService.GradingCriteriaTemplate;
import com.heronix.autograder.service.RecordLookupService;
import com.heronix.autograder.service.RecordMutationService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * REST API for assignment records and their grading criteria.
 */
@RestController
@RequestMapping("/api/v1/autograder/assignments")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Assignments", description = "Read and edit assignments and grading criteria")
public class AssignmentController {

    private final RecordLookupService lookupService;
    private final RecordMutationService mutationService;
    private final GradingCriteriaTemplateService templateService;

    @GetMapping("/{assignmentId}")
    @Operation(summary = "Get assignment", description = "Read one assignment record")
    @ApiResponse(responseCode = "200", description = "Assignment returned")
    @ApiResponse(responseCode = "404", description = "Assignment not found")
    public ResponseEntity<AssignmentRecord> getAssignment(@PathVariable String assignmentId) {
        return ResponseEntity.ok(lookupService.getAssignment(assignmentId));
    }

    @PatchMapping("/{assignmentId}")
    @Operation(summary = "Edit assignment",
            description = "Partial update of title, description, type or points. Grading criteria are rejected here")
    @ApiResponse(responseCode = "200", description = "Assignment updated")
    @ApiResponse(responseCode = "400", description = "Validation failed")
    @ApiResponse(responseCode = "404", description = "Assignment not found")
    public ResponseEntity<AssignmentRecord> updateAssignment(
            @PathVariable String assignmentId,
            @RequestBody Map<String, Object> payload) {

        log.debug("Editing assignment {} fields {}", assignmentId, payload.keySet());
        return ResponseEntity.ok(mutationService.updateAssignment(assignmentId, payload).getOrThrow());
    }

    @PutMapping("/{assignmentId}/grading-criteria")
    @Operation(summary = "Edit grading criteria", description = "Replace the grading rubric of an assignment")
    @ApiResponse(responseCode = "200", description = "Grading criteria updated")
    @ApiResponse(responseCode = "400", description = "Validation failed")
    @ApiResponse(responseCode = "404", description = "Assignment not found")
    public ResponseEntity<AssignmentRecord> updateGradingCriteria(
            @PathVariable String assignmentId,
            @RequestBody GradingCriteriaRequest request) {

        return ResponseEntity.ok(
                mutationService.updateGradingCriteria(assignmentId, request.gradingCriteria()).getOrThrow());
    }

    @GetMapping("/{assignmentId}/grading-criteria/template")
    @Operation(summary = "Grading criteria example",
            description = "Example rubric scaled to the assignment's total points")
    @ApiResponse(responseCode = "200", description = "Template returned")
    public ResponseEntity<GradingCriteriaTemplate> getTemplate(@PathVariable String assignmentId) {
        return ResponseEntity.ok(templateService.templateFor(assignmentId));
    }
}
