package com.heronix.autograder.controller.api;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.heronix.autograder.model.domain.AssignmentView;
import com.heronix.autograder.service.AssignmentViewService;
import com.heronix.autograder.service.ViewRefreshResult;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;

/**
 * REST API for the assignment page: one assignment with its batches.
 */
@RestController
@RequestMapping("/api/v1/autograder/classes/{classId}/assignments/{assignmentId}/view")
@RequiredArgsConstructor
@Tag(name = "Assignment View", description = "Assignment with its submission batches")
public class AssignmentViewController {

    private final AssignmentViewService viewService;

    @GetMapping
    @Operation(summary = "Get assignment view", description = "Last committed view, loaded on first request")
    @ApiResponse(responseCode = "200", description = "View returned")
    @ApiResponse(responseCode = "404", description = "Assignment not found; redirectTo names the class view")
    public ResponseEntity<AssignmentView> getView(
            @PathVariable String classId,
            @PathVariable String assignmentId) {

        return ResponseEntity.ok(viewService.getView(classId, assignmentId));
    }

    @PostMapping("/refresh")
    @Operation(summary = "Refresh assignment view",
            description = "Re-read the assignment and its batches; the previous view is kept if either read fails")
    @ApiResponse(responseCode = "200", description = "View refreshed or superseded by a newer one")
    @ApiResponse(responseCode = "404", description = "Assignment not found; redirectTo names the class view")
    @ApiResponse(responseCode = "502", description = "Record store failed; previous view kept")
    public ResponseEntity<ViewRefreshResult> refresh(
            @PathVariable String classId,
            @PathVariable String assignmentId) {

        ViewRefreshResult result = viewService.refresh(classId, assignmentId);
        if (!result.isSuccess()) {
            throw result.error();
        }
        return ResponseEntity.ok(result);
    }
}
