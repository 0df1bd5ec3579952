package com.heronix.autograder.controller.api;

import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.heronix.autograder.model.domain.ClassRecord;
import com.heronix.autograder.service.RecordLookupService;
import com.heronix.autograder.service.RecordMutationService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * REST API for class records.
 */
@RestController
@RequestMapping("/api/v1/autograder/classes")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Classes", description = "Read and edit class records")
public class ClassController {

    private final RecordLookupService lookupService;
    private final RecordMutationService mutationService;

    @GetMapping("/{classId}")
    @Operation(summary = "Get class", description = "Read one class record")
    @ApiResponse(responseCode = "200", description = "Class returned")
    @ApiResponse(responseCode = "404", description = "Class not found")
    public ResponseEntity<ClassRecord> getClassRecord(@PathVariable String classId) {
        return ResponseEntity.ok(lookupService.getClassRecord(classId));
    }

    @PatchMapping("/{classId}")
    @Operation(summary = "Edit class",
            description = "Replace the editable fields of a class. Every field is required; the code is stored upper-cased")
    @ApiResponse(responseCode = "200", description = "Class updated")
    @ApiResponse(responseCode = "400", description = "Validation failed")
    @ApiResponse(responseCode = "404", description = "Class not found")
    public ResponseEntity<ClassRecord> updateClass(
            @PathVariable String classId,
            @RequestBody Map<String, Object> payload) {

        log.debug("Editing class {} fields {}", classId, payload.keySet());
        return ResponseEntity.ok(mutationService.updateClass(classId, payload).getOrThrow());
    }
}
