package com.heronix.autograder.controller.api;

import java.util.List;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import com.heronix.autograder.model.domain.SubmissionBatch;
import com.heronix.autograder.model.dto.UploadedFile;
import com.heronix.autograder.service.SubmissionBatchService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * REST API for submission batches.
 */
@RestController
@RequestMapping("/api/v1/autograder/assignments/{assignmentId}/batches")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Submission Batches", description = "Upload submissions and track their grading status")
public class SubmissionBatchController {

    private final SubmissionBatchService batchService;

    @GetMapping
    @Operation(summary = "List batches", description = "Batches of an assignment, newest first")
    @ApiResponse(responseCode = "200", description = "Batches returned")
    public ResponseEntity<List<SubmissionBatch>> listBatches(@PathVariable String assignmentId) {
        return ResponseEntity.ok(batchService.listBatches(assignmentId));
    }

    @GetMapping("/{batchId}")
    @Operation(summary = "Get batch", description = "Last observed state of one batch")
    @ApiResponse(responseCode = "200", description = "Batch returned")
    @ApiResponse(responseCode = "404", description = "Batch not found")
    public ResponseEntity<SubmissionBatch> getBatch(
            @PathVariable String assignmentId,
            @PathVariable String batchId) {

        return ResponseEntity.ok(batchService.requireBatch(assignmentId, batchId));
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "Upload batch",
            description = "Create a batch from uploaded files. The batch starts in status grading")
    @ApiResponse(responseCode = "201", description = "Batch created")
    @ApiResponse(responseCode = "400", description = "No files, or files of the wrong type")
    public ResponseEntity<SubmissionBatch> uploadBatch(
            @PathVariable String assignmentId,
            @RequestParam(name = "files", required = false) List<MultipartFile> files,
            @RequestParam(required = false) String batchName) {

        List<UploadedFile> uploaded = files == null ? List.of() : files.stream()
                .filter(file -> !file.isEmpty())
                .map(file -> new UploadedFile(file.getOriginalFilename(), file.getContentType()))
                .toList();

        log.info("Uploading {} files to assignment {}", uploaded.size(), assignmentId);

        SubmissionBatch batch = batchService.uploadBatch(assignmentId, batchName, uploaded);
        return ResponseEntity.status(HttpStatus.CREATED).body(batch);
    }

    @PostMapping("/refresh")
    @Operation(summary = "Refresh batches", description = "Re-read batch statuses from the record store")
    @ApiResponse(responseCode = "200", description = "Batches returned")
    public ResponseEntity<List<SubmissionBatch>> refresh(@PathVariable String assignmentId) {
        return ResponseEntity.ok(batchService.refresh(assignmentId));
    }
}
