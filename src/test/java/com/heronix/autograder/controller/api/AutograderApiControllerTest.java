package com.heronix.autograder.controller.api;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import com.heronix.autograder.AutograderTestSupport;
import com.heronix.autograder.AutograderTestSupport.RecordingPublisher;
import com.heronix.autograder.controller.GlobalExceptionHandler;
import com.heronix.autograder.exception.EmptyUploadException;
import com.heronix.autograder.exception.PersistenceException;
import com.heronix.autograder.exception.RecordNotFoundException;
import com.heronix.autograder.exception.RecordValidationException;
import com.heronix.autograder.model.domain.AssignmentRecord;
import com.heronix.autograder.model.domain.SubmissionBatch;
import com.heronix.autograder.model.dto.UploadedFile;
import com.heronix.autograder.model.dto.UserNotice;
import com.heronix.autograder.model.enums.BatchStatus;
import com.heronix.autograder.service.AssignmentViewService;
import com.heronix.autograder.service.GradingCriteriaTemplateService;
import com.heronix.autograder.service.MutationResult;
import com.heronix.autograder.service.NoticeService;
import com.heronix.autograder.service.RecordLookupService;
import com.heronix.autograder.service.RecordMutationService;
import com.heronix.autograder.service.SubmissionBatchService;
import com.heronix.autograder.service.ViewRefreshResult;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class AutograderApiControllerTest {

    private RecordLookupService lookupService;
    private RecordMutationService mutationService;
    private SubmissionBatchService batchService;
    private AssignmentViewService viewService;
    private NoticeService noticeService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        Clock clock = AutograderTestSupport.fixedClock();
        lookupService = mock(RecordLookupService.class);
        mutationService = mock(RecordMutationService.class);
        batchService = mock(SubmissionBatchService.class);
        viewService = mock(AssignmentViewService.class);
        noticeService = new NoticeService(new RecordingPublisher(), clock, AutograderTestSupport.properties());

        mockMvc = MockMvcBuilders
                .standaloneSetup(
                        new ClassController(lookupService, mutationService),
                        new AssignmentController(lookupService, mutationService,
                                mock(GradingCriteriaTemplateService.class)),
                        new SubmissionBatchController(batchService),
                        new AssignmentViewController(viewService),
                        new NoticeController(noticeService))
                .setControllerAdvice(new GlobalExceptionHandler(noticeService, clock))
                .build();
    }

    @Test
    void classEditWithViolations_isBadRequestWithFieldDetails() throws Exception {
        when(mutationService.updateClass(eq("c1"), any())).thenReturn(MutationResult.failure(
                new RecordValidationException("code", "Class code must be alphanumeric")));

        mockMvc.perform(patch("/api/v1/autograder/classes/c1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"code\":\"CS-1\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.violations[0].field").value("code"))
                .andExpect(jsonPath("$.violations[0].reason").value("Class code must be alphanumeric"));
    }

    @Test
    void missingAssignmentView_isNotFoundWithRedirect() throws Exception {
        when(viewService.getView("c1", "gone")).thenThrow(
                new RecordNotFoundException("Assignment", "assignments", "gone", "/classes/c1"));

        mockMvc.perform(get("/api/v1/autograder/classes/c1/assignments/gone/view"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Assignment not found"))
                .andExpect(jsonPath("$.redirectTo").value("/classes/c1"));
    }

    @Test
    void failedViewRefresh_isBadGateway() throws Exception {
        PersistenceException failure = new PersistenceException("submissions", "Record store timed out on submissions");
        when(viewService.refresh("c1", "a1")).thenReturn(ViewRefreshResult.failed(failure, null));

        mockMvc.perform(post("/api/v1/autograder/classes/c1/assignments/a1/view/refresh"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.code").value("PERSISTENCE_FAILED"));
    }

    @Test
    void upload_createsBatchFromFileMetadata() throws Exception {
        SubmissionBatch batch = SubmissionBatch.builder()
                .id("s9").assignmentId("a1").displayName("Period 3")
                .createdAt(OffsetDateTime.of(2025, 3, 1, 10, 0, 0, 0, ZoneOffset.UTC))
                .status(BatchStatus.GRADING).fileCount(2).build();
        when(batchService.uploadBatch(eq("a1"), eq("Period 3"), anyList())).thenAnswer(invocation -> {
            List<UploadedFile> files = invocation.getArgument(2);
            assertEquals(List.of(
                    new UploadedFile("one.pdf", "application/pdf"),
                    new UploadedFile("two.pdf", "application/pdf")), files);
            return batch;
        });

        mockMvc.perform(multipart("/api/v1/autograder/assignments/a1/batches")
                        .file(new MockMultipartFile("files", "one.pdf", "application/pdf", new byte[] {1}))
                        .file(new MockMultipartFile("files", "two.pdf", "application/pdf", new byte[] {2}))
                        .param("batchName", "Period 3"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("s9"))
                .andExpect(jsonPath("$.status").value("grading"))
                .andExpect(jsonPath("$.fileCount").value(2));
    }

    @Test
    void uploadWithoutFiles_isBadRequest() throws Exception {
        when(batchService.uploadBatch(eq("a1"), isNull(), eq(List.of())))
                .thenThrow(new EmptyUploadException("a1"));

        mockMvc.perform(multipart("/api/v1/autograder/assignments/a1/batches"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("EMPTY_UPLOAD"))
                .andExpect(jsonPath("$.message").value("Please select at least one file to upload"));
    }

    @Test
    void unexpectedFailure_isInternalErrorWithNotice() throws Exception {
        when(lookupService.getAssignment("a1")).thenThrow(new IllegalStateException("bug"));

        mockMvc.perform(get("/api/v1/autograder/assignments/a1"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value("INTERNAL_ERROR"));

        mockMvc.perform(get("/api/v1/autograder/notices").param("limit", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].level").value("ERROR"));
    }

    @Test
    void malformedBody_isBadRequestWithNotice() throws Exception {
        mockMvc.perform(patch("/api/v1/autograder/classes/c1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("MALFORMED_REQUEST"));

        List<UserNotice> notices = noticeService.recent(10);
        assertEquals(1, notices.size());
        assertEquals(UserNotice.Level.ERROR, notices.get(0).level());
        assertEquals("Request could not be read", notices.get(0).message());
    }

    @Test
    void missingBatch_isNotFoundWithRedirect() throws Exception {
        when(batchService.requireBatch("a1", "missing")).thenThrow(new RecordNotFoundException(
                "Submission batch", "submissions", "missing", "/assignments/a1/batches"));

        mockMvc.perform(get("/api/v1/autograder/assignments/a1/batches/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Submission batch not found"))
                .andExpect(jsonPath("$.redirectTo").value("/assignments/a1/batches"));
    }

    @Test
    void assignmentEdit_returnsUpdatedRecord() throws Exception {
        when(mutationService.updateAssignment(eq("a1"), eq(Map.of("points", 20)))).thenReturn(
                MutationResult.success(AssignmentRecord.builder()
                        .id("a1").title("Essay").points(20).build()));

        mockMvc.perform(patch("/api/v1/autograder/assignments/a1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"points\":20}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.points").value(20));
    }
}
