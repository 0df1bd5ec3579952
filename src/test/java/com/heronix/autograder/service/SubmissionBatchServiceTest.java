package com.heronix.autograder.service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.heronix.autograder.AutograderTestSupport;
import com.heronix.autograder.AutograderTestSupport.RecordingPublisher;
import com.heronix.autograder.config.AutograderProperties;
import com.heronix.autograder.event.BatchListChangedEvent;
import com.heronix.autograder.exception.EmptyUploadException;
import com.heronix.autograder.exception.RecordNotFoundException;
import com.heronix.autograder.exception.RecordValidationException;
import com.heronix.autograder.mapping.RecordMapper;
import com.heronix.autograder.model.domain.SubmissionBatch;
import com.heronix.autograder.model.dto.UploadedFile;
import com.heronix.autograder.model.dto.UserNotice;
import com.heronix.autograder.model.enums.BatchStatus;
import com.heronix.autograder.store.RecordQuery;
import com.heronix.autograder.store.memory.InMemoryRecordStore;

import static org.junit.jupiter.api.Assertions.*;

class SubmissionBatchServiceTest {

    private InMemoryRecordStore store;
    private RecordingPublisher publisher;
    private NoticeService noticeService;
    private SubmissionBatchService service;

    @BeforeEach
    void setUp() {
        Clock clock = AutograderTestSupport.fixedClock();
        AutograderProperties properties = AutograderTestSupport.properties();
        store = new InMemoryRecordStore(clock);
        publisher = new RecordingPublisher();
        noticeService = new NoticeService(publisher, clock, properties);
        RecordMapper mapper = new RecordMapper(AutograderTestSupport.objectMapper(), clock, properties);
        RecordLookupService lookupService = new RecordLookupService(store, mapper, noticeService);
        service = new SubmissionBatchService(store, mapper, lookupService, new UploadPolicyService(),
                noticeService, publisher);

        store.insert(RecordMapper.ASSIGNMENTS, assignmentRow("voice-1", "voice")).block();
        store.insert(RecordMapper.ASSIGNMENTS, assignmentRow("doc-1", "document")).block();
    }

    @Test
    void createBatch_startsGradingWithSynthesizedName() {
        SubmissionBatch batch = service.createBatch("doc-1", "", 3);

        assertEquals(BatchStatus.GRADING, batch.getStatus());
        assertEquals(3, batch.getFileCount());
        assertEquals("Batch " + batch.getId(), batch.getDisplayName());
        assertEquals("doc-1", batch.getAssignmentId());

        Map<String, Object> stored = store.findById(RecordMapper.SUBMISSIONS, batch.getId()).block();
        assertEquals("grading", stored.get("status"));
        assertEquals(3, stored.get("file_count"));
        assertNull(stored.get("batch_name"));
        assertEquals("Files uploaded successfully", noticeService.recent(1).get(0).message());
    }

    @Test
    void createBatch_withoutFilesFailsAndAddsNothing() {
        List<SubmissionBatch> before = service.listBatches("doc-1");

        assertThrows(EmptyUploadException.class, () -> service.createBatch("doc-1", "X", 0));

        assertEquals(before, service.listBatches("doc-1"));
        assertTrue(store.select(RecordQuery.from(RecordMapper.SUBMISSIONS)).block().isEmpty());
        assertEquals(UserNotice.Level.ERROR, noticeService.recent(1).get(0).level());
    }

    @Test
    void createBatch_rejectsNegativeCount() {
        assertThrows(IllegalArgumentException.class, () -> service.createBatch("doc-1", "X", -1));
    }

    @Test
    void listBatches_isNewestFirst() {
        store.insert(RecordMapper.SUBMISSIONS, submissionRow("s1", "doc-1", "2025-02-01T10:00:00.000Z", "completed")).block();
        store.insert(RecordMapper.SUBMISSIONS, submissionRow("s3", "doc-1", "2025-02-03T10:00:00.000Z", "grading")).block();
        store.insert(RecordMapper.SUBMISSIONS, submissionRow("s2", "doc-1", "2025-02-02T10:00:00.000Z", "failed")).block();
        store.insert(RecordMapper.SUBMISSIONS, submissionRow("other", "voice-1", "2025-02-04T10:00:00.000Z", "grading")).block();

        List<SubmissionBatch> batches = service.listBatches("doc-1");

        assertEquals(List.of("s3", "s2", "s1"), batches.stream().map(SubmissionBatch::getId).toList());
    }

    @Test
    void sameCreatedAt_isOrderedByIdDescending() {
        store.insert(RecordMapper.SUBMISSIONS, submissionRow("b-1", "doc-1", "2025-02-01T10:00:00.000Z", "grading")).block();
        store.insert(RecordMapper.SUBMISSIONS, submissionRow("b-2", "doc-1", "2025-02-01T10:00:00.000Z", "grading")).block();

        assertEquals(List.of("b-2", "b-1"),
                service.refresh("doc-1").stream().map(SubmissionBatch::getId).toList());
    }

    @Test
    void createBatch_prependsToListedBatches() {
        store.insert(RecordMapper.SUBMISSIONS, submissionRow("s1", "doc-1", "2025-02-01T10:00:00.000Z", "completed")).block();
        service.listBatches("doc-1");
        publisher.clear();

        SubmissionBatch batch = service.createBatch("doc-1", "  Period 2  ", 4);

        List<SubmissionBatch> batches = service.listBatches("doc-1");
        assertEquals(List.of(batch.getId(), "s1"), batches.stream().map(SubmissionBatch::getId).toList());
        assertEquals("Period 2", batches.get(0).getDisplayName());
        assertEquals(batches, publisher.events(BatchListChangedEvent.class).get(0).batches());
    }

    @Test
    void refresh_observesExternalStatusChanges() {
        SubmissionBatch batch = service.createBatch("doc-1", "Period 1", 2);
        assertEquals(BatchStatus.GRADING, service.listBatches("doc-1").get(0).getStatus());

        store.update(RecordMapper.SUBMISSIONS, batch.getId(), Map.of("status", "completed")).block();
        service.refresh("doc-1");

        assertEquals(BatchStatus.COMPLETED, service.getBatch("doc-1", batch.getId()).orElseThrow().getStatus());
    }

    @Test
    void refresh_reflectsTerminalToGradingAsFreshState() {
        store.insert(RecordMapper.SUBMISSIONS, submissionRow("s1", "doc-1", "2025-02-01T10:00:00.000Z", "completed")).block();
        assertEquals(BatchStatus.COMPLETED, service.listBatches("doc-1").get(0).getStatus());
        publisher.clear();

        store.update(RecordMapper.SUBMISSIONS, "s1", Map.of("status", "grading")).block();
        List<SubmissionBatch> batches = service.refresh("doc-1");

        assertEquals(BatchStatus.GRADING, batches.get(0).getStatus());
        assertEquals(BatchStatus.GRADING, service.getBatch("doc-1", "s1").orElseThrow().getStatus());
        assertEquals(batches, publisher.events(BatchListChangedEvent.class).get(0).batches());
    }

    @Test
    void createBatch_keepsNewestFirstOrderWhenCreatedAtTies() {
        service.listBatches("doc-1");

        for (int i = 0; i < 5; i++) {
            service.createBatch("doc-1", "Batch " + i, 1);
        }

        List<SubmissionBatch> listed = service.listBatches("doc-1");
        assertEquals(5, listed.size());
        assertEquals(listed.stream().sorted(SubmissionBatch.NEWEST_FIRST).toList(), listed);
        assertEquals(service.refresh("doc-1"), listed);
    }

    @Test
    void requireBatch_missingBatchIsNotFoundWithOneNotice() {
        service.listBatches("doc-1");

        RecordNotFoundException e = assertThrows(RecordNotFoundException.class,
                () -> service.requireBatch("doc-1", "missing"));

        assertEquals("/assignments/doc-1/batches", e.getRedirectTo());
        List<UserNotice> notices = noticeService.recent(10);
        assertEquals(1, notices.size());
        assertEquals(UserNotice.Level.ERROR, notices.get(0).level());
        assertEquals("Submission batch not found", notices.get(0).message());
    }

    @Test
    void requireBatch_returnsListedBatch() {
        SubmissionBatch batch = service.createBatch("doc-1", "Period 1", 2);

        assertEquals(batch, service.requireBatch("doc-1", batch.getId()));
    }

    @Test
    void commit_discardsSupersededList() {
        long older = service.beginRefresh("doc-1");
        long newer = service.beginRefresh("doc-1");
        SubmissionBatch fresh = SubmissionBatch.builder().id("new").assignmentId("doc-1")
                .displayName("New").status(BatchStatus.GRADING).fileCount(1).build();

        assertTrue(service.commit("doc-1", newer, List.of(fresh)));
        assertFalse(service.commit("doc-1", older, List.of()));

        assertEquals(List.of(fresh), service.listBatches("doc-1"));
    }

    @Test
    void uploadBatch_enforcesAssignmentFileType() {
        List<UploadedFile> files = List.of(
                new UploadedFile("reading.mp3", "audio/mpeg"),
                new UploadedFile("notes.pdf", "application/pdf"));

        RecordValidationException e = assertThrows(RecordValidationException.class,
                () -> service.uploadBatch("voice-1", "Week 1", files));

        assertEquals("files", e.getViolations().get(0).field());
        assertTrue(e.getViolations().get(0).reason().contains("notes.pdf"));
        assertTrue(store.select(RecordQuery.from(RecordMapper.SUBMISSIONS)).block().isEmpty());
        assertEquals(1, noticeService.recent(10).size());
    }

    @Test
    void uploadBatch_createsBatchForAcceptedFiles() {
        SubmissionBatch batch = service.uploadBatch("voice-1", null, List.of(
                new UploadedFile("a.webm", "audio/webm;codecs=opus"),
                new UploadedFile("b.mp3", "audio/mpeg")));

        assertEquals(2, batch.getFileCount());
        assertEquals(BatchStatus.GRADING, batch.getStatus());
    }

    @Test
    void uploadBatch_withNoFilesIsEmptyUpload() {
        assertThrows(EmptyUploadException.class, () -> service.uploadBatch("voice-1", "X", List.of()));
    }

    private static Map<String, Object> assignmentRow(String id, String type) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", id);
        row.put("title", "Assignment " + id);
        row.put("type", type);
        row.put("points", 10);
        row.put("created_at", "2025-01-01T00:00:00.000Z");
        row.put("updated_at", "2025-01-01T00:00:00.000Z");
        return row;
    }

    private static Map<String, Object> submissionRow(String id, String assignmentId, String createdAt, String status) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", id);
        row.put("assignment_id", assignmentId);
        row.put("file_count", 1);
        row.put("status", status);
        row.put("created_at", createdAt);
        return row;
    }
}
