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
import com.heronix.autograder.event.AssignmentViewChangedEvent;
import com.heronix.autograder.event.RecordUpdatedEvent;
import com.heronix.autograder.exception.PersistenceException;
import com.heronix.autograder.mapping.RecordMapper;
import com.heronix.autograder.model.domain.AssignmentView;
import com.heronix.autograder.model.enums.RecordKind;
import com.heronix.autograder.store.RecordQuery;
import com.heronix.autograder.store.RecordStore;

import reactor.core.publisher.Mono;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AssignmentViewServiceTest {

    private RecordStore store;
    private RecordingPublisher publisher;
    private NoticeService noticeService;
    private AssignmentViewService service;

    @BeforeEach
    void setUp() {
        Clock clock = AutograderTestSupport.fixedClock();
        AutograderProperties properties = AutograderTestSupport.properties();
        store = mock(RecordStore.class);
        publisher = new RecordingPublisher();
        noticeService = new NoticeService(publisher, clock, properties);
        RecordMapper mapper = new RecordMapper(AutograderTestSupport.objectMapper(), clock, properties);
        RecordLookupService lookupService = new RecordLookupService(store, mapper, noticeService);
        UploadPolicyService uploadPolicy = new UploadPolicyService();
        SubmissionBatchService batchService = new SubmissionBatchService(store, mapper, lookupService,
                uploadPolicy, noticeService, publisher);
        service = new AssignmentViewService(lookupService, batchService, uploadPolicy, mapper,
                noticeService, publisher, clock);
    }

    @Test
    void refresh_composesAssignmentAndBatches() {
        when(store.findById(RecordMapper.ASSIGNMENTS, "a1")).thenReturn(Mono.just(assignmentRow("Essay")));
        when(store.select(any(RecordQuery.class))).thenReturn(Mono.just(List.of(submissionRow("s1"))));

        ViewRefreshResult result = service.refresh("c1", "a1");

        assertEquals(ViewRefreshResult.Status.COMMITTED, result.status());
        AssignmentView view = result.view();
        assertEquals("c1", view.getClassId());
        assertEquals("Essay", view.getAssignment().getTitle());
        assertEquals(1, view.getBatchCount());
        assertEquals(List.of("application/pdf"), view.getAcceptedFileTypes());
        assertEquals("PDF", view.getFileRequirement());
        assertEquals(1, publisher.events(AssignmentViewChangedEvent.class).size());
    }

    @Test
    void failedBatchFetch_keepsPreviousView() {
        when(store.findById(RecordMapper.ASSIGNMENTS, "a1"))
                .thenReturn(Mono.just(assignmentRow("Essay")))
                .thenReturn(Mono.just(assignmentRow("Essay (renamed)")));
        when(store.select(any(RecordQuery.class)))
                .thenReturn(Mono.just(List.of(submissionRow("s1"))))
                .thenReturn(Mono.error(new PersistenceException(RecordMapper.SUBMISSIONS, "connection reset")));

        AssignmentView previous = service.refresh("c1", "a1").view();
        ViewRefreshResult result = service.refresh("c1", "a1");

        assertEquals(ViewRefreshResult.Status.FAILED, result.status());
        assertInstanceOf(PersistenceException.class, result.error());
        assertSame(previous, result.view());
        assertSame(previous, service.currentView("a1").orElseThrow());
        assertEquals("Essay", service.getView("c1", "a1").getAssignment().getTitle());
        assertEquals(1, noticeService.recent(10).size());
    }

    @Test
    void missingAssignment_redirectsToClass() {
        when(store.findById(RecordMapper.ASSIGNMENTS, "gone")).thenReturn(Mono.empty());
        when(store.select(any(RecordQuery.class))).thenReturn(Mono.just(List.of()));

        ViewRefreshResult result = service.refresh("c1", "gone");

        assertFalse(result.isSuccess());
        assertEquals("/classes/c1", result.redirectTo());
        assertEquals("Assignment not found", result.message());
        assertNull(result.view());
    }

    @Test
    void recordUpdate_isAppliedToCommittedView() {
        when(store.findById(RecordMapper.ASSIGNMENTS, "a1")).thenReturn(Mono.just(assignmentRow("Essay")));
        when(store.select(any(RecordQuery.class))).thenReturn(Mono.just(List.of(submissionRow("s1"))));
        AssignmentView before = service.getView("c1", "a1");

        Map<String, Object> canonical = new LinkedHashMap<>();
        canonical.put("id", "a1");
        canonical.put("title", "Voice drill");
        canonical.put("type", "voice");
        canonical.put("points", 10);
        canonical.put("createdAt", "2025-01-01T00:00:00.000Z");
        canonical.put("updatedAt", "2025-03-01T10:00:00.000Z");
        service.onRecordUpdated(new RecordUpdatedEvent(RecordKind.ASSIGNMENT, "a1", canonical));

        AssignmentView after = service.currentView("a1").orElseThrow();
        assertEquals("Voice drill", after.getAssignment().getTitle());
        assertEquals("Audio", after.getFileRequirement());
        assertEquals(before.getBatches(), after.getBatches());
        assertTrue(after.getSequence() > before.getSequence());
    }

    @Test
    void classUpdate_doesNotTouchAssignmentViews() {
        when(store.findById(RecordMapper.ASSIGNMENTS, "a1")).thenReturn(Mono.just(assignmentRow("Essay")));
        when(store.select(any(RecordQuery.class))).thenReturn(Mono.just(List.of()));
        AssignmentView before = service.getView("c1", "a1");

        service.onRecordUpdated(new RecordUpdatedEvent(RecordKind.CLASS, "a1", Map.of("id", "a1")));

        assertSame(before, service.currentView("a1").orElseThrow());
    }

    private static Map<String, Object> assignmentRow(String title) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", "a1");
        row.put("class_id", "c1");
        row.put("title", title);
        row.put("type", "document");
        row.put("points", 10);
        row.put("created_at", "2025-01-01T00:00:00.000Z");
        row.put("updated_at", "2025-01-01T00:00:00.000Z");
        return row;
    }

    private static Map<String, Object> submissionRow(String id) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", id);
        row.put("assignment_id", "a1");
        row.put("batch_name", "Period 1");
        row.put("file_count", 4);
        row.put("status", "grading");
        row.put("created_at", "2025-02-01T10:00:00.000Z");
        return row;
    }
}
