package com.heronix.autograder.service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import com.heronix.autograder.event.AssignmentViewChangedEvent;
import com.heronix.autograder.event.BatchListChangedEvent;
import com.heronix.autograder.event.RecordUpdatedEvent;
import com.heronix.autograder.exception.AutograderException;
import com.heronix.autograder.exception.RecordNotFoundException;
import com.heronix.autograder.mapping.RecordMapper;
import com.heronix.autograder.model.domain.AssignmentRecord;
import com.heronix.autograder.model.domain.AssignmentView;
import com.heronix.autograder.model.domain.SubmissionBatch;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.util.function.Tuple2;

/**
 * Composes an assignment with its submission batches.
 *
 * A refresh fetches both concurrently and commits only when both fetches
 * succeed; otherwise the previous view stays in place and the failure is
 * returned. Committed views are also kept current from record updates and
 * batch list changes, and every new view is published as an
 * {@link AssignmentViewChangedEvent}.
 *
 * @author Heronix Development Team
 * @version 1.0.0
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AssignmentViewService {

    private final RecordLookupService lookupService;
    private final SubmissionBatchService batchService;
    private final UploadPolicyService uploadPolicy;
    private final RecordMapper recordMapper;
    private final NoticeService noticeService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    private final Map<String, SequencedState<AssignmentView>> views = new ConcurrentHashMap<>();

    /**
     * The committed view, loading it on first use.
     *
     * @throws AutograderException if the first load fails
     */
    public AssignmentView getView(String classId, String assignmentId) {
        Optional<AssignmentView> current = state(assignmentId).current();
        if (current.isPresent()) {
            return current.get();
        }

        ViewRefreshResult result = refresh(classId, assignmentId);
        if (!result.isSuccess()) {
            throw result.error();
        }
        return result.view();
    }

    public Optional<AssignmentView> currentView(String assignmentId) {
        return state(assignmentId).current();
    }

    /**
     * Re-read the assignment and its batches and commit them as one view.
     */
    public ViewRefreshResult refresh(String classId, String assignmentId) {
        SequencedState<AssignmentView> state = state(assignmentId);
        long sequence = state.nextSequence();
        long batchSequence = batchService.beginRefresh(assignmentId);

        Tuple2<AssignmentRecord, List<SubmissionBatch>> fetched;
        try {
            fetched = Mono.zip(
                    lookupService.fetchAssignment(assignmentId, "/classes/" + classId),
                    batchService.fetchBatches(assignmentId))
                    .block();
        } catch (RecordNotFoundException e) {
            log.warn("ASSIGNMENT_VIEW: assignment not found id={}, redirecting to {}", assignmentId, e.getRedirectTo());
            noticeService.error(e.getMessage());
            return ViewRefreshResult.failed(e, state.current().orElse(null));
        } catch (AutograderException e) {
            log.error("ASSIGNMENT_VIEW: refresh failed assignment={}, keeping previous view: {}",
                    assignmentId, e.getMessage());
            noticeService.error("Failed to load assignment data: " + e.getMessage());
            return ViewRefreshResult.failed(e, state.current().orElse(null));
        }

        AssignmentView view = compose(classId, fetched.getT1(), fetched.getT2(), sequence);
        boolean committed;
        synchronized (state) {
            committed = state.commit(sequence, view);
        }
        batchService.commit(assignmentId, batchSequence, fetched.getT2());

        if (!committed) {
            log.debug("ASSIGNMENT_VIEW: discarded superseded refresh assignment={} sequence={}", assignmentId, sequence);
            return ViewRefreshResult.superseded(state.current().orElse(view));
        }

        log.info("ASSIGNMENT_VIEW: refreshed assignment={} batches={}", assignmentId, view.getBatchCount());
        eventPublisher.publishEvent(new AssignmentViewChangedEvent(assignmentId, view));
        return ViewRefreshResult.committed(view);
    }

    // ========================================================================
    // EVENT LISTENERS
    // ========================================================================

    @EventListener
    public void onRecordUpdated(RecordUpdatedEvent event) {
        if (!RecordMapper.ASSIGNMENTS.equals(event.kind().getTable())) {
            return;
        }
        SequencedState<AssignmentView> state = views.get(event.recordId());
        if (state == null) {
            return;
        }

        AssignmentRecord assignment = recordMapper.toAssignmentRecord(event.canonical());
        AssignmentView view;
        synchronized (state) {
            Optional<AssignmentView> current = state.current();
            if (current.isEmpty()) {
                return;
            }
            long sequence = state.nextSequence();
            view = compose(current.get().getClassId(), assignment, current.get().getBatches(), sequence);
            state.commit(sequence, view);
        }

        log.debug("ASSIGNMENT_VIEW: applied {} update to assignment={}", event.kind(), event.recordId());
        eventPublisher.publishEvent(new AssignmentViewChangedEvent(event.recordId(), view));
    }

    @EventListener
    public void onBatchListChanged(BatchListChangedEvent event) {
        SequencedState<AssignmentView> state = views.get(event.assignmentId());
        if (state == null) {
            return;
        }

        AssignmentView view;
        synchronized (state) {
            Optional<AssignmentView> current = state.current();
            if (current.isEmpty() || current.get().getBatches().equals(event.batches())) {
                return;
            }
            long sequence = state.nextSequence();
            view = compose(current.get().getClassId(), current.get().getAssignment(), event.batches(), sequence);
            state.commit(sequence, view);
        }

        log.debug("ASSIGNMENT_VIEW: applied batch list change to assignment={} batches={}",
                event.assignmentId(), view.getBatchCount());
        eventPublisher.publishEvent(new AssignmentViewChangedEvent(event.assignmentId(), view));
    }

    // ========================================================================
    // HELPER METHODS
    // ========================================================================

    private AssignmentView compose(String classId, AssignmentRecord assignment,
                                   List<SubmissionBatch> batches, long sequence) {
        return AssignmentView.builder()
                .classId(classId)
                .assignment(assignment)
                .batches(List.copyOf(batches))
                .acceptedFileTypes(uploadPolicy.acceptedFileTypes(assignment.getType()))
                .fileRequirement(uploadPolicy.fileRequirement(assignment.getType()))
                .sequence(sequence)
                .committedAt(OffsetDateTime.now(clock))
                .build();
    }

    private SequencedState<AssignmentView> state(String assignmentId) {
        return views.computeIfAbsent(assignmentId, key -> new SequencedState<>());
    }
}
