package com.heronix.autograder.service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import com.heronix.autograder.event.BatchListChangedEvent;
import com.heronix.autograder.exception.AutograderException;
import com.heronix.autograder.exception.EmptyUploadException;
import com.heronix.autograder.exception.RecordNotFoundException;
import com.heronix.autograder.exception.RecordValidationException;
import com.heronix.autograder.mapping.RecordMapper;
import com.heronix.autograder.model.domain.AssignmentRecord;
import com.heronix.autograder.model.domain.SubmissionBatch;
import com.heronix.autograder.model.dto.UploadedFile;
import com.heronix.autograder.model.enums.BatchStatus;
import com.heronix.autograder.store.RecordQuery;
import com.heronix.autograder.store.RecordStore;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Owns the submission batches of each assignment.
 *
 * Batch lifecycle:
 * <pre>
 *   upload -> GRADING -> COMPLETED
 *                     \-> FAILED
 * </pre>
 * A batch is created in GRADING. The move to a terminal status happens in
 * the grading pipeline and is only observed here, by re-reading the list.
 *
 * The committed list of an assignment is an immutable snapshot, newest first,
 * replaced whole on every change. Refreshes are sequenced: a refresh that
 * finishes after a newer one was committed is discarded.
 *
 * @author Heronix Development Team
 * @version 1.0.0
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SubmissionBatchService {

    private final RecordStore recordStore;
    private final RecordMapper recordMapper;
    private final RecordLookupService lookupService;
    private final UploadPolicyService uploadPolicy;
    private final NoticeService noticeService;
    private final ApplicationEventPublisher eventPublisher;

    private final Map<String, SequencedState<List<SubmissionBatch>>> committed = new ConcurrentHashMap<>();

    // ========================================================================
    // BATCH CREATION
    // ========================================================================

    /**
     * Create a batch of {@code fileCount} files in status GRADING.
     *
     * @param displayName batch name; blank means the store-derived default "Batch {id}"
     * @throws EmptyUploadException if {@code fileCount} is zero
     */
    public SubmissionBatch createBatch(String assignmentId, String displayName, int fileCount) {
        if (fileCount < 0) {
            throw new IllegalArgumentException("fileCount must not be negative: " + fileCount);
        }

        try {
            if (fileCount == 0) {
                throw new EmptyUploadException(assignmentId);
            }
            SubmissionBatch batch = insertBatch(assignmentId, displayName, fileCount);
            noticeService.success("Files uploaded successfully");
            return batch;
        } catch (AutograderException e) {
            reportUploadFailure(assignmentId, e);
            throw e;
        }
    }

    /**
     * Check an upload against the assignment's accepted file types and create
     * a batch for it. File contents are not stored.
     */
    public SubmissionBatch uploadBatch(String assignmentId, String batchName, List<UploadedFile> files) {
        try {
            if (files == null || files.isEmpty()) {
                throw new EmptyUploadException(assignmentId);
            }

            AssignmentRecord assignment = lookupService
                    .fetchAssignment(assignmentId, RecordLookupService.CLASS_LIST_VIEW)
                    .block();
            uploadPolicy.checkUpload(assignment.getType(), files);

            SubmissionBatch batch = insertBatch(assignmentId, batchName, files.size());
            noticeService.success("Files uploaded successfully");
            return batch;
        } catch (AutograderException e) {
            reportUploadFailure(assignmentId, e);
            throw e;
        }
    }

    // ========================================================================
    // READS
    // ========================================================================

    /**
     * Committed batches of an assignment, newest first. Loads them on first use.
     */
    public List<SubmissionBatch> listBatches(String assignmentId) {
        return state(assignmentId).current()
                .orElseGet(() -> refresh(assignmentId));
    }

    /**
     * Committed state of a single batch.
     */
    public Optional<SubmissionBatch> getBatch(String assignmentId, String batchId) {
        return listBatches(assignmentId).stream()
                .filter(batch -> batch.getId().equals(batchId))
                .findFirst();
    }

    /**
     * Committed state of a single batch, or a not-found failure with its notice.
     *
     * @throws RecordNotFoundException if the assignment has no such batch
     */
    public SubmissionBatch requireBatch(String assignmentId, String batchId) {
        return getBatch(assignmentId, batchId).orElseThrow(() -> {
            RecordNotFoundException e = new RecordNotFoundException("Submission batch", RecordMapper.SUBMISSIONS,
                    batchId, "/assignments/" + assignmentId + "/batches");
            log.warn("SUBMISSION_BATCH: batch not found id={} assignment={}", batchId, assignmentId);
            noticeService.error(e.getMessage());
            return e;
        });
    }

    /**
     * Re-read every batch of the assignment and replace the committed list.
     *
     * @return the list committed after this refresh; a newer list if this
     *         refresh was superseded
     */
    public List<SubmissionBatch> refresh(String assignmentId) {
        long sequence = beginRefresh(assignmentId);
        try {
            List<SubmissionBatch> batches = fetchBatches(assignmentId).block();
            commit(assignmentId, sequence, batches);
            return state(assignmentId).current().orElse(batches);
        } catch (AutograderException e) {
            log.error("SUBMISSION_BATCH: refresh failed assignment={}: {}", assignmentId, e.getMessage());
            noticeService.error("Failed to load submissions: " + e.getMessage());
            throw e;
        }
    }

    /**
     * Read the batches of an assignment from the store, newest first. Lazy, no notices.
     */
    public Mono<List<SubmissionBatch>> fetchBatches(String assignmentId) {
        RecordQuery query = RecordQuery.from(RecordMapper.SUBMISSIONS)
                .where("assignment_id", assignmentId)
                .orderBy("created_at", false);

        return recordStore.select(query)
                .map(rows -> rows.stream()
                        .map(row -> recordMapper.toSubmissionBatch(
                                recordMapper.toCanonical(RecordMapper.SUBMISSIONS, row)))
                        .sorted(SubmissionBatch.NEWEST_FIRST)
                        .toList());
    }

    // ========================================================================
    // COMMITS
    // ========================================================================

    /**
     * Reserve the sequence number for a refresh of the assignment's list.
     */
    public long beginRefresh(String assignmentId) {
        return state(assignmentId).nextSequence();
    }

    /**
     * Replace the committed list with {@code batches} fetched under {@code sequence}.
     *
     * @return false if a newer list was committed in the meantime
     */
    public boolean commit(String assignmentId, long sequence, List<SubmissionBatch> batches) {
        SequencedState<List<SubmissionBatch>> state = state(assignmentId);
        List<SubmissionBatch> next = batches.stream()
                .sorted(SubmissionBatch.NEWEST_FIRST)
                .toList();

        List<SubmissionBatch> previous;
        synchronized (state) {
            previous = state.current().orElse(List.of());
            if (!state.commit(sequence, next)) {
                log.debug("SUBMISSION_BATCH: discarded superseded list assignment={} sequence={}",
                        assignmentId, sequence);
                return false;
            }
        }

        logStatusChanges(assignmentId, previous, next);
        eventPublisher.publishEvent(new BatchListChangedEvent(assignmentId, next));
        return true;
    }

    // ========================================================================
    // HELPER METHODS
    // ========================================================================

    private SubmissionBatch insertBatch(String assignmentId, String displayName, int fileCount) {
        Map<String, Object> canonical = new LinkedHashMap<>();
        canonical.put("assignmentId", assignmentId);
        canonical.put("batchName", displayName != null && !displayName.isBlank() ? displayName.trim() : null);
        canonical.put("fileCount", fileCount);
        canonical.put("status", BatchStatus.GRADING.getLabel());

        Map<String, Object> row = recordStore
                .insert(RecordMapper.SUBMISSIONS, recordMapper.toPersisted(RecordMapper.SUBMISSIONS, canonical))
                .block();
        SubmissionBatch batch = recordMapper.toSubmissionBatch(
                recordMapper.toCanonical(RecordMapper.SUBMISSIONS, row));

        log.info("SUBMISSION_BATCH: created batch id={} assignment={} files={} status={}",
                batch.getId(), assignmentId, batch.getFileCount(), batch.getStatus().getLabel());

        prepend(assignmentId, batch);
        return batch;
    }

    private void prepend(String assignmentId, SubmissionBatch batch) {
        SequencedState<List<SubmissionBatch>> state = state(assignmentId);
        List<SubmissionBatch> next;
        synchronized (state) {
            Optional<List<SubmissionBatch>> current = state.current();
            if (current.isEmpty()) {
                // Never listed yet; the first listing reads it from the store
                return;
            }
            List<SubmissionBatch> list = new ArrayList<>(current.get().size() + 1);
            list.add(batch);
            list.addAll(current.get());
            list.sort(SubmissionBatch.NEWEST_FIRST);
            next = List.copyOf(list);
            state.commit(state.nextSequence(), next);
        }
        eventPublisher.publishEvent(new BatchListChangedEvent(assignmentId, next));
    }

    private void logStatusChanges(String assignmentId, List<SubmissionBatch> previous, List<SubmissionBatch> next) {
        Map<String, SubmissionBatch> before = previous.stream()
                .collect(Collectors.toMap(SubmissionBatch::getId, Function.identity(), (a, b) -> a));

        for (SubmissionBatch batch : next) {
            SubmissionBatch old = before.get(batch.getId());
            if (old == null || old.getStatus() == batch.getStatus()) {
                continue;
            }
            if (old.getStatus().canTransitionTo(batch.getStatus())) {
                log.info("SUBMISSION_BATCH: batch id={} assignment={} transitioned {} -> {}",
                        batch.getId(), assignmentId, old.getStatus().getLabel(), batch.getStatus().getLabel());
            } else {
                // Store is authoritative: the observed status replaces ours as a fresh state
                log.warn("SUBMISSION_BATCH: batch id={} assignment={} observed {} -> {}, taking store state as fresh",
                        batch.getId(), assignmentId, old.getStatus().getLabel(), batch.getStatus().getLabel());
            }
        }
    }

    private void reportUploadFailure(String assignmentId, AutograderException e) {
        if (e instanceof EmptyUploadException || e instanceof RecordValidationException
                || e instanceof RecordNotFoundException) {
            log.warn("SUBMISSION_BATCH: upload rejected assignment={}: {}", assignmentId, e.getMessage());
            noticeService.error(e.getMessage());
        } else {
            log.error("SUBMISSION_BATCH: upload failed assignment={}: {}", assignmentId, e.getMessage(), e);
            noticeService.error("Failed to upload files: " + e.getMessage());
        }
    }

    private SequencedState<List<SubmissionBatch>> state(String assignmentId) {
        return committed.computeIfAbsent(assignmentId, key -> new SequencedState<>());
    }
}
