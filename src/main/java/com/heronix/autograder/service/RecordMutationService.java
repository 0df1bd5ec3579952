package com.heronix.autograder.service;

import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import com.heronix.autograder.event.RecordUpdatedEvent;
import com.heronix.autograder.exception.PersistenceException;
import com.heronix.autograder.exception.RecordNotFoundException;
import com.heronix.autograder.exception.RecordValidationException;
import com.heronix.autograder.mapping.RecordMapper;
import com.heronix.autograder.model.domain.AssignmentRecord;
import com.heronix.autograder.model.domain.ClassRecord;
import com.heronix.autograder.model.dto.RecordPatch;
import com.heronix.autograder.model.enums.RecordKind;
import com.heronix.autograder.store.RecordStore;
import com.heronix.autograder.store.Timestamps;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Applies validated partial updates to class and assignment records.
 *
 * Pipeline per call:
 * <pre>
 * validate -> normalize -> toPersisted (+ updated_at) -> store update by id
 *          -> read back row -> toCanonical -> typed record
 * </pre>
 * The store update is a single partial write, so either the whole patch lands
 * or nothing changes. Concurrent edits are last-write-wins.
 *
 * Every call produces exactly one user notice.
 *
 * @author Heronix Development Team
 * @version 1.0.0
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecordMutationService {

    private final RecordValidationService validationService;
    private final RecordStore recordStore;
    private final RecordMapper recordMapper;
    private final NoticeService noticeService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * Apply {@code payload} (canonical keys) to the record {@code id}.
     *
     * @return the refreshed record in canonical form, or the failure. The
     *         refreshed row is checked to be readable as its typed record.
     */
    public MutationResult<Map<String, Object>> updateRecord(RecordKind kind, String id, Map<String, Object> payload) {
        return apply(kind, id, payload, canonical -> {
            readTyped(kind, canonical);
            return canonical;
        });
    }

    public MutationResult<ClassRecord> updateClass(String classId, Map<String, Object> payload) {
        return apply(RecordKind.CLASS, classId, payload, recordMapper::toClassRecord);
    }

    public MutationResult<AssignmentRecord> updateAssignment(String assignmentId, Map<String, Object> payload) {
        return apply(RecordKind.ASSIGNMENT, assignmentId, payload, recordMapper::toAssignmentRecord);
    }

    public MutationResult<AssignmentRecord> updateGradingCriteria(String assignmentId, String gradingCriteria) {
        return apply(RecordKind.GRADING_CRITERIA, assignmentId,
                Collections.singletonMap("gradingCriteria", gradingCriteria),
                recordMapper::toAssignmentRecord);
    }

    // ========================================================================
    // HELPER METHODS
    // ========================================================================

    private Object readTyped(RecordKind kind, Map<String, Object> canonical) {
        return kind == RecordKind.CLASS
                ? recordMapper.toClassRecord(canonical)
                : recordMapper.toAssignmentRecord(canonical);
    }

    private <T> MutationResult<T> apply(RecordKind kind, String id, Map<String, Object> payload,
                                        Function<Map<String, Object>, T> reader) {
        try {
            RecordPatch patch = validationService.validate(kind, payload);

            Map<String, Object> canonical = new LinkedHashMap<>(patch.toCanonicalMap());
            canonical.put("updatedAt", Timestamps.now(clock));
            Map<String, Object> row = recordMapper.toPersisted(kind.getTable(), canonical);

            Map<String, Object> stored = recordStore.update(kind.getTable(), id, row).block();
            if (stored == null) {
                throw new RecordNotFoundException(kind.getEntityName(), kind.getTable(), id,
                        RecordLookupService.CLASS_LIST_VIEW);
            }

            Map<String, Object> refreshed = recordMapper.toCanonical(kind.getTable(), stored);
            T record = reader.apply(refreshed);

            eventPublisher.publishEvent(new RecordUpdatedEvent(kind, id, refreshed));
            noticeService.success(kind.getSuccessNotice());
            log.info("RECORD_MUTATION: updated kind={} id={} fields={}", kind, id, patch.toCanonicalMap().keySet());
            return MutationResult.success(record);

        } catch (RecordValidationException e) {
            log.warn("RECORD_MUTATION: validation failed kind={} id={} violations={}", kind, id, e.getViolations().size());
            noticeService.error(e.getMessage());
            return MutationResult.failure(e);

        } catch (RecordNotFoundException e) {
            log.warn("RECORD_MUTATION: record not found kind={} id={}", kind, id);
            noticeService.error(e.getMessage());
            return MutationResult.failure(e);

        } catch (PersistenceException e) {
            log.error("RECORD_MUTATION: store update failed kind={} id={}: {}", kind, id, e.getMessage(), e);
            noticeService.error("Failed to update " + kind.getEntityName().toLowerCase(Locale.ROOT) + ": " + e.getMessage());
            return MutationResult.failure(e);
        }
    }
}
