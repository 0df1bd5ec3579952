package com.heronix.autograder.service;

import org.springframework.stereotype.Service;

import com.heronix.autograder.exception.AutograderException;
import com.heronix.autograder.exception.RecordNotFoundException;
import com.heronix.autograder.mapping.RecordMapper;
import com.heronix.autograder.model.domain.AssignmentRecord;
import com.heronix.autograder.model.domain.ClassRecord;
import com.heronix.autograder.store.RecordStore;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Reads single class and assignment records.
 *
 * The {@code fetch*} methods are lazy and emit no notices; they are the
 * building blocks of composed refreshes. The {@code get*} methods block and
 * emit one error notice when the read fails.
 *
 * @author Heronix Development Team
 * @version 1.0.0
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecordLookupService {

    static final String CLASS_LIST_VIEW = "/classes";

    private final RecordStore recordStore;
    private final RecordMapper recordMapper;
    private final NoticeService noticeService;

    public Mono<ClassRecord> fetchClass(String classId) {
        return recordStore.findById(RecordMapper.CLASSES, classId)
                .map(row -> recordMapper.toClassRecord(recordMapper.toCanonical(RecordMapper.CLASSES, row)))
                .switchIfEmpty(Mono.error(() -> new RecordNotFoundException(
                        "Class", RecordMapper.CLASSES, classId, CLASS_LIST_VIEW)));
    }

    /**
     * @param parentView where the caller should go if the assignment is gone
     */
    public Mono<AssignmentRecord> fetchAssignment(String assignmentId, String parentView) {
        return recordStore.findById(RecordMapper.ASSIGNMENTS, assignmentId)
                .map(row -> recordMapper.toAssignmentRecord(recordMapper.toCanonical(RecordMapper.ASSIGNMENTS, row)))
                .switchIfEmpty(Mono.error(() -> new RecordNotFoundException(
                        "Assignment", RecordMapper.ASSIGNMENTS, assignmentId, parentView)));
    }

    public ClassRecord getClassRecord(String classId) {
        return await(fetchClass(classId), "class", classId);
    }

    public AssignmentRecord getAssignment(String assignmentId) {
        return await(fetchAssignment(assignmentId, CLASS_LIST_VIEW), "assignment", assignmentId);
    }

    private <T> T await(Mono<T> fetch, String entity, String id) {
        try {
            return fetch.block();
        } catch (RecordNotFoundException e) {
            log.warn("RECORD_LOOKUP: {} not found id={}", entity, id);
            noticeService.error(e.getMessage());
            throw e;
        } catch (AutograderException e) {
            log.error("RECORD_LOOKUP: failed to load {} id={}: {}", entity, id, e.getMessage());
            noticeService.error("Failed to load " + entity + " data");
            throw e;
        }
    }
}
