package com.heronix.autograder.mapping;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.heronix.autograder.config.AutograderProperties;
import com.heronix.autograder.exception.PersistenceException;
import com.heronix.autograder.model.domain.AssignmentRecord;
import com.heronix.autograder.model.domain.ClassRecord;
import com.heronix.autograder.model.domain.SubmissionBatch;
import com.heronix.autograder.model.enums.BatchStatus;

import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Converts rows crossing the record store boundary.
 *
 * INBOUND (store -> service): snake_case row -> canonical map -> typed record
 * OUTBOUND (service -> store): canonical map -> snake_case row
 *
 * Enumerated values are parsed into their enums here, once; a row carrying an
 * unknown label is unreadable and surfaces as a {@link PersistenceException}.
 */
@Component
@Slf4j
public class RecordMapper {

    public static final String CLASSES = "classes";
    public static final String ASSIGNMENTS = "assignments";
    public static final String SUBMISSIONS = "submissions";

    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String defaultBatchNamePrefix;

    public RecordMapper(ObjectMapper objectMapper, Clock clock, AutograderProperties properties) {
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.defaultBatchNamePrefix = properties.getBatches().getDefaultNamePrefix();
    }

    // ========================================================================
    // NAMING
    // ========================================================================

    /**
     * Rename a store row to canonical form, logging any key that could not be renamed.
     */
    public Map<String, Object> toCanonical(String table, Map<String, Object> row) {
        NamingTransform.Conversion conversion = NamingTransform.toCanonical(row);
        if (!conversion.isClean()) {
            log.warn("RECORD_MAPPER: malformed keys passed through direction=inbound table={} keys={}",
                    table, conversion.malformedKeys());
        }
        return conversion.record();
    }

    /**
     * Rename a canonical map to store form, logging any key that could not be renamed.
     */
    public Map<String, Object> toPersisted(String table, Map<String, Object> canonical) {
        NamingTransform.Conversion conversion = NamingTransform.toPersisted(canonical);
        if (!conversion.isClean()) {
            log.warn("RECORD_MAPPER: malformed keys passed through direction=outbound table={} keys={}",
                    table, conversion.malformedKeys());
        }
        return conversion.record();
    }

    // ========================================================================
    // TYPED RECORDS
    // ========================================================================

    public ClassRecord toClassRecord(Map<String, Object> canonical) {
        return read(CLASSES, canonical, ClassRecord.class);
    }

    /**
     * Missing timestamps are tolerated: the record is loaded with the read time
     * in their place and the gap is logged.
     */
    public AssignmentRecord toAssignmentRecord(Map<String, Object> canonical) {
        AssignmentRecord assignment = read(ASSIGNMENTS, canonical, AssignmentRecord.class);

        if (assignment.getCreatedAt() == null || assignment.getUpdatedAt() == null) {
            log.warn("RECORD_MAPPER: assignment id={} missing timestamps createdAt={} updatedAt={}, defaulting to now",
                    assignment.getId(), assignment.getCreatedAt(), assignment.getUpdatedAt());
            OffsetDateTime now = OffsetDateTime.now(clock);
            assignment = assignment.toBuilder()
                    .createdAt(assignment.getCreatedAt() != null ? assignment.getCreatedAt() : now)
                    .updatedAt(assignment.getUpdatedAt() != null ? assignment.getUpdatedAt() : now)
                    .build();
        }
        return assignment;
    }

    public SubmissionBatch toSubmissionBatch(Map<String, Object> canonical) {
        BatchRow row = read(SUBMISSIONS, canonical, BatchRow.class);

        if (row.getStatus() == null) {
            throw new PersistenceException(SUBMISSIONS, "Submission " + row.getId() + " has no status");
        }

        String name = row.getBatchName() != null && !row.getBatchName().isBlank()
                ? row.getBatchName()
                : defaultBatchNamePrefix + row.getId();

        return SubmissionBatch.builder()
                .id(row.getId())
                .assignmentId(row.getAssignmentId())
                .displayName(name)
                .createdAt(row.getCreatedAt())
                .status(row.getStatus())
                .fileCount(row.getFileCount() != null ? row.getFileCount() : 0)
                .build();
    }

    private <T> T read(String table, Map<String, Object> canonical, Class<T> type) {
        try {
            return objectMapper.convertValue(canonical, type);
        } catch (IllegalArgumentException e) {
            log.error("RECORD_MAPPER: unreadable row table={} id={}: {}", table, canonical.get("id"), e.getMessage());
            throw new PersistenceException(table,
                    "Unreadable " + table + " row " + canonical.get("id") + ": " + e.getMessage(), e);
        }
    }

    /**
     * Shape of a submissions row in canonical form.
     */
    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class BatchRow {
        private String id;
        private String assignmentId;
        private String batchName;
        private Integer fileCount;
        private BatchStatus status;
        private OffsetDateTime createdAt;
    }
}
