package com.heronix.autograder.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.springframework.stereotype.Service;

import com.heronix.autograder.exception.RecordValidationException;
import com.heronix.autograder.model.dto.FieldViolation;
import com.heronix.autograder.model.dto.UploadedFile;
import com.heronix.autograder.model.enums.AssignmentType;

import lombok.extern.slf4j.Slf4j;

/**
 * Decides which files an assignment accepts.
 *
 * voice -> audio/* ; any other type -> application/pdf
 *
 * Content types are compared without parameters and case-insensitively, so
 * "audio/webm;codecs=opus" is an audio file. An assignment without a stored
 * type is treated as a document assignment.
 *
 * @author Heronix Development Team
 * @version 1.0.0
 */
@Service
@Slf4j
public class UploadPolicyService {

    static final String FILES_FIELD = "files";

    public List<String> acceptedFileTypes(AssignmentType type) {
        return effective(type).getAcceptedFileTypes();
    }

    public String fileRequirement(AssignmentType type) {
        return effective(type).getFileRequirement();
    }

    public boolean accepts(AssignmentType type, String contentType) {
        String mimeType = baseType(contentType);
        if (mimeType.isEmpty()) {
            return false;
        }

        for (String accepted : acceptedFileTypes(type)) {
            if (accepted.endsWith("/*")) {
                if (mimeType.startsWith(accepted.substring(0, accepted.length() - 1))) {
                    return true;
                }
            } else if (mimeType.equals(accepted)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Reject an upload containing any file the assignment does not accept.
     * An empty upload is not checked here; batch creation rejects it.
     *
     * @throws RecordValidationException on field "files"
     */
    public void checkUpload(AssignmentType type, List<UploadedFile> files) {
        List<String> rejected = new ArrayList<>();
        for (UploadedFile file : files) {
            if (!accepts(type, file.contentType())) {
                rejected.add(file.fileName());
            }
        }

        if (!rejected.isEmpty()) {
            log.warn("UPLOAD_POLICY: rejected files type={} files={}", effective(type).getLabel(), rejected);
            throw new RecordValidationException(FILES_FIELD,
                    "Only " + fileRequirement(type) + " files are accepted: " + String.join(", ", rejected));
        }
    }

    // ========================================================================
    // HELPER METHODS
    // ========================================================================

    private static AssignmentType effective(AssignmentType type) {
        return type != null ? type : AssignmentType.DOCUMENT;
    }

    private static String baseType(String contentType) {
        if (contentType == null) {
            return "";
        }
        int separator = contentType.indexOf(';');
        String base = separator >= 0 ? contentType.substring(0, separator) : contentType;
        return base.trim().toLowerCase(Locale.ROOT);
    }
}
