package com.heronix.autograder.model.enums;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import lombok.RequiredArgsConstructor;

/**
 * Assignment types. The type decides which files a submission batch may contain:
 * voice assignments take audio recordings, everything else takes PDF documents.
 */
@RequiredArgsConstructor
public enum AssignmentType implements LabeledEnum {

    /**
     * Spoken response, graded from audio recordings
     */
    VOICE("voice", List.of("audio/*"), "Audio"),

    /**
     * Written free-text response
     */
    TEXT("text", List.of("application/pdf"), "PDF"),

    /**
     * Worksheet or other document
     */
    DOCUMENT("document", List.of("application/pdf"), "PDF");

    private final String label;

    /**
     * MIME types (or type/* wildcards) accepted for uploads
     */
    private final List<String> acceptedFileTypes;

    /**
     * Human-readable file requirement shown next to the upload form
     */
    private final String fileRequirement;

    @Override
    @JsonValue
    public String getLabel() {
        return label;
    }

    public List<String> getAcceptedFileTypes() {
        return acceptedFileTypes;
    }

    public String getFileRequirement() {
        return fileRequirement;
    }

    @JsonCreator
    public static AssignmentType fromLabel(String label) {
        return LabeledEnum.fromLabel(AssignmentType.class, label)
                .orElseThrow(() -> new IllegalArgumentException("Unknown assignment type: " + label));
    }
}
