package com.heronix.autograder.model.dto;

/**
 * Metadata of one file in an upload. File contents are not kept.
 */
public record UploadedFile(String fileName, String contentType) {
}
