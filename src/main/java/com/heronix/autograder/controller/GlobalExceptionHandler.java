package com.heronix.autograder.controller;

import java.time.Clock;
import java.time.OffsetDateTime;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import com.heronix.autograder.exception.AutograderException;
import com.heronix.autograder.exception.EmptyUploadException;
import com.heronix.autograder.exception.PersistenceException;
import com.heronix.autograder.exception.RecordNotFoundException;
import com.heronix.autograder.exception.RecordValidationException;
import com.heronix.autograder.model.dto.ApiErrorResponse;
import com.heronix.autograder.service.NoticeService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Translates service failures into API error bodies.
 *
 * The services have already logged their failures and emitted the user
 * notice; only failures that never reached a service get a notice here.
 */
@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    private final NoticeService noticeService;
    private final Clock clock;

    @ExceptionHandler(RecordValidationException.class)
    public ResponseEntity<ApiErrorResponse> handleValidation(RecordValidationException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(body(e).violations(e.getViolations()).build());
    }

    @ExceptionHandler(EmptyUploadException.class)
    public ResponseEntity<ApiErrorResponse> handleEmptyUpload(EmptyUploadException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body(e).build());
    }

    @ExceptionHandler(RecordNotFoundException.class)
    public ResponseEntity<ApiErrorResponse> handleNotFound(RecordNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(body(e).redirectTo(e.getRedirectTo()).build());
    }

    @ExceptionHandler(PersistenceException.class)
    public ResponseEntity<ApiErrorResponse> handlePersistence(PersistenceException e) {
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(body(e).build());
    }

    @ExceptionHandler(AutograderException.class)
    public ResponseEntity<ApiErrorResponse> handleAutograder(AutograderException e) {
        log.warn("API: unmapped failure [{}] {}", e.getErrorCode(), e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body(e).build());
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ApiErrorResponse> handleFileSize(MaxUploadSizeExceededException e) {
        noticeService.error("Upload is too large");
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(body("FILE_TOO_LARGE", "Upload is too large").build());
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MissingServletRequestParameterException.class,
            MissingServletRequestPartException.class})
    public ResponseEntity<ApiErrorResponse> handleMalformedRequest(Exception e) {
        log.warn("API: malformed request: {}", e.getMessage());
        noticeService.error("Request could not be read");
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(body("MALFORMED_REQUEST", "Request could not be read").build());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleGeneric(Exception e) {
        log.error("API: unexpected failure", e);
        noticeService.error("Something went wrong, please try again");
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(body("INTERNAL_ERROR", "Internal error, please try again later").build());
    }

    private ApiErrorResponse.ApiErrorResponseBuilder body(AutograderException e) {
        return body(e.getErrorCode(), e.getMessage());
    }

    private ApiErrorResponse.ApiErrorResponseBuilder body(String code, String message) {
        return ApiErrorResponse.builder()
                .code(code)
                .message(message)
                .timestamp(OffsetDateTime.now(clock));
    }
}
