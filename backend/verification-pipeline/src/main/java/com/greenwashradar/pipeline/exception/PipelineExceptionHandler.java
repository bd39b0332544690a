package com.greenwashradar.pipeline.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;

/**
 * 파이프라인 API 전역 예외 핸들러
 */
@RestControllerAdvice(basePackages = "com.greenwashradar.pipeline.controller")
@Slf4j
public class PipelineExceptionHandler {

    @ExceptionHandler(DocumentNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleDocumentNotFound(DocumentNotFoundException ex) {
        log.warn("Report not found: {}", ex.getMessage());
        return respond(ex, HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(CheckpointConflictException.class)
    public ResponseEntity<Map<String, Object>> handleCheckpointConflict(CheckpointConflictException ex) {
        log.warn("Checkpoint conflict: {}", ex.getMessage());
        return respond(ex, HttpStatus.CONFLICT);
    }

    @ExceptionHandler({OracleUnavailableException.class, RateLimitedException.class})
    public ResponseEntity<Map<String, Object>> handleUnavailable(PipelineException ex) {
        log.error("Dependency unavailable: {}", ex.getMessage(), ex);
        return respond(ex, HttpStatus.SERVICE_UNAVAILABLE);
    }

    @ExceptionHandler(PipelineException.class)
    public ResponseEntity<Map<String, Object>> handlePipelineException(PipelineException ex) {
        log.error("Pipeline error: {}", ex.getMessage(), ex);
        return respond(ex, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(WebExchangeBindException ex) {
        String message = ex.getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        log.debug("Rejected request: {}", message);
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(createErrorResponse("INVALID_REQUEST", message, null, HttpStatus.BAD_REQUEST.value()));
    }

    @ExceptionHandler(RejectedExecutionException.class)
    public ResponseEntity<Map<String, Object>> handleRejected(RejectedExecutionException ex) {
        log.warn("Pipeline queue is full: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(createErrorResponse("QUEUE_FULL", "Too many analyses in progress, try again later",
                        null, HttpStatus.SERVICE_UNAVAILABLE.value()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(createErrorResponse("INTERNAL_ERROR", "An unexpected error occurred",
                        null, HttpStatus.INTERNAL_SERVER_ERROR.value()));
    }

    private ResponseEntity<Map<String, Object>> respond(PipelineException ex, HttpStatus status) {
        return ResponseEntity.status(status)
                .body(createErrorResponse(ex.getErrorCode().name(), ex.getMessage(), ex.getJobKey(), status.value()));
    }

    private Map<String, Object> createErrorResponse(String errorCode, String message, String jobKey, int status) {
        Map<String, Object> response = new HashMap<>();
        response.put("success", false);
        response.put("error", errorCode);
        response.put("message", message);
        response.put("status", status);
        response.put("timestamp", LocalDateTime.now().toString());

        if (jobKey != null) {
            response.put("jobKey", jobKey);
        }

        return response;
    }
}
