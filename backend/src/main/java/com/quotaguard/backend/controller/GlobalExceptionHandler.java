package com.quotaguard.backend.controller;

import com.quotaguard.backend.dto.ApiError;
import com.quotaguard.backend.exception.AuditWriteFailureException;
import com.quotaguard.backend.exception.BizException;
import com.quotaguard.backend.exception.InvalidRetentionStateException;
import com.quotaguard.backend.exception.RestrictedDeletionException;
import com.quotaguard.backend.exception.TransientStoreConflictException;
import jakarta.persistence.EntityNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.HashMap;
import java.util.Map;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(EntityNotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(EntityNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ApiError.of("NOT_FOUND", ex.getMessage()));
    }

    @ExceptionHandler(RestrictedDeletionException.class)
    public ResponseEntity<ApiError> handleRestrictedDeletion(RestrictedDeletionException ex) {
        log.warn("[RETENTION] Purge of principal {} refused: live audit history", ex.getPrincipalId());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(ApiError.requiring(ex.getCode(), ex.getMessage(), ex.getRequiredStep()));
    }

    @ExceptionHandler(InvalidRetentionStateException.class)
    public ResponseEntity<ApiError> handleConflict(InvalidRetentionStateException ex) {
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(ApiError.of(ex.getCode(), ex.getMessage()));
    }

    @ExceptionHandler(TransientStoreConflictException.class)
    public ResponseEntity<ApiError> handleTransientConflict(TransientStoreConflictException ex) {
        log.warn("Transient store conflict after {} attempt(s): {}", ex.getAttempts(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .header(HttpHeaders.RETRY_AFTER, "1")
                .body(ApiError.of(ex.getCode(), ex.getMessage()));
    }

    @ExceptionHandler(AuditWriteFailureException.class)
    public ResponseEntity<ApiError> handleAuditWriteFailure(AuditWriteFailureException ex) {
        log.error("Change rolled back because its audit entry failed", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiError.of(ex.getCode(), "Change was not applied"));
    }

    @ExceptionHandler(BizException.class)
    public ResponseEntity<ApiError> handleBizException(BizException ex) {
        HttpStatus status = HttpStatus.BAD_REQUEST;
        if ("EMAIL_TAKEN".equals(ex.getCode())) {
            status = HttpStatus.CONFLICT;
        }
        return ResponseEntity.status(status).body(ApiError.of(ex.getCode(), ex.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, String>> handleValidationExceptions(MethodArgumentNotValidException ex) {
        Map<String, String> errors = new HashMap<>();
        ex.getBindingResult().getFieldErrors().forEach(error -> errors.put(error.getField(), error.getDefaultMessage()));
        return new ResponseEntity<>(errors, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(Exception ex) {
        log.error("Unhandled exception", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiError.of("INTERNAL_ERROR", "Internal server error"));
    }
}
