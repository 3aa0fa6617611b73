package com.lanhub.collector.intake.api;

import com.lanhub.collector.intake.service.CapacityExceededException;
import com.lanhub.collector.intake.service.InvalidSubmissionException;
import com.lanhub.collector.intake.service.PasswordRejectedException;
import com.lanhub.collector.intake.service.SlugConflictException;
import com.lanhub.collector.intake.service.TaskClosedException;
import com.lanhub.collector.intake.service.TaskNotFoundException;
import com.lanhub.collector.intake.storage.ArtifactStorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class CollectorExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(CollectorExceptionHandler.class);

    @ExceptionHandler(TaskNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleNotFound(TaskNotFoundException ex) {
        return error(HttpStatus.NOT_FOUND, "task_not_found", ex.getMessage());
    }

    @ExceptionHandler(TaskClosedException.class)
    public ResponseEntity<Map<String, String>> handleClosed(TaskClosedException ex) {
        return error(HttpStatus.FORBIDDEN, "task_closed", ex.getMessage());
    }

    @ExceptionHandler(PasswordRejectedException.class)
    public ResponseEntity<Map<String, String>> handlePassword(PasswordRejectedException ex) {
        return error(HttpStatus.UNAUTHORIZED, "password_rejected", ex.getMessage());
    }

    @ExceptionHandler({InvalidSubmissionException.class, IllegalArgumentException.class})
    public ResponseEntity<Map<String, String>> handleInvalid(RuntimeException ex) {
        return error(HttpStatus.BAD_REQUEST, "invalid_request", ex.getMessage());
    }

    @ExceptionHandler(CapacityExceededException.class)
    public ResponseEntity<Map<String, String>> handleCapacity(CapacityExceededException ex) {
        return error(HttpStatus.CONFLICT, "capacity_exceeded", ex.getMessage());
    }

    @ExceptionHandler(SlugConflictException.class)
    public ResponseEntity<Map<String, String>> handleSlugConflict(SlugConflictException ex) {
        log.error("Task slug allocation failed", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "slug_conflict", ex.getMessage());
    }

    @ExceptionHandler(ArtifactStorageException.class)
    public ResponseEntity<Map<String, String>> handleStorage(ArtifactStorageException ex) {
        log.error("Storage failure at {}", ex.getPath(), ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "storage_failure", "Failed to store the submitted file");
    }

    private ResponseEntity<Map<String, String>> error(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status)
            .body(Map.of("error", code, "message", message == null ? "" : message));
    }
}
