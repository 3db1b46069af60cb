package com.replifast.backend.exceptions;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST controllers.
 * Every error body carries the taxonomy kind so the UI can branch on it.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(PostedButUnrecordedException.class)
    public ResponseEntity<Map<String, Object>> handlePostedButUnrecorded(PostedButUnrecordedException ex) {
        // Already logged at ERROR by the lifecycle engine with the reconciliation marker
        return build(ex);
    }

    @ExceptionHandler(ReviewWorkflowException.class)
    public ResponseEntity<Map<String, Object>> handleWorkflowException(ReviewWorkflowException ex) {
        if (ex.getKind().getStatus().is5xxServerError()) {
            log.error("Review workflow failure [{}]: {}", ex.getKind(), ex.getMessage(), ex);
        } else {
            log.debug("Review workflow rejected [{}]: {}", ex.getKind(), ex.getMessage());
        }
        return build(ex);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return simple(ErrorKind.VALIDATION, message.isEmpty() ? "Invalid request" : message);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, Object>> handleUnreadable(Exception ex) {
        return simple(ErrorKind.VALIDATION, "Malformed request: " + ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return simple(ErrorKind.INTERNAL, "An unexpected error occurred");
    }

    private ResponseEntity<Map<String, Object>> build(ReviewWorkflowException ex) {
        Map<String, Object> response = new HashMap<>(ex.getDetails());
        response.put("error", ex.getKind().name());
        response.put("message", ex.getMessage());
        response.put("retryable", ex.isRetryable());
        response.put("timestamp", OffsetDateTime.now(ZoneOffset.UTC));
        return ResponseEntity.status(ex.getKind().getStatus()).body(response);
    }

    private ResponseEntity<Map<String, Object>> simple(ErrorKind kind, String message) {
        Map<String, Object> response = new HashMap<>();
        response.put("error", kind.name());
        response.put("message", message);
        response.put("timestamp", OffsetDateTime.now(ZoneOffset.UTC));
        HttpStatus status = kind.getStatus();
        return ResponseEntity.status(status).body(response);
    }
}
