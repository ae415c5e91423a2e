package com.fieldservice.bookingbackend.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.HashMap;
import java.util.Map;

/**
 * Maps failures to JSON bodies of the form {error, message, ...}.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(LocationException.class)
    public ResponseEntity<Map<String, Object>> handleLocationException(LocationException ex) {
        log.debug("Location request rejected: {} {}", ex.getCode(), ex.getMessage());

        Map<String, Object> error = new HashMap<>();
        error.put("error", ex.getCode().name());
        error.put("message", ex.getMessage());
        if (ex.getEntity() != null) {
            error.put("entity", ex.getEntity());
        }
        if (ex.getField() != null) {
            error.put("field", ex.getField());
        }

        return ResponseEntity.status(ex.getCode().getHttpStatus()).body(error);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationException(MethodArgumentNotValidException ex) {
        log.debug("Validation error", ex);

        Map<String, Object> error = new HashMap<>();
        error.put("error", LocationErrorCode.VALIDATION_ERROR.name());

        Map<String, String> fieldErrors = new HashMap<>();
        ex.getBindingResult().getFieldErrors().forEach(fieldError ->
                fieldErrors.put(fieldError.getField(), fieldError.getDefaultMessage()));
        error.put("fieldErrors", fieldErrors);
        error.put("message", "Validation failed");

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, Object>> handleTypeMismatchException(MethodArgumentTypeMismatchException ex) {
        log.debug("Type mismatch error", ex);

        Map<String, Object> error = new HashMap<>();
        error.put("error", LocationErrorCode.VALIDATION_ERROR.name());
        error.put("message", "Invalid parameter type: " + ex.getName());
        error.put("field", ex.getName());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<Map<String, Object>> handleMissingParameter(MissingServletRequestParameterException ex) {
        Map<String, Object> error = new HashMap<>();
        error.put("error", LocationErrorCode.VALIDATION_ERROR.name());
        error.put("message", "Missing required parameter: " + ex.getParameterName());
        error.put("field", ex.getParameterName());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.debug("Unreadable request body", ex);

        Map<String, Object> error = new HashMap<>();
        error.put("error", LocationErrorCode.VALIDATION_ERROR.name());
        error.put("message", "Malformed request body");

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
    }

    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<Map<String, Object>> handleAccessDenied(AccessDeniedException ex) {
        Map<String, Object> error = new HashMap<>();
        error.put("error", "ACCESS_DENIED");
        error.put("message", "Access denied");

        return ResponseEntity.status(HttpStatus.FORBIDDEN).body(error);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("❌ Unexpected error", ex);

        Map<String, Object> error = new HashMap<>();
        error.put("error", "INTERNAL_ERROR");
        error.put("message", "An unexpected error occurred");

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }
}
