package com.example.alerthistory.controller;

import com.example.alerthistory.error.AlertHistoryException;
import com.example.alerthistory.error.ConflictException;
import com.example.alerthistory.error.NotFoundException;
import com.example.alerthistory.error.StateStoreException;
import com.example.alerthistory.error.SuppressionTimeoutException;
import com.example.alerthistory.error.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps engine errors to JSON bodies of the form {@code {error, message, field, constraint}}.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(ValidationException e) {
        return body(HttpStatus.BAD_REQUEST, e.getCode(), e.getMessage(), e.getField(), e.getConstraint());
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(NotFoundException e) {
        return body(HttpStatus.NOT_FOUND, e.getCode(), e.getMessage(), null, null);
    }

    @ExceptionHandler(ConflictException.class)
    public ResponseEntity<Map<String, Object>> handleConflict(ConflictException e) {
        return body(HttpStatus.CONFLICT, e.getCode(), e.getMessage(), null, null);
    }

    @ExceptionHandler(StateStoreException.class)
    public ResponseEntity<Map<String, Object>> handleStateStore(StateStoreException e) {
        log.error("State store error: {}", e.getMessage());
        return body(HttpStatus.SERVICE_UNAVAILABLE, e.getCode(), e.getMessage(), null, null);
    }

    @ExceptionHandler(SuppressionTimeoutException.class)
    public ResponseEntity<Map<String, Object>> handleTimeout(SuppressionTimeoutException e) {
        return body(HttpStatus.GATEWAY_TIMEOUT, e.getCode(), e.getMessage(), null, null);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException e) {
        // Validation raised while binding (e.g. an unknown matcher operator) keeps its field.
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof ValidationException ve) {
                return handleValidation(ve);
            }
        }
        return body(HttpStatus.BAD_REQUEST, "validation_error", "Malformed request body: " + e.getMostSpecificCause().getMessage(),
                "body", "readable");
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, Object>> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        return body(HttpStatus.BAD_REQUEST, "validation_error", "Invalid value for " + e.getName() + ": " + e.getValue(),
                e.getName(), "type");
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<Map<String, Object>> handleMissingParameter(MissingServletRequestParameterException e) {
        return body(HttpStatus.BAD_REQUEST, "validation_error", e.getMessage(), e.getParameterName(), "required");
    }

    @ExceptionHandler(AlertHistoryException.class)
    public ResponseEntity<Map<String, Object>> handleOther(AlertHistoryException e) {
        log.error("Unhandled engine error: {}", e.getMessage(), e);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, e.getCode(), e.getMessage(), null, null);
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String error, String message,
                                                            String field, String constraint) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("message", message);
        if (field != null) body.put("field", field);
        if (constraint != null) body.put("constraint", constraint);
        return ResponseEntity.status(status).body(body);
    }
}
