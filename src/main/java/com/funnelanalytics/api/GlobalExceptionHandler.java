package com.funnelanalytics.api;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.funnelanalytics.domain.exception.ErrorKind;
import com.funnelanalytics.domain.exception.FunnelAnalysisException;
import com.funnelanalytics.domain.exception.InvalidFunnelDefinitionException;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Maps errors to HTTP: 400 bad input, 404 unknown funnel, 503 analysis cancelled, 500 anything else. */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(FunnelAnalysisException.class)
    public ResponseEntity<Map<String, Object>> handleFunnelAnalysisException(FunnelAnalysisException ex) {
        HttpStatus status = statusOf(ex.getKind());
        if (status.is5xxServerError()) {
            log.warn("Funnel analysis unavailable: {}", ex.getMessage());
        } else {
            log.debug("Rejected request: {} ({})", ex.getMessage(), ex.getKind());
        }
        
        Object details = null;
        if (ex instanceof InvalidFunnelDefinitionException) {
            details = ((InvalidFunnelDefinitionException) ex).getViolations();
        }
        
        return ResponseEntity.status(status)
                .body(errorBody(status, ex.getKind().name(), ex.getMessage(), details));
    }
    
    /** @RequestBody validation errors → 400 with per-field detail. */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationErrors(MethodArgumentNotValidException ex) {
        List<Map<String, String>> fieldErrors = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> Map.of(
                        "field", error.getField(),
                        "message", error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value"
                ))
                .toList();
        
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(errorBody(HttpStatus.BAD_REQUEST, ErrorKind.INVALID_ANALYSIS_REQUEST.name(),
                        "Validation failed", fieldErrors));
    }
    
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<Map<String, Object>> handleConstraintViolation(ConstraintViolationException ex) {
        List<Map<String, String>> violations = ex.getConstraintViolations().stream()
                .map(v -> Map.of(
                        "field", v.getPropertyPath().toString(),
                        "message", v.getMessage()
                ))
                .toList();
        
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(errorBody(HttpStatus.BAD_REQUEST, ErrorKind.INVALID_ANALYSIS_REQUEST.name(),
                        "Validation failed", violations));
    }
    
    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<Map<String, Object>> handleMissingParam(MissingServletRequestParameterException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(errorBody(HttpStatus.BAD_REQUEST, ErrorKind.INVALID_ANALYSIS_REQUEST.name(),
                        "Missing required parameter: " + ex.getParameterName(), null));
    }
    
    /** Unreadable JSON body → 400. Anything wrong under "steps" is an invalid funnel definition. */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableBody(HttpMessageNotReadableException ex) {
        ErrorKind kind = ErrorKind.INVALID_ANALYSIS_REQUEST;
        String message = "Malformed request body";
        
        if (ex.getCause() instanceof JsonMappingException) {
            JsonMappingException mapping = (JsonMappingException) ex.getCause();
            String field = mapping.getPath().stream()
                    .map(JsonMappingException.Reference::getFieldName)
                    .filter(Objects::nonNull)
                    .reduce((parent, child) -> parent + "." + child)
                    .orElse(null);
            if (field != null) {
                message = "Invalid value for " + field;
            }
            if (mapping.getPath().stream().anyMatch(reference -> "steps".equals(reference.getFieldName()))) {
                kind = ErrorKind.INVALID_FUNNEL_DEFINITION;
            }
        }
        
        log.debug("Unreadable request body: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(errorBody(HttpStatus.BAD_REQUEST, kind.name(), message, null));
    }
    
    /** Path or query parameter of the wrong type (non-UUID id, unparseable date) → 400. */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, Object>> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(errorBody(HttpStatus.BAD_REQUEST, ErrorKind.INVALID_ANALYSIS_REQUEST.name(),
                        "Invalid value for parameter " + ex.getName() + ": " + ex.getValue(), null));
    }
    
    /** Unexpected errors → 500 with a generic message. */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(errorBody(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR",
                        "An unexpected error occurred", null));
    }
    
    static HttpStatus statusOf(ErrorKind kind) {
        return switch (kind) {
            case INVALID_FUNNEL_DEFINITION, UNKNOWN_SEGMENT_DIMENSION, INVALID_ANALYSIS_REQUEST -> HttpStatus.BAD_REQUEST;
            case FUNNEL_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case ANALYSIS_CANCELLED -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    }
    
    private Map<String, Object> errorBody(HttpStatus status, String kind, String message, Object details) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now().toString());
        body.put("status", status.value());
        body.put("error", status.getReasonPhrase());
        body.put("kind", kind);
        body.put("message", message);
        if (details != null) {
            body.put("details", details);
        }
        return body;
    }
}
